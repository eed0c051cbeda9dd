package com.webdiag.core.analyzer;

import com.webdiag.core.analyzer.rule.Rule;
import com.webdiag.core.analyzer.rule.RuleOutcome;
import com.webdiag.core.analyzer.rule.Rules;
import com.webdiag.core.localize.FindingCatalog;
import com.webdiag.core.model.Category;
import com.webdiag.core.model.PageDocument;
import com.webdiag.core.model.PageSnapshot;
import com.webdiag.core.model.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 접근성 분석기: lang(15) / alt(20) / 폼 label(15) / ARIA(10) / main(10) / nav(5)
 * / 제목 계층(10) / 링크 텍스트(10).
 * alt 비율은 SEO와 따로 계산한다(등급 기준이 다름).
 */
public final class AccessibilityAnalyzer extends AbstractRuleAnalyzer {

    public AccessibilityAnalyzer() {
        this(FindingCatalog.defaultCatalog());
    }

    public AccessibilityAnalyzer(FindingCatalog catalog) {
        super(Category.ACCESSIBILITY, ruleSet(), catalog);
    }

    private static List<Rule> ruleSet() {
        return List.of(
                Rules.of("accessibility.lang", 15, AccessibilityAnalyzer::lang),
                Rules.of("accessibility.alt", 20, AccessibilityAnalyzer::altCoverage),
                Rules.of("accessibility.form-labels", 15, AccessibilityAnalyzer::formLabels),
                Rules.of("accessibility.aria", 10, AccessibilityAnalyzer::aria),
                Rules.of("accessibility.main", 10, s -> s.getDocument().landmarkCount("main") > 0
                        ? RuleOutcome.pass(10, "mainランドマークがあります")
                        : RuleOutcome.fail("mainランドマークがありません").withExplanation("accessibility.main_landmark")),
                Rules.of("accessibility.nav", 5, s -> s.getDocument().landmarkCount("nav") > 0
                        ? RuleOutcome.pass(5, "navランドマークがあります")
                        : RuleOutcome.skip()),
                Rules.of("accessibility.heading-order", 10, AccessibilityAnalyzer::headingOrder),
                Rules.of("accessibility.link-text", 10, AccessibilityAnalyzer::linkText));
    }

    static RuleOutcome lang(PageSnapshot s) {
        String lang = s.getDocument().getLang();
        if (lang != null && !lang.isEmpty()) {
            return RuleOutcome.pass(15, "HTML要素にlang属性があります (" + lang + ")");
        }
        return RuleOutcome.fail("HTML要素にlang属性がありません").withExplanation("accessibility.lang");
    }

    /** 전부 → 20, 80% 이상 → 15 + 이슈, 그 미만 → 이슈. 이미지가 없으면 평가 안 함. */
    static RuleOutcome altCoverage(PageSnapshot s) {
        List<PageDocument.ImageRef> images = s.getDocument().getImages();
        int total = images.size();
        if (total == 0) return RuleOutcome.skip();
        int missing = (int) images.stream().filter(i -> !i.hasAlt()).count();
        if (missing == 0) return RuleOutcome.pass(20, "すべての画像にalt属性があります");
        if ((total - missing) * 10 >= total * 8) {
            return RuleOutcome.partial(15, "alt属性のない画像があります (" + missing + ")");
        }
        return RuleOutcome.fail("alt属性のない画像が多数あります (" + missing + "/" + total + ")")
                .withSeverity(Severity.HIGH);
    }

    /** id + label[for] 또는 aria-label이 있으면 label 있음 */
    static RuleOutcome formLabels(PageSnapshot s) {
        PageDocument doc = s.getDocument();
        int total = doc.getFormControls().size();
        if (total == 0) return RuleOutcome.skip();
        int labeled = labeledControls(doc);
        if (labeled == total) return RuleOutcome.pass(15, "すべてのフォーム要素にlabelがあります");
        String ratio = " (" + labeled + "/" + total + ")";
        if (labeled * 10 >= total * 7) return RuleOutcome.partial(10, "labelがないフォーム要素があります" + ratio);
        return RuleOutcome.fail("labelがないフォーム要素が多数あります" + ratio).withSeverity(Severity.HIGH);
    }

    static int labeledControls(PageDocument doc) {
        int n = 0;
        for (PageDocument.FormControl c : doc.getFormControls()) {
            boolean byLabel = c.id() != null && !c.id().isEmpty() && doc.getLabelTargets().contains(c.id());
            boolean byAria = c.ariaLabel() != null && !c.ariaLabel().isEmpty();
            if (byLabel || byAria) n++;
        }
        return n;
    }

    static RuleOutcome aria(PageSnapshot s) {
        PageDocument doc = s.getDocument();
        int roles = doc.getRoleElementCount();
        int labels = doc.getAriaLabelElementCount();
        if (roles > 0 || labels > 0) {
            return RuleOutcome.pass(10, "ARIA属性が使用されています (" + roles + " roles, " + labels + " labels)");
        }
        return RuleOutcome.fail("ARIA属性が使用されていません").withSeverity(Severity.LOW);
    }

    /** 문서 순서에서 다음 제목 레벨이 +2 이상 뛰면 문제. 내려가는 건 자유. */
    static RuleOutcome headingOrder(PageSnapshot s) {
        List<PageDocument.Heading> hs = s.getDocument().getHeadings();
        if (hs.isEmpty()) return RuleOutcome.skip();
        for (int i = 0; i + 1 < hs.size(); i++) {
            int from = hs.get(i).level();
            int to = hs.get(i + 1).level();
            if (to - from > 1) {
                return RuleOutcome.fail("見出しの階層構造に問題があります (h" + from + " → h" + to + ")");
            }
        }
        return RuleOutcome.pass(10, "見出しの階層構造が適切です");
    }

    static RuleOutcome linkText(PageSnapshot s) {
        List<PageDocument.LinkRef> links = s.getDocument().getLinks();
        if (links.isEmpty()) return RuleOutcome.skip();
        long empty = emptyLinks(s.getDocument());
        if (empty == 0) return RuleOutcome.pass(10, "すべてのリンクにテキストがあります");
        return RuleOutcome.fail("テキストのないリンクがあります (" + empty + ")");
    }

    private static long emptyLinks(PageDocument doc) {
        return doc.getLinks().stream().filter(l -> !l.hasAccessibleName()).count();
    }

    @Override
    protected Map<String, Object> metrics(PageSnapshot s) {
        PageDocument doc = s.getDocument();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("lang_attribute", doc.getLang());
        m.put("images_without_alt_count", doc.getImages().stream().filter(i -> !i.hasAlt()).count());
        m.put("form_inputs_count", doc.getFormControls().size());
        m.put("inputs_with_labels", labeledControls(doc));
        m.put("aria_roles_count", doc.getRoleElementCount());
        m.put("aria_labels_count", doc.getAriaLabelElementCount());
        Map<String, Integer> landmarks = new LinkedHashMap<>();
        for (String tag : PageDocument.LANDMARK_TAGS) landmarks.put(tag, doc.landmarkCount(tag));
        m.put("landmarks", landmarks);
        m.put("empty_links_count", emptyLinks(doc));
        // 점수와 무관한 진단 전용 값
        m.put("negative_tabindex_count", doc.getNegativeTabindexCount());
        m.put("inline_style_count", doc.getInlineStyleCount());
        return m;
    }
}
