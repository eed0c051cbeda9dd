package com.webdiag.core.analyzer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * SEO 분석기.
 * title(15) / meta description(15) / H1(10) / H2(5) / alt 비율(15) / OG(10) / Twitter(5)
 * / canonical(5) / 내부 링크(5) / JSON-LD(10)
 */
public final class SeoAnalyzer extends AbstractRuleAnalyzer {

    static final int TITLE_MIN = 30, TITLE_MAX = 60;
    static final int DESC_MIN = 120, DESC_MAX = 160;

    private static final ObjectMapper JSON = new ObjectMapper();

    public SeoAnalyzer() {
        this(FindingCatalog.defaultCatalog());
    }

    public SeoAnalyzer(FindingCatalog catalog) {
        super(Category.SEO, ruleSet(), catalog);
    }

    private static List<Rule> ruleSet() {
        return List.of(
                Rules.of("seo.title", 15, SeoAnalyzer::title),
                Rules.of("seo.meta-description", 15, SeoAnalyzer::metaDescription),
                Rules.of("seo.h1", 10, SeoAnalyzer::h1),
                Rules.of("seo.h2", 5, SeoAnalyzer::h2),
                Rules.of("seo.alt", 15, SeoAnalyzer::altCoverage),
                Rules.of("seo.open-graph", 10, s -> presence(!s.getDocument().openGraph().isEmpty(), 10,
                        "Open Graphタグが設定されています", "Open Graphタグが設定されていません")),
                Rules.of("seo.twitter-card", 5, s -> presence(!s.getDocument().twitterCard().isEmpty(), 5,
                        "Twitter Cardタグが設定されています", "Twitter Cardタグが設定されていません")),
                Rules.of("seo.canonical", 5, s -> presence(s.getDocument().getCanonicalHref() != null, 5,
                        "canonicalタグが設定されています", "canonicalタグが設定されていません")),
                Rules.of("seo.internal-links", 5, SeoAnalyzer::internalLinks),
                Rules.of("seo.structured-data", 10, SeoAnalyzer::structuredData));
    }

    static RuleOutcome title(PageSnapshot s) {
        String t = s.getDocument().getTitle();
        if (t == null) {
            return RuleOutcome.fail("titleタグが見つかりません").withExplanation("seo.title").withSeverity(Severity.HIGH);
        }
        int len = t.strip().length();
        if (len >= TITLE_MIN && len <= TITLE_MAX) {
            return RuleOutcome.pass(15, "titleタグが設定されています (" + len + " chars)");
        }
        return RuleOutcome.fail("titleタグの長さが最適ではありません (" + len + " chars, " + TITLE_MIN + "-" + TITLE_MAX + ")")
                .withExplanation("seo.title");
    }

    static RuleOutcome metaDescription(PageSnapshot s) {
        String d = s.getDocument().metaDescription();
        if (d == null) {
            return RuleOutcome.fail("meta descriptionが見つかりません").withExplanation("seo.meta_description");
        }
        int len = d.length();
        if (len >= DESC_MIN && len <= DESC_MAX) {
            return RuleOutcome.pass(15, "meta descriptionが設定されています (" + len + " chars)");
        }
        return RuleOutcome.fail("meta descriptionの長さが最適ではありません (" + len + " chars, " + DESC_MIN + "-" + DESC_MAX + ")")
                .withExplanation("seo.meta_description");
    }

    static RuleOutcome h1(PageSnapshot s) {
        int n = s.getDocument().headingTexts(1).size();
        if (n == 1) return RuleOutcome.pass(10, "H1タグが1つだけあります");
        if (n == 0) return RuleOutcome.fail("H1タグが見つかりません").withExplanation("seo.h1").withSeverity(Severity.HIGH);
        return RuleOutcome.fail("H1タグが複数あります (" + n + ")").withExplanation("seo.h1");
    }

    static RuleOutcome h2(PageSnapshot s) {
        int n = s.getDocument().headingTexts(2).size();
        return n > 0
                ? RuleOutcome.pass(5, "H2タグがあります (" + n + ")")
                : RuleOutcome.fail("H2タグが見つかりません").withSeverity(Severity.LOW);
    }

    /** alt 비율: ≥0.9 → 15, 0.7~0.9 → 10 + 이슈, 그 미만 → 이슈. 이미지가 없으면 평가 안 함. */
    static RuleOutcome altCoverage(PageSnapshot s) {
        List<PageDocument.ImageRef> images = s.getDocument().getImages();
        int total = images.size();
        if (total == 0) return RuleOutcome.skip();
        int withAlt = (int) images.stream().filter(PageDocument.ImageRef::hasAlt).count();
        String ratio = " (" + withAlt + "/" + total + ")";
        // 정수 비교로 9/10 == 0.9 경계를 정확히
        if (withAlt * 10 >= total * 9) {
            return RuleOutcome.pass(15, "ほとんどの画像にalt属性があります" + ratio);
        }
        if (withAlt * 10 >= total * 7) {
            return RuleOutcome.partial(10, "alt属性のない画像があります" + ratio).withExplanation("seo.alt");
        }
        return RuleOutcome.fail("alt属性のない画像が多数あります" + ratio).withExplanation("seo.alt");
    }

    static RuleOutcome internalLinks(PageSnapshot s) {
        int n = countLinks(s)[0];
        return n > 0
                ? RuleOutcome.pass(5, "内部リンクがあります (" + n + ")")
                : RuleOutcome.fail("内部リンクが見つかりません").withSeverity(Severity.LOW);
    }

    static RuleOutcome structuredData(PageSnapshot s) {
        int n = parseableJsonLd(s.getDocument());
        return n > 0
                ? RuleOutcome.pass(10, "構造化データがあります (" + n + ")")
                : RuleOutcome.fail("構造化データが見つかりません").withSeverity(Severity.LOW);
    }

    private static RuleOutcome presence(boolean present, int points, String ok, String missing) {
        return present ? RuleOutcome.pass(points, ok) : RuleOutcome.fail(missing).withSeverity(Severity.LOW);
    }

    /**
     * [internal, external]. 절대 URL은 도메인 문자열을 포함하면 내부,
     * "/"로 시작하는 상대 경로는 내부. 그 밖(#, mailto:, 상대 파일명)은 세지 않는다.
     */
    static int[] countLinks(PageSnapshot s) {
        String domain = s.getDomain();
        int internal = 0, external = 0;
        for (PageDocument.LinkRef l : s.getDocument().getLinks()) {
            String href = l.href();
            if (href == null) continue;
            if (href.startsWith("http")) {
                if (!domain.isEmpty() && href.contains(domain)) internal++;
                else external++;
            } else if (href.startsWith("/")) {
                internal++;
            }
        }
        return new int[]{internal, external};
    }

    static int parseableJsonLd(PageDocument doc) {
        int n = 0;
        for (String body : doc.getJsonLdBlocks()) {
            try {
                JsonNode node = JSON.readTree(body);
                if (node != null && !node.isMissingNode()) n++;
            } catch (JsonProcessingException e) {
                // 깨진 블록은 구조화 데이터로 치지 않음
            }
        }
        return n;
    }

    @Override
    protected Map<String, Object> metrics(PageSnapshot s) {
        PageDocument doc = s.getDocument();
        Map<String, Object> m = new LinkedHashMap<>();
        String title = doc.getTitle() == null ? null : doc.getTitle().strip();
        m.put("title", title);
        m.put("title_length", title == null ? null : title.length());
        String desc = doc.metaDescription();
        m.put("meta_description", desc);
        m.put("meta_description_length", desc == null ? null : desc.length());
        Map<String, List<String>> headings = new LinkedHashMap<>();
        for (int i = 1; i <= 6; i++) headings.put("h" + i, doc.headingTexts(i));
        m.put("headings", headings);
        m.put("total_images", doc.getImages().size());
        m.put("images_with_alt", doc.getImages().stream().filter(PageDocument.ImageRef::hasAlt).count());
        m.put("open_graph", doc.openGraph());
        m.put("twitter_card", doc.twitterCard());
        m.put("canonical", doc.getCanonicalHref());
        int[] links = countLinks(s);
        m.put("internal_links_count", links[0]);
        m.put("external_links_count", links[1]);
        m.put("structured_data_count", parseableJsonLd(doc));
        return m;
    }
}
