package com.webdiag.core.analyzer;

import com.webdiag.core.Snapshots;
import com.webdiag.core.analyzer.rule.RuleOutcome;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.PageSnapshot;
import com.webdiag.core.model.Severity;
import org.junit.jupiter.api.Test;

import static com.webdiag.core.Snapshots.images;
import static org.assertj.core.api.Assertions.assertThat;

class AccessibilityAnalyzerTest {

    private static final String URL = "https://example.com/";

    private static PageSnapshot html(String lang, String body) {
        String open = lang == null ? "<html>" : "<html lang=\"" + lang + "\">";
        return Snapshots.of(URL, "<!doctype html>" + open + "<head><title>t</title></head><body>" + body + "</body></html>");
    }

    @Test
    void wellStructuredPage_scores95() {
        PageSnapshot s = html("ja",
                "<header role=\"banner\"></header><nav aria-label=\"menu\"><a href=\"/\">Home</a></nav>"
                        + "<main><h1>Title</h1><h2>Section</h2><h3>Sub</h3><h2>Next</h2>"
                        + images(2, 0)
                        + "<label for=\"q\">Search</label><input id=\"q\"><textarea aria-label=\"msg\"></textarea>"
                        + "</main>");

        CategoryResult r = new AccessibilityAnalyzer().analyze(s);

        assertThat(r.issues()).isEmpty();
        assertThat(r.score()).isEqualTo(95);
        assertThat(r.success()).containsExactly(
                "HTML要素にlang属性があります (ja)",
                "すべての画像にalt属性があります",
                "すべてのフォーム要素にlabelがあります",
                "ARIA属性が使用されています (1 roles, 2 labels)",
                "mainランドマークがあります",
                "navランドマークがあります",
                "見出しの階層構造が適切です",
                "すべてのリンクにテキストがあります");
    }

    @Test
    void barePage_reportsLangAriaAndMain_butNotNav() {
        CategoryResult r = new AccessibilityAnalyzer().analyze(html(null, "<p>hello</p>"));

        assertThat(r.score()).isZero();
        assertThat(r.issues()).containsExactly(
                "HTML要素にlang属性がありません",
                "ARIA属性が使用されていません",
                "mainランドマークがありません");
        assertThat(r.explanations()).hasSize(2);
        assertThat(r.success()).isEmpty();
    }

    @Test
    void altTiers_useTheirOwnThresholds() {
        RuleOutcome fourOfFive = AccessibilityAnalyzer.altCoverage(html("en", images(4, 1)));
        assertThat(fourOfFive.points()).isEqualTo(15);
        assertThat(fourOfFive.issue()).isEqualTo("alt属性のない画像があります (1)");

        RuleOutcome threeOfFour = AccessibilityAnalyzer.altCoverage(html("en", images(3, 1)));
        assertThat(threeOfFour.points()).isZero();
        assertThat(threeOfFour.issue()).isEqualTo("alt属性のない画像が多数あります (1/4)");

        // 9/10은 SEO에서는 최상위 등급이지만 여기서는 중간 등급
        assertThat(AccessibilityAnalyzer.altCoverage(html("en", images(9, 1))).points()).isEqualTo(15);
        assertThat(AccessibilityAnalyzer.altCoverage(html("en", "")).isSkip()).isTrue();
    }

    @Test
    void formLabels_acceptLabelForOrAriaLabel() {
        RuleOutcome partial = AccessibilityAnalyzer.formLabels(html("en",
                "<label for=\"a\">A</label><input id=\"a\">"
                        + "<input aria-label=\"b\"><select aria-label=\"c\"></select>"
                        + "<input id=\"d\"><label for=\"x\">X</label>"
                        + "<textarea aria-label=\"e\"></textarea>"
                        + "<input aria-label=\"f\"><input aria-label=\"g\"><input aria-label=\"h\"><input aria-label=\"i\">"
                        + "<input aria-label=\"j\">"));
        // 9/10 라벨
        assertThat(partial.points()).isEqualTo(10);
        assertThat(partial.issue()).isEqualTo("labelがないフォーム要素があります (9/10)");

        RuleOutcome poor = AccessibilityAnalyzer.formLabels(html("en", "<input><input><input aria-label=\"x\">"));
        assertThat(poor.points()).isZero();
        assertThat(poor.issue()).isEqualTo("labelがないフォーム要素が多数あります (1/3)");

        assertThat(AccessibilityAnalyzer.formLabels(html("en", "<p>no form</p>")).isSkip()).isTrue();
    }

    @Test
    void formLabels_seventyPercentIsLowestPartialTier() {
        RuleOutcome seven = AccessibilityAnalyzer.formLabels(html("en", controls(7, 3)));
        assertThat(seven.points()).isEqualTo(10);
        assertThat(seven.issue()).isEqualTo("labelがないフォーム要素があります (7/10)");
        assertThat(seven.severity()).isNotEqualTo(Severity.HIGH);

        RuleOutcome six = AccessibilityAnalyzer.formLabels(html("en", controls(6, 4)));
        assertThat(six.points()).isZero();
        assertThat(six.issue()).isEqualTo("labelがないフォーム要素が多数あります (6/10)");
        assertThat(six.severity()).isEqualTo(Severity.HIGH);
    }

    private static String controls(int labeled, int unlabeled) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < labeled; i++) sb.append("<input aria-label=\"c").append(i).append("\">");
        for (int i = 0; i < unlabeled; i++) sb.append("<input>");
        return sb.toString();
    }

    @Test
    void builtInRuleSet_isExposedThroughAnalyzer() {
        AccessibilityAnalyzer a = new AccessibilityAnalyzer();
        assertThat(a.rules()).hasSize(8);
        assertThat(a.maxAchievablePoints()).isEqualTo(95);
    }

    @Test
    void headingJump_inDocumentOrder_isIssue() {
        RuleOutcome jump = AccessibilityAnalyzer.headingOrder(html("en", "<h1>a</h1><h2>b</h2><h4>c</h4>"));
        assertThat(jump.points()).isZero();
        assertThat(jump.issue()).isEqualTo("見出しの階層構造に問題があります (h2 → h4)");

        // 내려가는 방향은 문제 아님
        assertThat(AccessibilityAnalyzer.headingOrder(html("en", "<h1>a</h1><h2>b</h2><h3>c</h3><h1>d</h1>")).points())
                .isEqualTo(10);
        // 문서 순서 기준: h3가 먼저 나오고 h1이 뒤에 와도 상승 점프 없음
        assertThat(AccessibilityAnalyzer.headingOrder(html("en", "<h3>a</h3><h1>b</h1>")).isSuccess()).isTrue();
        assertThat(AccessibilityAnalyzer.headingOrder(html("en", "<p>none</p>")).isSkip()).isTrue();
    }

    @Test
    void emptyLinks_areCounted_ariaLabelCountsAsText() {
        RuleOutcome o = AccessibilityAnalyzer.linkText(html("en",
                "<a href=\"/a\">A</a><a href=\"/b\"><img src=x.png></a><a href=\"/c\" aria-label=\"C\"></a><a href=\"/d\">  </a>"));
        assertThat(o.issue()).isEqualTo("テキストのないリンクがあります (2)");
        assertThat(AccessibilityAnalyzer.linkText(html("en", "")).isSkip()).isTrue();
    }

    @Test
    void diagnosticOnlyMetrics_doNotAffectScore() {
        PageSnapshot plain = html("en", "<main><p>x</p></main>");
        PageSnapshot noisy = html("en", "<main><p style=\"color:red\" tabindex=\"-1\">x</p><div tabindex=\"0\"></div></main>");

        CategoryResult a = new AccessibilityAnalyzer().analyze(plain);
        CategoryResult b = new AccessibilityAnalyzer().analyze(noisy);

        assertThat(b.score()).isEqualTo(a.score());
        assertThat(b.metrics()).containsEntry("negative_tabindex_count", 1).containsEntry("inline_style_count", 1);
    }
}
