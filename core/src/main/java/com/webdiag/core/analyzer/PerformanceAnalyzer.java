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
import java.util.Set;

/** 성능 분석기: 응답 시간(30) / 크기(20) / 리소스 수(15) / 압축(15) / Cache-Control(10) */
public final class PerformanceAnalyzer extends AbstractRuleAnalyzer {

    static final long KIB = 1024;
    static final long MIB = 1024 * 1024;
    static final Set<String> COMPRESSION = Set.of("gzip", "br", "deflate");

    public PerformanceAnalyzer() {
        this(FindingCatalog.defaultCatalog());
    }

    public PerformanceAnalyzer(FindingCatalog catalog) {
        super(Category.PERFORMANCE, ruleSet(), catalog);
    }

    private static List<Rule> ruleSet() {
        return List.of(
                Rules.of("performance.load-time", 30, PerformanceAnalyzer::loadTime),
                Rules.of("performance.page-size", 20, PerformanceAnalyzer::pageSize),
                Rules.of("performance.resources", 15, PerformanceAnalyzer::resources),
                Rules.of("performance.compression", 15, PerformanceAnalyzer::compression),
                Rules.of("performance.cache-control", 10, s -> s.hasHeader("Cache-Control")
                        ? RuleOutcome.pass(10, "Cache-Controlが設定されています")
                        : RuleOutcome.fail("Cache-Controlヘッダーが設定されていません").withSeverity(Severity.LOW)));
    }

    static RuleOutcome loadTime(PageSnapshot s) {
        double t = s.getFetchSeconds();
        String sec = " (" + Fmt.round(t, 2) + "s)";
        if (t < 1) return RuleOutcome.pass(30, "ページの読み込みが高速です" + sec);
        if (t < 2) return RuleOutcome.partial(20, "ページの読み込みがやや遅いです" + sec).withExplanation("performance.load_time");
        if (t < 3) return RuleOutcome.partial(10, "ページの読み込みが遅いです" + sec).withExplanation("performance.load_time");
        return RuleOutcome.fail("ページの読み込みが非常に遅いです" + sec)
                .withExplanation("performance.load_time").withSeverity(Severity.HIGH);
    }

    static RuleOutcome pageSize(PageSnapshot s) {
        long b = s.getByteSize();
        if (b < 500 * KIB) return RuleOutcome.pass(20, "ページサイズが適切です (" + kb(b) + ")");
        if (b < MIB) return RuleOutcome.partial(15, "ページサイズがやや大きいです (" + kb(b) + ")").withExplanation("performance.page_size");
        if (b < 3 * MIB) return RuleOutcome.partial(5, "ページサイズが大きいです (" + mb(b) + ")").withExplanation("performance.page_size");
        return RuleOutcome.fail("ページサイズが非常に大きいです (" + mb(b) + ")")
                .withExplanation("performance.page_size").withSeverity(Severity.HIGH);
    }

    static RuleOutcome resources(PageSnapshot s) {
        int n = s.getDocument().totalResourceCount();
        if (n < 30) return RuleOutcome.pass(15, "リソース数が適切です (" + n + ")");
        if (n < 50) return RuleOutcome.pass(10, "リソース数がやや多めです (" + n + ")");
        return RuleOutcome.fail("リソース数が多すぎます (合計: " + n + ")");
    }

    static RuleOutcome compression(PageSnapshot s) {
        String enc = s.header("Content-Encoding");
        if (enc != null && COMPRESSION.contains(enc)) {
            return RuleOutcome.pass(15, "コンテンツ圧縮が有効です (" + enc + ")");
        }
        return RuleOutcome.fail("コンテンツ圧縮が有効になっていません").withExplanation("performance.compression");
    }

    private static String kb(long bytes) { return Fmt.round(bytes / (double) KIB, 2) + "KB"; }
    private static String mb(long bytes) { return Fmt.round(bytes / (double) MIB, 2) + "MB"; }

    @Override
    protected Map<String, Object> metrics(PageSnapshot s) {
        PageDocument doc = s.getDocument();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("final_url", s.getFinalUrl().toString());
        m.put("retries", s.getRetries());
        m.put("load_time", Fmt.roundToDouble(s.getFetchSeconds(), 3));
        m.put("page_size_bytes", s.getByteSize());
        m.put("page_size_kb", Fmt.roundToDouble(s.getByteSize() / (double) KIB, 2));
        Map<String, Integer> res = new LinkedHashMap<>();
        res.put("scripts", doc.getScriptCount());
        res.put("stylesheets", doc.getStylesheetCount());
        res.put("images", doc.getImages().size());
        res.put("iframes", doc.getIframeCount());
        m.put("resources", res);
        m.put("compression", s.header("Content-Encoding"));
        m.put("cache_control", s.header("Cache-Control"));
        return m;
    }
}
