package com.webdiag.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.webdiag.core.model.Category;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.DiagnosisResult;
import com.webdiag.core.model.Explanation;
import com.webdiag.core.model.IssueExplanation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonDiagnosisExporterTest {

    @TempDir
    Path tmp;

    static DiagnosisResult sample() {
        Map<String, Object> secMetrics = new LinkedHashMap<>();
        secMetrics.put("https", true);
        secMetrics.put("ssl_certificate", null);
        Explanation https = new Explanation("HTTPSとは", "重要", "設定する", "高");
        return DiagnosisResult.builder()
                .url("https://example.com/")
                .timestamp(OffsetDateTime.of(2026, 3, 1, 9, 30, 15, 0, ZoneOffset.UTC))
                .overallScore(65.9)
                .category(new CategoryResult(Category.SEO, 85,
                        List.of("H2タグが見つかりません"), List.of("titleタグが設定されています"),
                        List.of(), List.of(), Map.of("title", "Example")))
                .category(new CategoryResult(Category.SECURITY, 30,
                        List.of("HTTPSが有効になっていません (セキュリティリスク)"), List.of(),
                        List.of(new IssueExplanation("HTTPSが有効になっていません (セキュリティリスク)", https)),
                        List.of("HTTPSが有効になっていません (セキュリティリスク)"), secMetrics))
                .category(new CategoryResult(Category.PERFORMANCE, 90, List.of(), List.of(), List.of(), List.of(), Map.of()))
                .category(new CategoryResult(Category.ACCESSIBILITY, 67, List.of(), List.of(), List.of(), List.of(), Map.of()))
                .build();
    }

    @Test
    void export_writesUnderHostDirectory_withTimestampedName() throws Exception {
        Path out = new JsonDiagnosisExporter().export(tmp, sample());

        assertThat(out).isEqualTo(tmp.resolve("reports").resolve("example.com")
                .resolve("diagnosis_result_20260301_093015.json"));
        assertThat(out).exists();
    }

    @Test
    void export_keepsJapaneseText_andIsoTimestamp() throws Exception {
        Path out = new JsonDiagnosisExporter().export(tmp, sample());
        String json = Files.readString(out, StandardCharsets.UTF_8);

        assertThat(json).contains("HTTPSが有効になっていません (セキュリティリスク)");
        assertThat(json).contains("\"2026-03-01T09:30:15Z\"");
        assertThat(json).doesNotContain("\\u");
    }

    @Test
    void exportedTree_hasCategoryBlocksAndScores() throws Exception {
        JsonDiagnosisExporter exporter = new JsonDiagnosisExporter();
        JsonNode root = exporter.read(exporter.export(tmp, sample()));

        assertThat(root.path("url").asText()).isEqualTo("https://example.com/");
        assertThat(root.path("overallScore").asDouble()).isEqualTo(65.9);
        assertThat(root.path("scores").path("security").asInt()).isEqualTo(30);
        assertThat(root.has("categoryResults")).isFalse();

        JsonNode sec = root.path("security");
        assertThat(sec.path("category").asText()).isEqualTo("security");
        assertThat(sec.path("criticalIssues")).hasSize(1);
        assertThat(sec.path("explanations").get(0).path("explanation").path("risk").asText()).isEqualTo("高");
        assertThat(sec.path("metrics").has("ssl_certificate")).isTrue();
        assertThat(sec.path("metrics").path("ssl_certificate").isNull()).isTrue();

        JsonNode seo = root.path("seo");
        assertThat(seo.path("success").get(0).asText()).isEqualTo("titleタグが設定されています");
    }

    @Test
    void explanationWithoutRisk_omitsRiskField() throws Exception {
        DiagnosisResult base = sample();
        Explanation noRisk = new Explanation("w", "y", "h", null);
        DiagnosisResult r = DiagnosisResult.builder()
                .url(base.getUrl()).timestamp(base.getTimestamp()).overallScore(base.getOverallScore())
                .category(new CategoryResult(Category.SEO, 80, List.of("H1タグが見つかりません"), List.of(),
                        List.of(new IssueExplanation("H1タグが見つかりません", noRisk)), List.of(), Map.of()))
                .category(base.getSecurity()).category(base.getPerformance()).category(base.getAccessibility())
                .build();

        String json = new JsonDiagnosisExporter().toJson(r);

        assertThat(json).contains("\"what\" : \"w\"").doesNotContain("\"risk\"  : null").doesNotContain("\"risk\" : null");
    }

    @Test
    void reportNaming_sanitizesHosts() {
        assertThat(ReportNaming.hostDir("https://Example.COM:8443/x")).isEqualTo("example.com");
        assertThat(ReportNaming.hostDir("not a url")).isEqualTo("unknown-host");
        assertThat(ReportNaming.hostDir("https://my_host.example.com:8443/x")).isEqualTo("my_host.example.com");
        assertThat(ReportNaming.hostDir(null)).isEqualTo("unknown-host");
        assertThat(ReportNaming.reportsDir(null, "https://a.test/")).isEqualTo(Path.of("out", "reports", "a.test"));
    }
}
