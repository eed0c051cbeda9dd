package com.webdiag.core.analyzer;

import com.webdiag.core.Snapshots;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.IssueExplanation;
import com.webdiag.core.model.TlsCertificateInfo;
import com.webdiag.core.tls.TlsCertificateInspector;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.webdiag.core.Snapshots.page;
import static org.assertj.core.api.Assertions.assertThat;

class SecurityAnalyzerTest {

    private static final TlsCertificateInfo CERT = new TlsCertificateInfo(
            "CN=example.com", "CN=Test CA",
            Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2027-01-01T00:00:00Z"), "TLSv1.3");

    private static final TlsCertificateInspector VALID_TLS = (host, port) -> CERT;

    @Test
    void httpsWithoutHeaders_andValidTls_scores30() {
        CategoryResult r = new SecurityAnalyzer(VALID_TLS).analyze(Snapshots.of("https://example.com/", page("", "")));

        assertThat(r.score()).isEqualTo(30);
        assertThat(r.issues()).hasSize(7)
                .allMatch(i -> i.endsWith("ヘッダーが設定されていません"));
        assertThat(r.success()).containsExactly(
                "HTTPSが使用されています",
                "SSL証明書が有効です (subject: CN=example.com, issuer: CN=Test CA, 2025-01-01 ~ 2027-01-01)");
        assertThat(r.explanations()).extracting(IssueExplanation::issue).containsExactly(
                "Strict-Transport-Securityヘッダーが設定されていません",
                "X-Frame-Optionsヘッダーが設定されていません",
                "Content-Security-Policyヘッダーが設定されていません");
        assertThat(r.criticalIssues()).isEmpty();
        assertThat(r.metrics()).containsKey("ssl_certificate");
    }

    @Test
    void httpsWithAllHeaders_scores100() {
        Map<String, String> headers = new LinkedHashMap<>();
        for (SecurityAnalyzer.SecurityHeader h : SecurityAnalyzer.SecurityHeader.values()) {
            headers.put(h.headerName().toLowerCase(), "x"); // 대소문자 무시 조회
        }
        CategoryResult r = new SecurityAnalyzer(VALID_TLS)
                .analyze(Snapshots.of("https://example.com/", page("", ""), headers));

        assertThat(r.score()).isEqualTo(100);
        assertThat(r.issues()).isEmpty();
    }

    @Test
    void headerPoints_matchTheirWeights() {
        CategoryResult r = new SecurityAnalyzer(VALID_TLS).analyze(Snapshots.of("https://example.com/", page("", ""),
                Map.of("Content-Security-Policy", "default-src 'self'", "X-XSS-Protection", "1")));
        assertThat(r.score()).isEqualTo(30 + 20 + 5);
        assertThat(r.issues()).hasSize(5);
    }

    @Test
    void plainHttp_isCritical_andSkipsTlsCheck() {
        AtomicInteger calls = new AtomicInteger();
        TlsCertificateInspector tls = (host, port) -> { calls.incrementAndGet(); return CERT; };

        CategoryResult r = new SecurityAnalyzer(tls)
                .analyze(Snapshots.of("http://example.com/", page("", ""), Map.of("X-Frame-Options", "DENY")));

        assertThat(calls.get()).isZero();
        assertThat(r.score()).isEqualTo(10);
        assertThat(r.issues().get(0)).isEqualTo("HTTPSが有効になっていません (セキュリティリスク)");
        assertThat(r.criticalIssues()).containsExactly("HTTPSが有効になっていません (セキュリティリスク)");
        assertThat(r.explanations().get(0).explanation().hasRisk()).isTrue();
    }

    @Test
    void tlsFailure_isAbsorbedAsIssue_withoutChangingScore() {
        TlsCertificateInspector failing = (host, port) -> { throw new SocketTimeoutException("connect timed out"); };

        CategoryResult r = new SecurityAnalyzer(failing).analyze(Snapshots.of("https://example.com/", page("", "")));

        assertThat(r.score()).isEqualTo(30);
        assertThat(r.issues()).hasSize(8)
                .last().isEqualTo("SSL証明書の確認に失敗しました: connect timed out");
        assertThat(r.metrics()).containsEntry("ssl_certificate", null);
    }

    @Test
    void tlsRuntimeFailure_isAlsoAbsorbed() {
        TlsCertificateInspector broken = (host, port) -> { throw new IllegalStateException(); };

        CategoryResult r = new SecurityAnalyzer(broken).analyze(Snapshots.of("https://example.com/", page("", "")));

        assertThat(r.issues()).last().isEqualTo("SSL証明書の確認に失敗しました: IllegalStateException");
    }

    @Test
    void tlsCheck_usesSnapshotHostOnPort443() {
        String[] seen = new String[1];
        int[] port = new int[1];
        TlsCertificateInspector tls = (host, p) -> { seen[0] = host; port[0] = p; return CERT; };

        new SecurityAnalyzer(tls).analyze(Snapshots.of("https://shop.example.com:8443/x", page("", "")));

        assertThat(seen[0]).isEqualTo("shop.example.com");
        assertThat(port[0]).isEqualTo(443);
    }

    @Test
    void maxAchievablePoints_is_100() {
        assertThat(new SecurityAnalyzer(VALID_TLS).maxAchievablePoints()).isEqualTo(100);
    }
}
