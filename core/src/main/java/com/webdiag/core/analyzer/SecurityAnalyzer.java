package com.webdiag.core.analyzer;

import com.webdiag.core.analyzer.rule.Rule;
import com.webdiag.core.analyzer.rule.RuleOutcome;
import com.webdiag.core.analyzer.rule.Rules;
import com.webdiag.core.localize.FindingCatalog;
import com.webdiag.core.model.Category;
import com.webdiag.core.model.PageSnapshot;
import com.webdiag.core.model.Severity;
import com.webdiag.core.model.TlsCertificateInfo;
import com.webdiag.core.tls.TlsCertificateInspector;
import com.webdiag.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 보안 분석기: HTTPS(30) + 보안 헤더 7종 + TLS 인증서 확인(점수 없음).
 * TLS 확인 실패는 여기서 흡수되어 이슈로만 남는다.
 */
public final class SecurityAnalyzer extends AbstractRuleAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(SecurityAnalyzer.class);
    private static final StructuredLog SLOG = StructuredLog.get(SecurityAnalyzer.class);

    static final int HTTPS_POINTS = 30;
    static final int TLS_PORT = 443;

    /** 검사 대상 헤더 (순서 = 결과 순서) */
    public enum SecurityHeader {
        STRICT_TRANSPORT_SECURITY("Strict-Transport-Security", 15, "security.strict_transport_security", Severity.HIGH),
        X_FRAME_OPTIONS("X-Frame-Options", 10, "security.x_frame_options", Severity.HIGH),
        X_CONTENT_TYPE_OPTIONS("X-Content-Type-Options", 10, null, Severity.MEDIUM),
        X_XSS_PROTECTION("X-XSS-Protection", 5, null, Severity.LOW),
        CONTENT_SECURITY_POLICY("Content-Security-Policy", 20, "security.content_security_policy", Severity.HIGH),
        REFERRER_POLICY("Referrer-Policy", 5, null, Severity.LOW),
        PERMISSIONS_POLICY("Permissions-Policy", 5, null, Severity.LOW);

        private final String headerName;
        private final int points;
        private final String explanationKey;
        private final Severity severity;

        SecurityHeader(String headerName, int points, String explanationKey, Severity severity) {
            this.headerName = headerName;
            this.points = points;
            this.explanationKey = explanationKey;
            this.severity = severity;
        }

        public String headerName() { return headerName; }
        public int points() { return points; }
    }

    public SecurityAnalyzer(TlsCertificateInspector tls) {
        this(tls, FindingCatalog.defaultCatalog());
    }

    public SecurityAnalyzer(TlsCertificateInspector tls, FindingCatalog catalog) {
        super(Category.SECURITY, ruleSet(Objects.requireNonNull(tls, "tls")), catalog);
    }

    private static List<Rule> ruleSet(TlsCertificateInspector tls) {
        List<Rule> rules = new ArrayList<>();
        rules.add(Rules.of("security.https", HTTPS_POINTS, s -> s.isHttps()
                ? RuleOutcome.pass(HTTPS_POINTS, "HTTPSが使用されています")
                : RuleOutcome.fail("HTTPSが有効になっていません (セキュリティリスク)")
                        .withExplanation("security.https")
                        .withSeverity(Severity.CRITICAL)));
        for (SecurityHeader h : SecurityHeader.values()) {
            rules.add(Rules.of("security.header." + h.headerName().toLowerCase(Locale.ROOT), h.points(),
                    s -> header(s, h)));
        }
        rules.add(Rules.of("security.tls-certificate", 0, s -> tlsCertificate(s, tls)));
        return rules;
    }

    static RuleOutcome header(PageSnapshot s, SecurityHeader h) {
        if (s.hasHeader(h.headerName())) {
            return RuleOutcome.pass(h.points(), h.headerName() + "ヘッダーが設定されています");
        }
        return RuleOutcome.fail(h.headerName() + "ヘッダーが設定されていません")
                .withExplanation(h.explanationKey)
                .withSeverity(h.severity);
    }

    static RuleOutcome tlsCertificate(PageSnapshot s, TlsCertificateInspector tls) {
        if (!s.isHttps()) return RuleOutcome.skip();
        String host = s.getDomain();
        try {
            TlsCertificateInfo cert = tls.inspect(host, TLS_PORT);
            return RuleOutcome.pass(0, "SSL証明書が有効です (subject: " + cert.subject()
                            + ", issuer: " + cert.issuer()
                            + ", " + utcDate(cert.validFrom()) + " ~ " + utcDate(cert.validUntil()) + ")")
                    .withMetric("ssl_certificate", certificateMetric(cert));
        } catch (Exception e) {
            // 네트워크/핸드셰이크/DNS/런타임 오류 모두 하위 검사 실패로 흡수
            String msg = (e.getMessage() == null || e.getMessage().isBlank())
                    ? e.getClass().getSimpleName() : e.getMessage();
            LOG.warn("TLS check failed for {}: {}", host, msg);
            SLOG.warn("tls-check-failed", "host", host, "error", e.getClass().getSimpleName());
            return RuleOutcome.fail("SSL証明書の確認に失敗しました: " + msg)
                    .withSeverity(Severity.HIGH)
                    .withMetric("ssl_certificate", null);
        }
    }

    private static String utcDate(Instant t) {
        return t.atOffset(ZoneOffset.UTC).toLocalDate().toString();
    }

    private static Map<String, Object> certificateMetric(TlsCertificateInfo c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("issued_to", c.subject());
        m.put("issued_by", c.issuer());
        m.put("valid_from", c.validFrom().toString());
        m.put("valid_until", c.validUntil().toString());
        m.put("protocol", c.protocol());
        return m;
    }

    @Override
    protected Map<String, Object> metrics(PageSnapshot s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("https", s.isHttps());
        Map<String, String> headers = new LinkedHashMap<>();
        for (SecurityHeader h : SecurityHeader.values()) headers.put(h.headerName(), s.header(h.headerName()));
        m.put("security_headers", headers);
        return m;
    }
}
