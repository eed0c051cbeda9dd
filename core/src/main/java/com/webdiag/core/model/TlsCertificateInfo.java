package com.webdiag.core.model;

import java.time.Instant;
import java.util.Objects;

/** TLS 핸드셰이크로 얻은 서버 인증서 요약 */
public record TlsCertificateInfo(String subject, String issuer, Instant validFrom, Instant validUntil, String protocol) {
    public TlsCertificateInfo {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(validFrom, "validFrom");
        Objects.requireNonNull(validUntil, "validUntil");
    }
}
