package com.webdiag.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * 초보자용 설명 레코드.
 *
 * @param what 무엇인가
 * @param why  왜 중요한가
 * @param how  어떻게 고치는가
 * @param risk 위험도 설명 (nullable, 보안 항목에만 존재)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Explanation(String what, String why, String how, String risk) {
    public Explanation {
        Objects.requireNonNull(what, "what");
        Objects.requireNonNull(why, "why");
        Objects.requireNonNull(how, "how");
    }

    public boolean hasRisk() { return risk != null && !risk.isBlank(); }
}
