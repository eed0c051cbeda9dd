package com.webdiag.core.localize;

import com.webdiag.core.model.Explanation;

import java.util.Objects;

/**
 * 현지화된 진단 문구.
 *
 * @param original    분석기가 낸 원문
 * @param localized   영문 용어로 치환된 문구 (매칭 실패 시 원문 그대로)
 * @param explanation 설명 (없을 수 있음)
 */
public record LocalizedFinding(String original, String localized, Explanation explanation) {
    public LocalizedFinding {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(localized, "localized");
    }

    public boolean matched() { return !original.equals(localized) || explanation != null; }

    /** "원문 / localized" 형식. 치환이 없으면 원문 한 번만. */
    public String bilingual() {
        return original.equals(localized) ? original : original + " / " + localized;
    }
}
