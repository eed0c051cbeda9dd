package com.webdiag.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** 진단 카테고리. 선언 순서 = 리포트/랭킹 수집 순서 */
public enum Category {
    SEO("seo", "SEO", "SEO"),
    SECURITY("security", "Security", "セキュリティ"),
    PERFORMANCE("performance", "Performance", "パフォーマンス"),
    ACCESSIBILITY("accessibility", "Accessibility", "アクセシビリティ");

    private final String key;
    private final String labelEn;
    private final String labelJa;

    Category(String key, String labelEn, String labelJa) {
        this.key = key;
        this.labelEn = labelEn;
        this.labelJa = labelJa;
    }

    /** JSON/결과 맵 키 (소문자) */
    @JsonValue
    public String key() { return key; }
    public String labelEn() { return labelEn; }
    public String labelJa() { return labelJa; }

    public String bilingualLabel() {
        return labelEn.equals(labelJa) ? labelEn : labelEn + " / " + labelJa;
    }
}
