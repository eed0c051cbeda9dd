package com.webdiag.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 진단 1회의 최종 결과. 생성 후 불변, 그대로 직렬화 가능. */
@JsonPropertyOrder({"url", "timestamp", "seo", "security", "performance", "accessibility", "overallScore", "scores"})
public final class DiagnosisResult {
    private final String url;
    private final OffsetDateTime timestamp;
    private final Map<Category, CategoryResult> categories;
    private final double overallScore;
    private final Map<String, Integer> scores;

    private DiagnosisResult(Builder b) {
        this.url = b.url;
        this.timestamp = b.timestamp;
        EnumMap<Category, CategoryResult> m = new EnumMap<>(Category.class);
        m.putAll(b.categories);
        this.categories = Collections.unmodifiableMap(m);
        this.overallScore = b.overallScore;

        Map<String, Integer> s = new LinkedHashMap<>();
        for (Category c : Category.values()) s.put(c.key(), m.get(c).score());
        this.scores = Collections.unmodifiableMap(s);
    }

    public String getUrl() { return url; }
    public OffsetDateTime getTimestamp() { return timestamp; }
    public CategoryResult getSeo() { return categories.get(Category.SEO); }
    public CategoryResult getSecurity() { return categories.get(Category.SECURITY); }
    public CategoryResult getPerformance() { return categories.get(Category.PERFORMANCE); }
    public CategoryResult getAccessibility() { return categories.get(Category.ACCESSIBILITY); }
    public double getOverallScore() { return overallScore; }

    /** 카테고리 키 → 점수 */
    public Map<String, Integer> getScores() { return scores; }

    public CategoryResult category(Category c) {
        return categories.get(Objects.requireNonNull(c, "category"));
    }

    /** 선언 순서(SEO, Security, Performance, Accessibility)대로 */
    @JsonIgnore
    public List<CategoryResult> getCategoryResults() {
        return List.copyOf(categories.values());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private OffsetDateTime timestamp;
        private final Map<Category, CategoryResult> categories = new EnumMap<>(Category.class);
        private double overallScore;

        public Builder url(String url) { this.url = url; return this; }
        public Builder timestamp(OffsetDateTime timestamp) { this.timestamp = timestamp; return this; }
        public Builder overallScore(double overallScore) { this.overallScore = overallScore; return this; }

        public Builder category(CategoryResult result) {
            Objects.requireNonNull(result, "result");
            this.categories.put(result.category(), result);
            return this;
        }

        public DiagnosisResult build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(timestamp, "timestamp");
            for (Category c : Category.values()) {
                if (!categories.containsKey(c)) {
                    throw new IllegalStateException("missing category result: " + c.key());
                }
            }
            return new DiagnosisResult(this);
        }
    }
}
