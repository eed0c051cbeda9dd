package com.webdiag.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 카테고리 하나의 진단 결과 (불변).
 * issues/success는 발견 순서를 유지한다. metrics는 점수에 영향 없는 측정값.
 */
@JsonPropertyOrder({"category", "score", "issues", "success", "explanations", "criticalIssues", "metrics"})
public record CategoryResult(Category category,
                             int score,
                             List<String> issues,
                             List<String> success,
                             List<IssueExplanation> explanations,
                             List<String> criticalIssues,
                             Map<String, Object> metrics) {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public CategoryResult {
        Objects.requireNonNull(category, "category");
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException("score must be within 0..100: " + score);
        }
        issues = List.copyOf(issues == null ? List.of() : issues);
        success = List.copyOf(success == null ? List.of() : success);
        explanations = List.copyOf(explanations == null ? List.of() : explanations);
        criticalIssues = List.copyOf(criticalIssues == null ? List.of() : criticalIssues);
        // null 값 허용 + 삽입 순서 유지 (Map.copyOf는 둘 다 안 됨)
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics == null ? Map.of() : metrics));
    }

    public static int clamp(int raw) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, raw));
    }

    public boolean hasIssues() { return !issues.isEmpty(); }
}
