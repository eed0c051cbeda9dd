package com.webdiag.core.model;

import java.util.Objects;

/**
 * 우선 개선 항목 한 줄.
 *
 * @param rank     1부터 시작
 * @param category 이슈가 나온 카테고리
 * @param issue    원문 이슈 문구
 * @param priority (100 - 카테고리 점수) × 카테고리 가중치
 */
public record RecommendationEntry(int rank, Category category, String issue, double priority) {
    public RecommendationEntry {
        if (rank < 1) throw new IllegalArgumentException("rank must be >= 1");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(issue, "issue");
    }
}
