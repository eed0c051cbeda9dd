package com.webdiag.core.rank;

import com.webdiag.core.model.Category;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.DiagnosisResult;
import com.webdiag.core.model.RecommendationEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 전 카테고리 이슈를 한 목록으로 모아 우선순위 내림차순 상위 N개.
 * priority = (100 - 카테고리 점수) × 가중치. 동점은 카테고리 → 발견 순서 유지(안정 정렬).
 */
public final class RecommendationRanker {

    public static final int DEFAULT_TOP_N = 10;

    /** 고정 가중치 (실행 중 변경 불가) */
    public static final Map<Category, Double> WEIGHTS;
    static {
        EnumMap<Category, Double> w = new EnumMap<>(Category.class);
        w.put(Category.SECURITY, 1.5);
        w.put(Category.ACCESSIBILITY, 1.3);
        w.put(Category.SEO, 1.2);
        w.put(Category.PERFORMANCE, 1.0);
        WEIGHTS = Collections.unmodifiableMap(w);
    }

    private final int topN;

    public RecommendationRanker() { this(DEFAULT_TOP_N); }

    public RecommendationRanker(int topN) {
        if (topN < 1) throw new IllegalArgumentException("topN must be >= 1");
        this.topN = topN;
    }

    public RecommendationReport rank(DiagnosisResult result) {
        return rank(result.getCategoryResults());
    }

    /** results는 SEO, Security, Performance, Accessibility 순서로 넘길 것 */
    public RecommendationReport rank(List<CategoryResult> results) {
        List<Candidate> pool = new ArrayList<>();
        for (CategoryResult r : results) {
            double p = priority(r.score(), r.category());
            for (String issue : r.issues()) pool.add(new Candidate(r.category(), issue, p));
        }
        // List.sort는 안정 정렬
        pool.sort(Comparator.comparingDouble(Candidate::priority).reversed());

        List<RecommendationEntry> top = new ArrayList<>();
        for (int i = 0; i < Math.min(topN, pool.size()); i++) {
            Candidate c = pool.get(i);
            top.add(new RecommendationEntry(i + 1, c.category, c.issue, c.priority));
        }
        return new RecommendationReport(top, pool.size());
    }

    /** 부동소수 오차 없이: 70 × 1.5 = 105.0 */
    public static double priority(int score, Category category) {
        return BigDecimal.valueOf(100 - score)
                .multiply(BigDecimal.valueOf(WEIGHTS.get(category)))
                .doubleValue();
    }

    public int topN() { return topN; }

    private record Candidate(Category category, String issue, double priority) {}
}
