package com.webdiag.core.service;

import com.webdiag.core.model.Category;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.DiagnosisResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 네 카테고리 점수 → 종합 점수(소수 첫째 자리) + DiagnosisResult 조립.
 * 가중치 SEO 0.3 / Security 0.3 / Performance 0.2 / Accessibility 0.2 (고정).
 */
public final class ScoreAggregator {

    private final Clock clock;

    public ScoreAggregator() { this(Clock.systemDefaultZone()); }

    public ScoreAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DiagnosisResult aggregate(String url, Collection<CategoryResult> results) {
        Map<Category, CategoryResult> byCat = new EnumMap<>(Category.class);
        for (CategoryResult r : results) {
            if (byCat.put(r.category(), r) != null) {
                throw new IllegalArgumentException("duplicate category result: " + r.category().key());
            }
        }
        for (Category c : Category.values()) {
            if (!byCat.containsKey(c)) throw new IllegalStateException("missing category result: " + c.key());
        }

        DiagnosisResult.Builder b = DiagnosisResult.builder()
                .url(url)
                .timestamp(OffsetDateTime.now(clock))
                .overallScore(overall(
                        byCat.get(Category.SEO).score(),
                        byCat.get(Category.SECURITY).score(),
                        byCat.get(Category.PERFORMANCE).score(),
                        byCat.get(Category.ACCESSIBILITY).score()));
        byCat.values().forEach(b::category);
        return b.build();
    }

    /** 정수 가중합(×10)으로 계산해 0.1 단위 오차를 없앤다 */
    public static double overall(int seo, int security, int performance, int accessibility) {
        int tenths = 3 * seo + 3 * security + 2 * performance + 2 * accessibility;
        return BigDecimal.valueOf(tenths).divide(BigDecimal.TEN, 1, RoundingMode.HALF_UP).doubleValue();
    }
}
