package com.webdiag.core.analyzer.rule;

import com.webdiag.core.model.PageSnapshot;

import java.util.Objects;
import java.util.function.Function;

/** 람다로 규칙을 만드는 헬퍼 */
public final class Rules {
    private Rules() {}

    public static Rule of(String id, int maxPoints, Function<PageSnapshot, RuleOutcome> fn) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fn, "fn");
        if (maxPoints < 0) throw new IllegalArgumentException("maxPoints must be >= 0");
        return new Rule() {
            @Override public String id() { return id; }
            @Override public int maxPoints() { return maxPoints; }
            @Override public RuleOutcome evaluate(PageSnapshot snapshot) { return fn.apply(snapshot); }
            @Override public String toString() { return "Rule[" + id + ", max=" + maxPoints + "]"; }
        };
    }
}
