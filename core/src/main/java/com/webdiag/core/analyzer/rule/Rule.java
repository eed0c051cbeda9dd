package com.webdiag.core.analyzer.rule;

import com.webdiag.core.model.PageSnapshot;

/**
 * 이름 있는 채점 규칙 하나. 스냅샷만 보고 결과를 낸다(부작용 없음).
 * maxPoints()는 이 규칙이 줄 수 있는 최대 점수(감사용 합계에 쓰임).
 */
public interface Rule {
    String id();

    int maxPoints();

    RuleOutcome evaluate(PageSnapshot snapshot);
}
