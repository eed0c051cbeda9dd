package com.webdiag.core.analyzer.rule;

import com.webdiag.core.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 규칙 평가 결과: 획득 점수 + 이슈 또는 성공 문구 중 최대 하나.
 * 부분 점수(점수 + 이슈)도 가능. skip()은 아무것도 기여하지 않는다.
 */
public final class RuleOutcome {

    private static final RuleOutcome SKIP = new RuleOutcome(0, null, null, null, Severity.INFO, Map.of());

    private final int points;
    private final String issue;
    private final String success;
    private final String explanationKey;
    private final Severity severity;
    private final Map<String, Object> metrics;

    private RuleOutcome(int points, String issue, String success, String explanationKey,
                        Severity severity, Map<String, Object> metrics) {
        if (points < 0) throw new IllegalArgumentException("points must be >= 0");
        if (issue != null && success != null) throw new IllegalArgumentException("issue and success are exclusive");
        this.points = points;
        this.issue = issue;
        this.success = success;
        this.explanationKey = explanationKey;
        this.severity = Objects.requireNonNull(severity, "severity");
        this.metrics = metrics;
    }

    /** 통과: 점수 + 성공 문구 */
    public static RuleOutcome pass(int points, String success) {
        return new RuleOutcome(points, null, Objects.requireNonNull(success, "success"), null, Severity.INFO, Map.of());
    }

    /** 실패: 점수 없음 + 이슈 */
    public static RuleOutcome fail(String issue) {
        return partial(0, issue);
    }

    /** 부분 점수 + 이슈 */
    public static RuleOutcome partial(int points, String issue) {
        return new RuleOutcome(points, Objects.requireNonNull(issue, "issue"), null, null, Severity.MEDIUM, Map.of());
    }

    /** 점수만(문구 없음). 예: nav 없음은 감점도 이슈도 아님 */
    public static RuleOutcome silent(int points) {
        return points == 0 ? SKIP : new RuleOutcome(points, null, null, null, Severity.INFO, Map.of());
    }

    public static RuleOutcome skip() { return SKIP; }

    public RuleOutcome withExplanation(String key) {
        return new RuleOutcome(points, issue, success, key, severity, metrics);
    }

    public RuleOutcome withSeverity(Severity s) {
        return new RuleOutcome(points, issue, success, explanationKey, s, metrics);
    }

    /** 점수와 무관한 측정값 첨부 (null 값 허용) */
    public RuleOutcome withMetric(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(metrics);
        m.put(Objects.requireNonNull(key, "key"), value);
        return new RuleOutcome(points, issue, success, explanationKey, severity, Collections.unmodifiableMap(m));
    }

    public int points() { return points; }
    public String issue() { return issue; }
    public String success() { return success; }
    public String explanationKey() { return explanationKey; }
    public Severity severity() { return severity; }
    public Map<String, Object> metrics() { return metrics; }

    public boolean isIssue() { return issue != null; }
    public boolean isSuccess() { return success != null; }
    public boolean isSkip() { return this == SKIP; }

    @Override
    public String toString() {
        return "RuleOutcome{points=" + points
                + (issue != null ? ", issue='" + issue + '\'' : "")
                + (success != null ? ", success='" + success + '\'' : "")
                + (explanationKey != null ? ", explanation=" + explanationKey : "")
                + ", severity=" + severity + '}';
    }
}
