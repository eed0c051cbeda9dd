package com.webdiag.core.analyzer;

import com.webdiag.core.analyzer.rule.Rule;
import com.webdiag.core.analyzer.rule.RuleOutcome;
import com.webdiag.core.api.ICategoryAnalyzer;
import com.webdiag.core.localize.FindingCatalog;
import com.webdiag.core.model.Category;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.IssueExplanation;
import com.webdiag.core.model.PageSnapshot;
import com.webdiag.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 순서 있는 규칙 목록을 접어 CategoryResult를 만드는 공통 골격.
 * 점수 = 획득 점수 합을 [0,100]으로 clamp. 이슈/성공 문구는 규칙 순서 그대로.
 */
public abstract class AbstractRuleAnalyzer implements ICategoryAnalyzer {

    private final Category category;
    private final List<Rule> rules;
    private final FindingCatalog catalog;

    protected AbstractRuleAnalyzer(Category category, List<Rule> rules, FindingCatalog catalog) {
        this.category = Objects.requireNonNull(category, "category");
        this.rules = List.copyOf(rules);
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public final Category category() { return category; }

    public final List<Rule> rules() { return rules; }

    /** 모든 규칙이 최고 점수를 줄 때의 합 (clamp 전) */
    public final int maxAchievablePoints() {
        return rules.stream().mapToInt(Rule::maxPoints).sum();
    }

    @Override
    public final CategoryResult analyze(PageSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        int points = 0;
        List<String> issues = new ArrayList<>();
        List<String> success = new ArrayList<>();
        List<IssueExplanation> explanations = new ArrayList<>();
        List<String> critical = new ArrayList<>();
        Map<String, Object> metrics = new LinkedHashMap<>(metrics(snapshot));

        for (Rule rule : rules) {
            RuleOutcome out = rule.evaluate(snapshot);
            if (out == null) {
                throw new IllegalStateException("rule " + rule.id() + " returned no outcome");
            }
            points += out.points();
            if (out.isIssue()) {
                issues.add(out.issue());
                catalog.explanation(out.explanationKey())
                        .ifPresent(ex -> explanations.add(new IssueExplanation(out.issue(), ex)));
                if (out.severity() == Severity.CRITICAL) critical.add(out.issue());
            } else if (out.isSuccess()) {
                success.add(out.success());
            }
            metrics.putAll(out.metrics());
        }
        return new CategoryResult(category, CategoryResult.clamp(points), issues, success, explanations, critical, metrics);
    }

    /** 점수와 무관한 카테고리 측정값. 기본은 없음. */
    protected Map<String, Object> metrics(PageSnapshot snapshot) {
        return Map.of();
    }
}
