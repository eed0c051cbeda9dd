package com.webdiag.core.model;

import java.util.Objects;

/** 이슈 문구와 그 설명의 쌍 */
public record IssueExplanation(String issue, Explanation explanation) {
    public IssueExplanation {
        Objects.requireNonNull(issue, "issue");
        Objects.requireNonNull(explanation, "explanation");
    }
}
