package com.webdiag.core.rank;

import com.webdiag.core.model.RecommendationEntry;

import java.util.List;

/**
 * 랭킹 결과: 상위 항목 + 전체 이슈 수.
 * 이슈가 하나도 없으면 빈 목록 대신 summary()가 "이슈 없음" 문구를 돌려준다.
 */
public record RecommendationReport(List<RecommendationEntry> entries, int totalIssues) {

    public static final String NO_ISSUES = "No issues found / 問題は見つかりませんでした";

    public RecommendationReport {
        entries = List.copyOf(entries);
        if (totalIssues < entries.size()) throw new IllegalArgumentException("totalIssues < entries");
    }

    public boolean isEmpty() { return entries.isEmpty(); }

    public String summary() {
        if (isEmpty()) return NO_ISSUES;
        return "Top " + entries.size() + " of " + totalIssues + " issues / 全" + totalIssues + "件中の上位" + entries.size() + "件";
    }
}
