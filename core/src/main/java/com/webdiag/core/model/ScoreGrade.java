package com.webdiag.core.model;

/** 점수 구간 라벨 (리포트 표시용) */
public enum ScoreGrade {
    EXCELLENT(80, "Excellent", "優秀"),
    GOOD(60, "Good", "良好"),
    AVERAGE(40, "Average", "平均"),
    POOR(0, "Poor", "要改善");

    private final int minScore;
    private final String labelEn;
    private final String labelJa;

    ScoreGrade(int minScore, String labelEn, String labelJa) {
        this.minScore = minScore;
        this.labelEn = labelEn;
        this.labelJa = labelJa;
    }

    public static ScoreGrade of(double score) {
        for (ScoreGrade g : values()) {
            if (score >= g.minScore) return g;
        }
        return POOR;
    }

    public int minScore() { return minScore; }
    public String bilingualLabel() { return labelEn + " / " + labelJa; }
}
