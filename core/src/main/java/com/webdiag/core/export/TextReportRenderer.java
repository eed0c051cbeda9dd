package com.webdiag.core.export;

import com.webdiag.core.localize.FindingLocalizer;
import com.webdiag.core.localize.LocalizedFinding;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.DiagnosisResult;
import com.webdiag.core.model.Explanation;
import com.webdiag.core.model.IssueExplanation;
import com.webdiag.core.model.RecommendationEntry;
import com.webdiag.core.model.ScoreGrade;
import com.webdiag.core.rank.RecommendationReport;

import java.util.Locale;
import java.util.Objects;

/** 콘솔용 2개 국어 리포트 */
public final class TextReportRenderer {

    private static final String RULE = "=".repeat(60);
    private static final String THIN = "-".repeat(60);

    private final FindingLocalizer localizer;

    public TextReportRenderer(FindingLocalizer localizer) {
        this.localizer = Objects.requireNonNull(localizer, "localizer");
    }

    public String render(DiagnosisResult result, RecommendationReport recommendations) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append(RULE).append('\n');
        sb.append("Website Diagnosis / ウェブサイト診断").append('\n');
        sb.append("URL: ").append(result.getUrl()).append('\n');
        sb.append("Date / 日時: ").append(result.getTimestamp()).append('\n');
        sb.append(RULE).append('\n');
        sb.append(String.format(Locale.ROOT, "Overall / 総合スコア: %.1f/100 (%s)%n",
                result.getOverallScore(), ScoreGrade.of(result.getOverallScore()).bilingualLabel()));

        for (CategoryResult c : result.getCategoryResults()) {
            sb.append('\n').append(THIN).append('\n');
            sb.append(c.category().bilingualLabel()).append(": ").append(c.score()).append("/100 (")
              .append(ScoreGrade.of(c.score()).bilingualLabel()).append(")\n");
            if (!c.success().isEmpty()) {
                sb.append("  OK:\n");
                for (String s : c.success()) sb.append("    + ").append(localizer.localize(s).bilingual()).append('\n');
            }
            if (!c.issues().isEmpty()) {
                sb.append("  Issues / 問題点:\n");
                for (String s : c.issues()) sb.append("    - ").append(localizer.localize(s).bilingual()).append('\n');
            }
            for (IssueExplanation ie : c.explanations()) appendExplanation(sb, ie);
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append("Priorities / 優先改善項目: ").append(recommendations.summary()).append('\n');
        for (RecommendationEntry e : recommendations.entries()) {
            LocalizedFinding f = localizer.localize(e.issue());
            sb.append(String.format(Locale.ROOT, "  %2d. [%s] %s (priority %.1f)%n",
                    e.rank(), e.category().labelEn(), f.bilingual(), e.priority()));
        }
        return sb.toString();
    }

    private static void appendExplanation(StringBuilder sb, IssueExplanation ie) {
        Explanation ex = ie.explanation();
        sb.append("  ? ").append(ie.issue()).append('\n');
        sb.append("      What: ").append(ex.what()).append('\n');
        sb.append("      Why:  ").append(ex.why()).append('\n');
        sb.append("      How:  ").append(ex.how()).append('\n');
        if (ex.hasRisk()) sb.append("      Risk: ").append(ex.risk()).append('\n');
    }
}
