package com.repo.velocity.report;

import com.repo.velocity.churn.AuthorChurnStats;
import com.repo.velocity.rules.RiskAssessment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class CsvReporter {

    public static final String AUTHOR_HEADER =
            "Author,Commits,Additions,Deletions,Churn,Net Change,Files Changed,Churn Ratio,Avg Churn/Commit,Productivity Score";
    public static final String RISK_HEADER = "Item,Kind,Author,Churn,Risk Score,Tier,Factors,Churn Z-Score";

    /**
     * One row per author, in ranking order.
     */
    public void writeAuthors(List<AuthorChurnStats> authors, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        csv.append(AUTHOR_HEADER).append('\n');

        for (AuthorChurnStats a : authors) {
            csv.append(String.format(Locale.ROOT, "%s,%d,%d,%d,%d,%d,%d,%.2f,%.2f,%.2f\n",
                    escape(a.author()),
                    a.commitCount(),
                    a.totalAdditions(),
                    a.totalDeletions(),
                    a.churn(),
                    a.netChange(),
                    a.filesChanged(),
                    a.churnRatio(),
                    a.avgChurnPerCommit(),
                    a.productivityScore()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Flagged items only, highest score first.
     */
    public void writeRisks(List<RiskAssessment> assessments, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        csv.append(RISK_HEADER).append('\n');

        assessments.stream()
                .filter(RiskAssessment::isFlagged)
                .sorted((a, b) -> Integer.compare(b.riskScore(), a.riskScore()))
                .forEach(r -> csv.append(String.format(Locale.ROOT, "%s,%s,%s,%d,%d,%s,%s,%.2f\n",
                        escape(r.itemId()),
                        r.kind(),
                        escape(r.author()),
                        r.churn(),
                        r.riskScore(),
                        r.tier(),
                        escape(String.join(";", r.factorCodes())),
                        r.churnZScore())));

        Files.writeString(outputPath, csv.toString());
    }

    static String escape(String s) {
        if (s == null)
            return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
