package com.repo.velocity.rules;

import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.core.CiStatus;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.PullRequestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Additive, threshold-based defect risk scoring for commits and pull requests.
 * Each matching rule adds its weight; the total picks the tier. Weights are
 * non-negative, so matching one more rule can never lower an item's tier.
 */
public class RiskClassifier {

    public static final String STAGE = "risk";

    private static final Logger log = LoggerFactory.getLogger(RiskClassifier.class);

    /**
     * Condition evaluated against a single commit or pull request.
     */
    @FunctionalInterface
    public interface RuleCondition {
        boolean evaluate(RiskSubject subject);
    }

    /**
     * A weighted risk rule.
     */
    public record RiskRule(
            RiskFactor factor,
            int weight,
            RuleCondition condition,
            String description) {

        public RiskRule {
            if (weight < 0) {
                throw new IllegalArgumentException("rule weight must be >= 0: " + factor + "=" + weight);
            }
        }
    }

    private final AnalyticsConfig config;
    private final List<RiskRule> rules;
    private final OutlierDetector outlierDetector;

    /**
     * Create a classifier with the default rules, thresholds taken from the config.
     */
    public RiskClassifier(AnalyticsConfig config) {
        this(config, buildDefaultRules(config));
    }

    /**
     * Create a classifier with custom rules.
     */
    public RiskClassifier(AnalyticsConfig config, List<RiskRule> customRules) {
        this.config = config;
        this.rules = List.copyOf(customRules);
        this.outlierDetector = new OutlierDetector(config);
    }

    /**
     * Score one item against the team churn distribution.
     */
    public RiskAssessment assess(RiskSubject subject, double teamAvgChurn, double teamChurnStdDev) {
        int score = 0;
        List<RiskFactor> factors = new ArrayList<>();
        for (RiskRule rule : rules) {
            if (rule.condition().evaluate(subject)) {
                score += rule.weight();
                factors.add(rule.factor());
            }
        }
        double zScore = teamChurnStdDev > 0 ? (subject.churn() - teamAvgChurn) / teamChurnStdDev : 0.0;

        return new RiskAssessment(
                subject.itemId(),
                subject.kind(),
                subject.author(),
                subject.churn(),
                score,
                RiskTier.forScore(score, config),
                factors,
                zScore);
    }

    /**
     * Score all commits and pull requests and partition them into tiers, then
     * run outlier detection over the commit churn distribution.
     *
     * @param commits         commits to score; null entries are skipped with a warning
     * @param pullRequests    pull requests to score; null entries are skipped with a warning
     * @param teamAvgChurn    mean churn per commit from the churn stage
     * @param teamChurnStdDev sample standard deviation of churn per commit
     */
    public RiskReport classify(List<CommitRecord> commits, List<PullRequestRecord> pullRequests,
            double teamAvgChurn, double teamChurnStdDev) {
        List<AnalysisWarning> warnings = new ArrayList<>();
        List<RiskSubject> subjects = new ArrayList<>();
        List<CommitRecord> validCommits = new ArrayList<>();

        for (CommitRecord commit : commits) {
            if (commit == null) {
                warnings.add(AnalysisWarning.malformed(STAGE, "skipped null commit record"));
                continue;
            }
            validCommits.add(commit);
            subjects.add(RiskSubject.of(commit));
        }
        for (PullRequestRecord pr : pullRequests) {
            if (pr == null) {
                warnings.add(AnalysisWarning.malformed(STAGE, "skipped null pull request record"));
                continue;
            }
            subjects.add(RiskSubject.of(pr));
        }

        List<RiskAssessment> assessments = new ArrayList<>();
        List<RiskAssessment> high = new ArrayList<>();
        List<RiskAssessment> medium = new ArrayList<>();
        List<RiskAssessment> low = new ArrayList<>();

        for (RiskSubject subject : subjects) {
            RiskAssessment assessment = assess(subject, teamAvgChurn, teamChurnStdDev);
            assessments.add(assessment);
            switch (assessment.tier()) {
                case HIGH -> high.add(assessment);
                case MEDIUM -> medium.add(assessment);
                case LOW -> low.add(assessment);
                case NONE -> {
                    // not flagged
                }
            }
        }

        OutlierReport outliers = outlierDetector.detect(validCommits);
        warnings.addAll(outliers.warnings());

        log.debug("Scored {} items: {} high, {} medium, {} low, {} outliers",
                assessments.size(), high.size(), medium.size(), low.size(), outliers.outliers().size());

        return new RiskReport(assessments, high, medium, low, outliers, warnings);
    }

    public List<RiskRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Default scoring rules. Pull-request-only rules never match commits.
     */
    public static List<RiskRule> buildDefaultRules(AnalyticsConfig config) {
        List<RiskRule> defaultRules = new ArrayList<>();

        defaultRules.add(new RiskRule(
                RiskFactor.HIGH_CHURN,
                config.getWeightHighChurn(),
                s -> s.churn() > config.getHighChurnLines(),
                "More lines changed than a reviewer can reasonably follow"));

        defaultRules.add(new RiskRule(
                RiskFactor.MANY_FILES,
                config.getWeightManyFiles(),
                s -> s.filesChanged() > config.getManyFilesCount(),
                "Change spread across many files"));

        defaultRules.add(new RiskRule(
                RiskFactor.HIGH_DELETION_RATIO,
                config.getWeightHighDeletionRatio(),
                s -> s.deletionRatio() > config.getHighDeletionRatio(),
                "Mostly deletions relative to additions"));

        defaultRules.add(new RiskRule(
                RiskFactor.MASSIVE_COMMIT,
                config.getWeightMassiveCommit(),
                s -> s.churn() > config.getMassiveCommitLines(),
                "Extremely large change"));

        defaultRules.add(new RiskRule(
                RiskFactor.LOW_REVIEW,
                config.getWeightLowReview(),
                s -> s.isPullRequest() && s.merged() && s.reviewCount() <= config.getLowReviewMaxReviews(),
                "Merged with little or no review"));

        defaultRules.add(new RiskRule(
                RiskFactor.CI_FAILURE,
                config.getWeightCiFailure(),
                s -> s.isPullRequest() && s.ciStatus() == CiStatus.FAILURE,
                "CI reported a failure"));

        return defaultRules;
    }
}
