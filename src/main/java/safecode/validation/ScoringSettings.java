package safecode.validation;

/**
 * Weights, penalties and thresholds of {@link ConfidenceScorer}.
 *
 * @param templateWeight        cap of the template-adherence score
 * @param ruleWeight            cap of the rule-compliance score
 * @param selectorWeight        cap of the selector-validity score
 * @param templateAbsentScore   template score when the brand has no template
 * @param querySelectorScore    template score when neither side names functions but both call querySelector
 * @param rulePenalty           deducted per rule violation
 * @param selectorPenalty       deducted per invalid selector
 * @param safeThreshold         minimum overall score for {@link Recommendation#SAFE_TO_USE}
 * @param reviewThreshold       minimum overall score for {@link Recommendation#REVIEW_CAREFULLY}
 */
public record ScoringSettings(
        double templateWeight,
        double ruleWeight,
        double selectorWeight,
        double templateAbsentScore,
        double querySelectorScore,
        double rulePenalty,
        double selectorPenalty,
        double safeThreshold,
        double reviewThreshold) {

    public static ScoringSettings defaults() {
        return new ScoringSettings(0.3, 0.4, 0.3, 0.1, 0.2, 0.1, 0.05, 0.8, 0.6);
    }
}
