package safecode.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Decomposed confidence score for a piece of generated code.
 * {@code overallScore} is the sum of the three sub-scores clamped to {@code [0, 1]}.
 */
public record ConfidenceBreakdown(
        @JsonProperty("overall_score")     double overallScore,
        @JsonProperty("template_score")    double templateScore,
        @JsonProperty("rule_score")        double ruleScore,
        @JsonProperty("selector_score")    double selectorScore,
        @JsonProperty("rule_violations")   List<String> ruleViolations,
        @JsonProperty("invalid_selectors") List<String> invalidSelectors,
        @JsonProperty("is_valid")          boolean isValid,
        @JsonProperty("validation_status") ValidationStatus validationStatus,
        @JsonProperty("recommendation")    Recommendation recommendation) {

    public ConfidenceBreakdown {
        ruleViolations   = ruleViolations != null ? List.copyOf(ruleViolations) : List.of();
        invalidSelectors = invalidSelectors != null ? List.copyOf(invalidSelectors) : List.of();
    }
}
