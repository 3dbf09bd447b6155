package safecode.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Findings of {@link CodeValidator}. The code is valid exactly when both lists are empty.
 *
 * @param ruleViolations   one human-readable line per violated rule
 * @param invalidSelectors selectors used by the code that the catalog does not cover
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationResult(
        @JsonProperty("rule_violations")   List<String> ruleViolations,
        @JsonProperty("invalid_selectors") List<String> invalidSelectors) {

    public ValidationResult {
        ruleViolations   = ruleViolations != null ? List.copyOf(ruleViolations) : List.of();
        invalidSelectors = invalidSelectors != null ? List.copyOf(invalidSelectors) : List.of();
    }

    public static ValidationResult clean() {
        return new ValidationResult(List.of(), List.of());
    }

    @JsonProperty("is_valid")
    public boolean isValid() {
        return ruleViolations.isEmpty() && invalidSelectors.isEmpty();
    }

    public boolean hasRuleViolations() {
        return !ruleViolations.isEmpty();
    }

    public boolean hasInvalidSelectors() {
        return !invalidSelectors.isEmpty();
    }
}
