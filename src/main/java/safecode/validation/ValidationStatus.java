package safecode.validation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Verdict on generated code.
 * <ul>
 *   <li>{@code PASSED}: no rule violations and every selector is catalogued</li>
 *   <li>{@code WARNING}: no rule violations, but some selectors are not catalogued</li>
 *   <li>{@code FAILED}: at least one rule violation</li>
 * </ul>
 */
public enum ValidationStatus {
    PASSED, WARNING, FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ValidationStatus of(ValidationResult result) {
        if (result.isValid())           return PASSED;
        if (result.hasRuleViolations()) return FAILED;
        return WARNING;
    }
}
