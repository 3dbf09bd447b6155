package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Closed set of brand code-rule kinds. Switches over it are expected to be exhaustive. */
public enum RuleType {
    FORBIDDEN_PATTERN, REQUIRED_PATTERN, MAX_LENGTH, MIN_LENGTH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (RuleType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
