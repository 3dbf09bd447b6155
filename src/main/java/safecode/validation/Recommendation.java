package safecode.validation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What a reviewer should do with generated code. */
public enum Recommendation {
    SAFE_TO_USE, REVIEW_CAREFULLY, NEEDS_FIXES;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
