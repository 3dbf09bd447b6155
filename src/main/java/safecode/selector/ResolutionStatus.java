package safecode.selector;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Outcome of a selector resolution. */
public enum ResolutionStatus {
    FOUND_IN_DB,
    VALID_BUT_NOT_IN_DB,
    MULTIPLE_MATCHES,
    NOT_FOUND,
    INVALID_CHOICE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
