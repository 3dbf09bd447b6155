package safecode.selector;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Confidence band of a fuzzy catalog match. */
public enum MatchType {
    EXACT, PARTIAL, KEYWORD;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
