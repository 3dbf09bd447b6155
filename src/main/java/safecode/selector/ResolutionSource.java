package safecode.selector;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Where a resolved selector came from. */
public enum ResolutionSource {
    DATABASE, USER_PROVIDED, NONE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
