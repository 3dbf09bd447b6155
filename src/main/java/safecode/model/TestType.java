package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kind of A/B test a code template is written for. */
public enum TestType {
    PDP, CART, CHECKOUT, HOME, CATEGORY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TestType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (TestType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
