package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Storefront page on which a catalog selector lives.
 */
public enum PageType {
    PDP, CART, CHECKOUT, HOME, CATEGORY, SEARCH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup used by Jackson and by callers parsing request parameters.
     *
     * @return the matching page type, or {@code null} when the value is blank or unknown
     */
    @JsonCreator
    public static PageType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (PageType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
