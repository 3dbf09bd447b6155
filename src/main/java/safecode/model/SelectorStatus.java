package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Lifecycle state of a catalog selector. Only {@link #ACTIVE} entries take part in resolution. */
public enum SelectorStatus {
    ACTIVE, INACTIVE, DEPRECATED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SelectorStatus fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (SelectorStatus s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) return s;
        }
        return null;
    }
}
