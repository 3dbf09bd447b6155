package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse element category stored in a selector's relationship metadata.
 * Compared against the type labels implied by a user's element description.
 */
public enum ElementType {
    INTERACTIVE, CONTENT, CONTAINER, DATA;

    /** Lower-case label, as stored in the catalog and used by the synonym groups. */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns {@code null} for unknown labels so a bad tag never breaks catalog loading. */
    @JsonCreator
    public static ElementType fromLabel(String label) {
        if (label == null || label.isBlank()) return null;
        for (ElementType t : values()) {
            if (t.name().equalsIgnoreCase(label.trim())) return t;
        }
        return null;
    }
}
