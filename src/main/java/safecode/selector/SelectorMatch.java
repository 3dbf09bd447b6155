package safecode.selector;

import com.fasterxml.jackson.annotation.JsonProperty;
import safecode.model.SelectorCatalogEntry;

/**
 * A catalog entry paired with how well it matched an element description.
 *
 * @param entry      the matched catalog entry
 * @param confidence score in {@code [0, 1]}
 * @param matchType  band the score falls into
 */
public record SelectorMatch(
        @JsonProperty("selector")   SelectorCatalogEntry entry,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("match_type") MatchType matchType) {

    /** A direct catalog hit: confidence 1.0, type exact. */
    public static SelectorMatch exact(SelectorCatalogEntry entry) {
        return new SelectorMatch(entry, 1.0, MatchType.EXACT);
    }

    public String selector() {
        return entry.getSelector();
    }
}
