package safecode.selector;

import java.util.List;

/**
 * A family of words that imply an element category.
 *
 * @param name     group key, e.g. {@code "image"}
 * @param triggers substrings that, when found in a description, activate the group
 * @param labels   element-type labels the group implies, e.g. {@code image, content, picture}
 */
public record SynonymGroup(String name, List<String> triggers, List<String> labels) {

    public SynonymGroup {
        triggers = List.copyOf(triggers);
        labels   = List.copyOf(labels);
    }
}
