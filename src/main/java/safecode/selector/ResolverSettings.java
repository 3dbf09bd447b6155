package safecode.selector;

import java.util.Set;

/**
 * Tuning surface of {@link SelectorResolver} and {@link SelectorTextExtractor}.
 *
 * @param contextWindow      how many recent conversation turns are searched for a
 *                           disambiguation prompt or an id/class hint
 * @param bareNameStopWords  generic words never returned as a bare selector name
 */
public record ResolverSettings(int contextWindow, Set<String> bareNameStopWords) {

    public static final Set<String> DEFAULT_BARE_NAME_STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "product", "page", "element",
            "button", "text", "name", "title", "price", "cart", "checkout", "home",
            "use", "selector", "option", "class", "called", "named", "please");

    public ResolverSettings {
        bareNameStopWords = Set.copyOf(bareNameStopWords);
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(5, DEFAULT_BARE_NAME_STOP_WORDS);
    }
}
