package safecode.selector;

import java.util.List;
import java.util.Set;

/**
 * Tuning surface of {@link FuzzyCatalogMatcher}: factor weights, bonuses,
 * match-type thresholds, the keyword stop-list and the synonym groups.
 *
 * <p>{@link #defaults()} holds the shipped values; {@code EngineConfig}
 * overrides them from {@code config.properties}.
 */
public record MatcherSettings(
        double keywordWeight,
        double jaccardWeight,
        double ratioWeight,
        double substringCap,
        double elementTypeWeight,
        double elementTypePartialWeight,
        double testIdBonus,
        double trackingIdBonus,
        double idBonus,
        double classBonus,
        double relationshipWeight,
        double exactThreshold,
        double partialThreshold,
        double keywordThreshold,
        int maxResults,
        int minKeywordLength,
        Set<String> stopWords,
        List<SynonymGroup> synonymGroups) {

    public static final Set<String> DEFAULT_STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "are", "was", "were", "be",
            "been", "have", "has", "had", "do", "does", "did", "will", "would",
            "could", "should", "may", "might", "must", "can", "this", "that",
            "these", "those", "off", "up", "down", "out", "over", "under");

    public static final List<SynonymGroup> DEFAULT_SYNONYM_GROUPS = List.of(
            new SynonymGroup("image",
                    List.of("image", "picture", "img", "photo", "graphic", "icon", "badge"),
                    List.of("image", "content", "picture")),
            new SynonymGroup("button",
                    List.of("button", "btn", "click", "cta", "action", "submit"),
                    List.of("button", "interactive")),
            new SynonymGroup("link",
                    List.of("link", "anchor", "url", "href"),
                    List.of("link", "interactive")),
            new SynonymGroup("text",
                    List.of("text", "title", "heading", "h1", "h2", "h3", "label", "name", "description"),
                    List.of("text", "content")),
            new SynonymGroup("form",
                    List.of("input", "field", "form", "textarea", "select"),
                    List.of("input", "interactive", "form")),
            new SynonymGroup("container",
                    List.of("container", "card", "div", "section", "wrapper", "box"),
                    List.of("container")));

    public MatcherSettings {
        stopWords     = Set.copyOf(stopWords);
        synonymGroups = List.copyOf(synonymGroups);
    }

    public static MatcherSettings defaults() {
        return new MatcherSettings(
                0.4, 0.6, 0.4, 0.9,
                0.3, 0.2,
                0.2, 0.15, 0.1, 0.05,
                0.1,
                0.9, 0.7, 0.2,
                5, 3,
                DEFAULT_STOP_WORDS, DEFAULT_SYNONYM_GROUPS);
    }
}
