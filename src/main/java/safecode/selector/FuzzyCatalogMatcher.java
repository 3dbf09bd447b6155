package safecode.selector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.catalog.SelectorCatalog;
import safecode.model.SelectorCatalogEntry;
import safecode.model.SelectorRelationships;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ranks catalog selectors against a natural-language element description.
 *
 * <h3>Scoring</h3>
 * Each entry with a non-empty description is scored as the sum of:
 * <ol>
 *   <li><b>Keyword overlap</b> (up to {@code keywordWeight}): a blend of Jaccard
 *       similarity and the share of description keywords found in the entry.
 *       An identical description short-circuits to 1.0; a description contained
 *       in the entry's raises the running score to at least the length ratio,
 *       capped at {@code substringCap}.</li>
 *   <li><b>Element type</b>: full weight when the entry's stored element type
 *       contains a label implied by the description, partial weight for the
 *       content/image and interactive/button-or-link near misses.</li>
 *   <li><b>Specificity</b>: the first of test-id attribute, tracking attribute,
 *       id selector, class selector that applies.</li>
 *   <li><b>Relationship</b>: a single bonus when the description talks about
 *       siblings, children or a parent and the entry records one.</li>
 * </ol>
 * The sum is capped at 1.0, classified into a {@link MatchType} band and
 * discarded below the keyword threshold.
 *
 * <p>Stateless and thread-safe.
 */
public class FuzzyCatalogMatcher {

    private static final Logger log = LoggerFactory.getLogger(FuzzyCatalogMatcher.class);

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");

    private static final List<String> SIBLING_WORDS = List.of("sibling", "siblings", "next to", "beside");
    private static final List<String> CHILD_WORDS   = List.of("child", "children", "inside", "within", "contained");
    private static final List<String> PARENT_WORDS  = List.of("parent", "container", "wrapper");

    private final MatcherSettings settings;

    public FuzzyCatalogMatcher() {
        this(MatcherSettings.defaults());
    }

    public FuzzyCatalogMatcher(MatcherSettings settings) {
        this.settings = settings;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Matches against every entry of a scoped catalog snapshot. */
    public List<SelectorMatch> findMatches(String description, SelectorCatalog catalog) {
        return findMatches(description, catalog.entries());
    }

    /**
     * Scores {@code entries} against {@code description}.
     *
     * @param description element description; trimmed and lower-cased here
     * @param entries     candidates, already filtered to one brand, page type and active status
     * @return at most {@code maxResults} matches, highest confidence first; ties keep catalog order
     */
    public List<SelectorMatch> findMatches(String description, Collection<SelectorCatalogEntry> entries) {
        String desc = normalize(description);
        if (desc.isEmpty() || entries == null || entries.isEmpty()) return List.of();

        Query query = analyse(desc);
        log.debug("Matching '{}': keywords={} typeLabels={} sibling={} child={} parent={}",
                desc, query.keywords, query.typeLabels, query.siblingContext, query.childContext, query.parentContext);

        List<SelectorMatch> matches = new ArrayList<>();
        for (SelectorCatalogEntry entry : entries) {
            if (entry == null || !entry.hasDescription()) continue;

            double score = score(query, entry);
            MatchType type = classify(score);
            if (type == null) continue;

            matches.add(new SelectorMatch(entry, score, type));
            log.debug("Candidate {} scored {} ({})", entry.getSelector(), String.format("%.2f", score), type);
        }

        matches.sort(Comparator.comparingDouble(SelectorMatch::confidence).reversed());
        List<SelectorMatch> top = matches.size() > settings.maxResults()
                ? List.copyOf(matches.subList(0, settings.maxResults()))
                : List.copyOf(matches);

        if (top.isEmpty()) {
            log.debug("No catalog match for '{}'", desc);
        } else {
            log.debug("{} candidate(s) for '{}', best {} ({})", matches.size(), desc,
                    top.get(0).selector(), String.format("%.2f", top.get(0).confidence()));
        }
        return top;
    }

    /**
     * Meaningful lower-case words of {@code text}: tokens of at least
     * {@code minKeywordLength} characters that are not stop words, in order.
     */
    public List<String> extractKeywords(String text) {
        List<String> keywords = new ArrayList<>();
        if (text == null) return keywords;
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String w = m.group();
            if (w.length() >= settings.minKeywordLength() && !settings.stopWords().contains(w)) {
                keywords.add(w);
            }
        }
        return keywords;
    }

    /**
     * Element-type labels implied by a description, e.g. "hero image" gives
     * {@code image, content, picture}. Trigger words match as substrings.
     */
    public Set<String> impliedTypeLabels(String description) {
        Set<String> labels = new LinkedHashSet<>();
        String desc = normalize(description);
        for (SynonymGroup group : settings.synonymGroups()) {
            for (String trigger : group.triggers()) {
                if (desc.contains(trigger)) {
                    labels.addAll(group.labels());
                    break;
                }
            }
        }
        return labels;
    }

    // ── Scoring ───────────────────────────────────────────────────────────

    double score(Query query, SelectorCatalogEntry entry) {
        String entryDesc = normalize(entry.getDescription());

        double score = keywordOverlap(query.keywords, extractKeywords(entryDesc)) * settings.keywordWeight();

        if (entryDesc.equals(query.description)) {
            return 1.0;
        }
        if (!entryDesc.isEmpty() && entryDesc.contains(query.description)) {
            double ratio = (double) query.description.length() / entryDesc.length();
            score = Math.max(score, Math.min(ratio, settings.substringCap()));
        }

        SelectorRelationships rel = entry.getRelationships();
        score += elementTypeBonus(query.typeLabels, rel);
        score += specificityBonus(entry.getSelector());
        score += relationshipBonus(query, rel);

        return Math.min(score, 1.0);
    }

    /** 0.6 × Jaccard + 0.4 × |A ∩ B| / |A| with the configured blend weights. */
    double keywordOverlap(List<String> descriptionKeywords, List<String> entryKeywords) {
        if (descriptionKeywords.isEmpty() || entryKeywords.isEmpty()) return 0.0;

        Set<String> a = new HashSet<>(descriptionKeywords);
        Set<String> b = new HashSet<>(entryKeywords);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);

        double jaccard = (double) intersection.size() / union.size();
        double ratio   = (double) intersection.size() / descriptionKeywords.size();
        return jaccard * settings.jaccardWeight() + ratio * settings.ratioWeight();
    }

    private double elementTypeBonus(Set<String> typeLabels, SelectorRelationships rel) {
        if (rel == null || rel.getElementType() == null || typeLabels.isEmpty()) return 0.0;
        String type = rel.getElementType().label();

        for (String label : typeLabels) {
            if (type.contains(label)) return settings.elementTypeWeight();
        }
        if (type.contains("content") && (typeLabels.contains("image") || typeLabels.contains("picture"))) {
            return settings.elementTypePartialWeight();
        }
        if (type.contains("interactive") && (typeLabels.contains("button") || typeLabels.contains("link"))) {
            return settings.elementTypePartialWeight();
        }
        return 0.0;
    }

    private double specificityBonus(String selector) {
        String s = selector.toLowerCase(Locale.ROOT);
        if (s.contains("data-test-id") || s.contains("data-testid"))         return settings.testIdBonus();
        if (s.contains("data-product-id") || s.contains("data-tracking-id")) return settings.trackingIdBonus();
        if (s.startsWith("#"))                                              return settings.idBonus();
        if (s.startsWith("."))                                              return settings.classBonus();
        return 0.0;
    }

    private double relationshipBonus(Query query, SelectorRelationships rel) {
        if (rel == null) return 0.0;
        boolean relevant = (query.siblingContext && !rel.getSiblings().isEmpty())
                || (query.childContext && !rel.getChildren().isEmpty())
                || (query.parentContext && rel.hasParent());
        return relevant ? settings.relationshipWeight() : 0.0;
    }

    private MatchType classify(double score) {
        if (score >= settings.exactThreshold())   return MatchType.EXACT;
        if (score >= settings.partialThreshold()) return MatchType.PARTIAL;
        if (score >= settings.keywordThreshold()) return MatchType.KEYWORD;
        return null;
    }

    // ── Query analysis ────────────────────────────────────────────────────

    Query analyse(String description) {
        String desc = normalize(description);
        return new Query(desc,
                extractKeywords(desc),
                impliedTypeLabels(desc),
                containsAny(desc, SIBLING_WORDS),
                containsAny(desc, CHILD_WORDS),
                containsAny(desc, PARENT_WORDS));
    }

    /** Pre-computed view of one description, shared across all entries it is scored against. */
    record Query(String description,
                 List<String> keywords,
                 Set<String> typeLabels,
                 boolean siblingContext,
                 boolean childContext,
                 boolean parentContext) {}

    private static boolean containsAny(String text, List<String> words) {
        for (String w : words) {
            if (text.contains(w)) return true;
        }
        return false;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
