package safecode.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replaces the header placeholders of a brand's global template:
 * {@code {test_id}}, {@code {summary}}, {@code {version}}, {@code {date}} and
 * {@code {features}}.
 */
public class PlaceholderFiller {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderFiller.class);

    static final String VERSION = "1.0";

    private static final int MAX_SUMMARY        = 150;
    private static final int MAX_FEATURES       = 5;
    private static final int MAX_FEATURE_LENGTH = 100;
    private static final int MIN_FEATURE_LENGTH = 10;

    private static final List<String> FEATURE_VERBS = List.of(
            "change", "modify", "update", "add", "remove", "highlight",
            "display", "show", "hide", "enable", "disable", "validate",
            "track", "measure", "improve", "enhance");

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final Clock clock;

    public PlaceholderFiller() {
        this(Clock.systemDefaultZone());
    }

    public PlaceholderFiller(Clock clock) {
        this.clock = clock;
    }

    /** Substitutes every placeholder occurrence in {@code code}. */
    public String fill(String code, String testDescription) {
        if (code == null) return "";
        String description = testDescription != null ? testDescription : "";

        List<String> features = extractFeatures(description);
        StringBuilder featureLines = new StringBuilder();
        for (String f : features) {
            if (featureLines.length() > 0) featureLines.append('\n');
            featureLines.append(" * - ").append(f);
        }

        Map<String, String> values = new LinkedHashMap<>();
        values.put("{test_id}", testId(description));
        values.put("{summary}", summary(description));
        values.put("{version}", VERSION);
        values.put("{date}", LocalDate.now(clock).format(DATE));
        values.put("{features}", featureLines.length() > 0 ? featureLines.toString() : " * - Test implementation");

        String filled = code;
        for (Map.Entry<String, String> e : values.entrySet()) {
            filled = filled.replace(e.getKey(), e.getValue());
        }
        log.debug("Filled template placeholders: test_id={}", values.get("{test_id}"));
        return filled;
    }

    /**
     * {@code TE-} followed by the initials of those of the first three words
     * that are longer than two characters, at most five; {@code TE-TEST} when none qualify.
     */
    String testId(String description) {
        String[] words = description.trim().split("\\s+");
        StringBuilder acronym = new StringBuilder();
        for (int i = 0; i < Math.min(3, words.length); i++) {
            if (words[i].length() > 2) {
                acronym.append(words[i].substring(0, 1).toUpperCase(Locale.ROOT));
            }
        }
        if (acronym.length() == 0) return "TE-TEST";
        return "TE-" + (acronym.length() > 5 ? acronym.substring(0, 5) : acronym);
    }

    String summary(String description) {
        String s = description.trim();
        return s.length() > MAX_SUMMARY ? s.substring(0, MAX_SUMMARY - 3) + "..." : s;
    }

    /**
     * Clauses of the description that name an action ("change", "hide", ...),
     * falling back to "and"/comma splits and finally to the description itself.
     */
    List<String> extractFeatures(String description) {
        List<String> features = new ArrayList<>();
        for (String clause : description.split("[.,;!?]\\s+")) {
            String c = clause.trim();
            if (c.length() > MIN_FEATURE_LENGTH && mentionsAction(c)) {
                features.add(truncate(c));
            }
        }

        if (features.isEmpty()) {
            String[] parts;
            if (description.toLowerCase(Locale.ROOT).contains(" and ")) {
                parts = description.split(" and ");
            } else if (description.contains(",")) {
                parts = description.split(",");
            } else {
                parts = new String[0];
                if (!description.isEmpty()) features.add(truncate(description));
            }
            for (String p : parts) {
                if (p.trim().length() > MIN_FEATURE_LENGTH) features.add(p.trim());
            }
        }
        return features.size() > MAX_FEATURES ? features.subList(0, MAX_FEATURES) : features;
    }

    private static boolean mentionsAction(String clause) {
        String lower = clause.toLowerCase(Locale.ROOT);
        for (String verb : FEATURE_VERBS) {
            if (lower.contains(verb)) return true;
        }
        return false;
    }

    private static String truncate(String s) {
        return s.length() > MAX_FEATURE_LENGTH ? s.substring(0, MAX_FEATURE_LENGTH) : s;
    }
}
