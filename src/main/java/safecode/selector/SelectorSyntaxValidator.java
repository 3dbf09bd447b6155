package safecode.selector;

import java.util.regex.Pattern;

/**
 * Cheap plausibility check for CSS selector strings.
 *
 * <p>This is not a CSS parser. A candidate is accepted when it:
 * <ul>
 *   <li>is non-blank after trimming</li>
 *   <li>starts with {@code . # [ : *} or a letter</li>
 *   <li>contains none of {@code < > { } ;}</li>
 *   <li>has balanced {@code []} and {@code ()} counts and an even number of each quote character</li>
 * </ul>
 *
 * <p>Total: never throws, {@code null} is treated as empty. Stateless and thread-safe.
 */
public class SelectorSyntaxValidator {

    private static final Pattern VALID_START   = Pattern.compile("^[.#\\[:*a-zA-Z]");
    private static final Pattern INVALID_CHARS = Pattern.compile("[<>{};]");
    private static final Pattern LETTER_START  = Pattern.compile("^[a-zA-Z]");

    /**
     * Validates and classifies a candidate selector.
     *
     * @param candidate raw candidate text; may be {@code null}
     * @return the check result; {@code error} is set only when the candidate is rejected
     */
    public SyntaxCheck check(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return new SyntaxCheck(false, SelectorKind.UNKNOWN, "", "Selector is empty");
        }
        String normalized = candidate.trim();
        SelectorKind kind = classify(normalized);
        if (!isPlausible(normalized)) {
            return new SyntaxCheck(false, kind, normalized, "Invalid CSS selector syntax: " + normalized);
        }
        return new SyntaxCheck(true, kind, normalized, null);
    }

    /** Shorthand for {@code check(candidate).valid()}. */
    public boolean isValid(String candidate) {
        return check(candidate).valid();
    }

    SelectorKind classify(String s) {
        if (s.startsWith("#")) return SelectorKind.ID;
        if (s.startsWith(".")) return SelectorKind.CLASS;
        if (s.startsWith("[")) return SelectorKind.ATTRIBUTE;
        boolean innerClassOrId = s.indexOf('.') > 0 || s.indexOf('#') > 0;
        if (s.contains("[") || innerClassOrId) return SelectorKind.COMPOUND;
        if (LETTER_START.matcher(s).find()) return SelectorKind.TAG;
        return SelectorKind.UNKNOWN;
    }

    private static boolean isPlausible(String s) {
        if (!VALID_START.matcher(s).find()) return false;
        if (INVALID_CHARS.matcher(s).find()) return false;
        if (count(s, '[') != count(s, ']')) return false;
        if (count(s, '(') != count(s, ')')) return false;
        return count(s, '\'') % 2 == 0 && count(s, '"') % 2 == 0;
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) n++;
        }
        return n;
    }

    /**
     * Outcome of {@link #check(String)}.
     *
     * @param valid      whether the selector is plausible CSS
     * @param kind       classification by leading character
     * @param normalized trimmed selector text ({@code ""} for null input)
     * @param error      rejection reason, {@code null} when valid
     */
    public record SyntaxCheck(boolean valid, SelectorKind kind, String normalized, String error) {}
}
