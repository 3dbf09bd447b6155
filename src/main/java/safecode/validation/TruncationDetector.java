package safecode.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Heuristic check for generated code that was cut off before it finished.
 *
 * <p>Code is flagged when it does not end with a statement or block terminator,
 * when its brace or parenthesis counts differ, or when one of its last three
 * lines is an unfinished call, declaration or assignment. Blank code is never
 * flagged. Stateless and thread-safe.
 */
public class TruncationDetector {

    private static final Logger log = LoggerFactory.getLogger(TruncationDetector.class);

    private static final List<String> VALID_ENDINGS = List.of("}", "});", "};", ");", ";");

    private static final List<Pattern> UNFINISHED_LINE = List.of(
            Pattern.compile("\\.observe\\([^)]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("addEventListener\\([^)]*$"),
            Pattern.compile("\\.then\\([^)]*$"),
            Pattern.compile("function\\s+\\w+\\([^)]*$"),
            Pattern.compile("const\\s+\\w+\\s*=\\s*[^;{]+$"));

    private static final int TAIL_LINES = 3;

    /** True when {@code code} looks truncated. */
    public boolean isTruncated(String code) {
        String reason = diagnose(code);
        if (reason != null) {
            log.debug("Code looks truncated: {}", reason);
        }
        return reason != null;
    }

    /**
     * Explains why {@code code} looks truncated.
     *
     * @return the first failed check, or {@code null} when the code looks complete
     */
    public String diagnose(String code) {
        if (code == null || code.isBlank()) return null;
        String stripped = code.strip();

        if (!endsProperly(stripped)) {
            String[] lines = stripped.split("\n");
            String lastLine = lines[lines.length - 1].stripTrailing();
            if (!lastLine.isEmpty() && !endsProperly(lastLine)) {
                return "ends mid-statement";
            }
        }
        if (count(code, '{') != count(code, '}')) return "unbalanced braces";
        if (count(code, '(') != count(code, ')')) return "unbalanced parentheses";

        String[] lines = stripped.split("\n");
        int from = Math.max(0, lines.length - TAIL_LINES);
        for (Pattern p : UNFINISHED_LINE) {
            for (int i = from; i < lines.length; i++) {
                if (p.matcher(lines[i]).find()) return "unfinished line: " + lines[i].strip();
            }
        }
        return null;
    }

    private static boolean endsProperly(String s) {
        for (String ending : VALID_ENDINGS) {
            if (s.endsWith(ending)) return true;
        }
        return false;
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) n++;
        }
        return n;
    }
}
