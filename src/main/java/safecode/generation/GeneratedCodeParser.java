package safecode.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the JavaScript from a generator reply.
 *
 * <p>The prompt asks for raw code, but replies also arrive fenced in
 * markdown or wrapped in a {@code {"generated_code": ...}} JSON object.
 * Parsing order:
 * <ol>
 *   <li>JSON wrapper, read with Jackson after stripping a {@code ```json} fence</li>
 *   <li>JSON wrapper that Jackson rejects: the {@code generated_code} string is cut out by regex</li>
 *   <li>raw code, with a leading {@code ```javascript}/{@code ```js}/{@code ```} fence stripped</li>
 *   <li>text that does not look like code: the first fenced block, else the reply as-is</li>
 * </ol>
 */
public class GeneratedCodeParser {

    private static final Logger log = LoggerFactory.getLogger(GeneratedCodeParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DEFAULT_NOTES     = "Generated by code generator";
    static final String DEFAULT_CHECKLIST = "Review code manually";
    static final String RAW_CHECKLIST     = "Review code manually - verify all functionality";

    private static final Pattern CODE_FIELD = Pattern.compile(
            "[\"']generated_code[\"']\\s*:\\s*[\"']((?:[^\"'\\\\]|\\\\.)*)[\"']", Pattern.DOTALL);
    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:javascript|js)?\\s*\\n(.*?)```", Pattern.DOTALL);

    private static final List<String> CODE_MARKERS =
            List.of("function", "const", "let", "var", "document.", "window.", "(", ")");

    /**
     * Code plus the optional commentary a JSON-wrapped reply carries.
     */
    public record ParsedCode(String code, String implementationNotes, String testingChecklist) {}

    public ParsedCode parse(String response) {
        String original = response != null ? response : "";
        String text = original.strip();

        if (text.contains("\"generated_code\"") || text.contains("'generated_code'")) {
            log.debug("Reply looks JSON-wrapped");
            ParsedCode wrapped = parseJsonWrapper(text, original);
            if (wrapped != null) return wrapped;
        }

        String code = stripCodeFence(text);
        if (code.isEmpty() || !looksLikeCode(code)) {
            log.warn("Generator reply does not look like JavaScript; falling back to fenced-block extraction");
            Matcher m = FENCED_BLOCK.matcher(original);
            code = m.find() ? m.group(1).strip() : text;
        }
        return new ParsedCode(code, DEFAULT_NOTES, RAW_CHECKLIST);
    }

    // ── JSON wrapper ──────────────────────────────────────────────────────

    private ParsedCode parseJsonWrapper(String text, String original) {
        String json = text;
        if (json.startsWith("```json")) {
            json = json.substring(7);
        } else if (json.startsWith("```")) {
            json = json.substring(3);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        json = json.strip();

        try {
            JsonNode root = MAPPER.readTree(json);
            if (root != null && root.isObject() && root.has("generated_code")) {
                return new ParsedCode(
                        root.path("generated_code").asText(""),
                        textOr(root, "implementation_notes", DEFAULT_NOTES),
                        textOr(root, "testing_checklist", DEFAULT_CHECKLIST));
            }
            return null;
        } catch (JsonProcessingException e) {
            log.warn("JSON-wrapped reply did not parse ({}); extracting generated_code by pattern",
                    e.getOriginalMessage());
        }

        Matcher m = CODE_FIELD.matcher(original);
        if (m.find()) {
            return new ParsedCode(unescape(m.group(1)), DEFAULT_NOTES, DEFAULT_CHECKLIST);
        }
        return null;
    }

    private static String textOr(JsonNode root, String field, String fallback) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? fallback : node.asText(fallback);
    }

    private static String unescape(String s) {
        return s.replace("\\n", "\n")
                .replace("\\t", "\t")
                .replace("\\\"", "\"")
                .replace("\\'", "'")
                .replace("\\\\", "\\");
    }

    // ── Raw code ──────────────────────────────────────────────────────────

    static String stripCodeFence(String text) {
        String s = text;
        if (s.startsWith("```javascript")) {
            s = s.substring(13);
        } else if (s.startsWith("```js")) {
            s = s.substring(5);
        } else if (s.startsWith("```")) {
            s = s.substring(3);
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.strip();
    }

    static boolean looksLikeCode(String text) {
        for (String marker : CODE_MARKERS) {
            if (text.contains(marker)) return true;
        }
        return false;
    }
}
