package safecode.selector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.model.ConversationTurn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls selector-like fragments out of free-form chat messages.
 *
 * <p>Four independent families, none mutually exclusive:
 * <ol>
 *   <li>{@link #extractSelectors}: explicit CSS selectors typed by the user</li>
 *   <li>{@link #extractNamedReference}: "the id is X" / "class is Y" phrasing</li>
 *   <li>{@link #extractChoice} / {@link #extractChoiceSelector}: answers to a numbered prompt</li>
 *   <li>{@link #extractElementDescription}: the element phrase itself, when upstream gave none</li>
 * </ol>
 *
 * <p>Methods that find nothing return an empty list or {@code null}; none of them throw.
 */
public class SelectorTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(SelectorTextExtractor.class);

    // ── Explicit selector patterns ────────────────────────────────────────

    /** {@code [attr]}, {@code [attr='v']}, {@code [attr*="v"]} and friends. */
    private static final String ATTR = "\\[[\\w-]+(?:[*^$|~]?=[\"'][^'\"]*[\"']?)?\\]";

    private static final Pattern QUOTED_ATTR     = Pattern.compile("[\"'](" + ATTR + ")[\"']");
    private static final Pattern QUOTED_ID_CLASS = Pattern.compile("[\"']([.#][\\w-]+)[\"']");
    private static final Pattern BARE_ATTR       = Pattern.compile(ATTR);
    private static final Pattern STANDALONE_ID    = Pattern.compile("(?<!\\S)(#[a-zA-Z][\\w-]*)(?![\\w-])");
    private static final Pattern STANDALONE_CLASS = Pattern.compile("(?<!\\S)(\\.[a-zA-Z][\\w-]*)(?![\\w-])");
    /** Leading element names accepted in {@code tag.class} / {@code tag[attr]} forms; prose like "e.g." or "vans.com" is not. */
    private static final String TAG_NAMES = String.join("|",
            "blockquote", "figcaption", "fieldset", "textarea", "section", "summary", "caption", "article",
            "details", "picture", "button", "header", "footer", "option", "select", "figure", "legend",
            "strong", "aside", "input", "label", "table", "tbody", "thead", "tfoot", "video", "audio",
            "small", "nav", "img", "svg", "span", "form", "main", "body", "html", "code", "pre", "div",
            "ul", "ol", "li", "dl", "dt", "dd", "tr", "td", "th", "em", "h1", "h2", "h3", "h4", "h5", "h6",
            "a", "b", "i", "p", "u");

    private static final Pattern COMPOUND = Pattern.compile(
            "(?<![\\w.#-])(?i:" + TAG_NAMES + ")(?:" + ATTR + "|[.#][\\w-]{2,})+");

    // ── Natural-language id/class patterns (case-insensitive, value keeps its case) ──

    private static final List<Pattern> ID_PHRASES = List.of(
            Pattern.compile("\\bid\\s*(?:is|=|:)\\s*[\"']?([a-zA-Z0-9_-]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bthe\\s+id\\s+[\"']?([a-zA-Z0-9_-]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bid\\s+[\"']?([a-zA-Z0-9_-]+)[\"']?", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> CLASS_PHRASES = List.of(
            Pattern.compile("\\bclass\\s*(?:is|=|:)\\s*[\"']?([a-zA-Z0-9_-]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bthe\\s+class\\s+[\"']?([a-zA-Z0-9_-]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bclass\\s+[\"']?([a-zA-Z0-9_-]+)[\"']?", Pattern.CASE_INSENSITIVE));

    private static final Pattern ITS_PHRASE = Pattern.compile(
            "\\bit(?:'s|s|\\s+is)\\s+[\"']?([a-zA-Z0-9_-]+)[\"']?", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_NAME   = Pattern.compile("\\b([a-zA-Z][a-zA-Z0-9_-]{2,})\\b");
    private static final Pattern ID_WORD     = Pattern.compile("\\b(?:id|identifier)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLASS_WORD  = Pattern.compile("\\bclass\\b", Pattern.CASE_INSENSITIVE);

    // ── Numbered choice patterns ──────────────────────────────────────────

    private static final Pattern CHOICE_KEYWORD = Pattern.compile("\\b(?:selector|option)\\s+(\\d{1,9})\\b");
    private static final Pattern CHOICE_VERB    = Pattern.compile("\\b(?:number|use)\\s+(\\d{1,9})\\b");
    private static final Pattern CHOICE_BARE    = Pattern.compile("^\\d{1,2}$");

    private static final int MAX_BARE_OPTION_LINE = 100;

    // ── Element description fallback ──────────────────────────────────────

    private static final List<String> ELEMENT_KEYWORDS = List.of(
            "button", "link", "text", "title", "heading", "image", "form", "input",
            "field", "label", "menu", "nav", "header", "footer", "cart", "checkout",
            "product", "name", "price", "description", "quantity", "add to cart",
            "buy now", "submit", "search", "filter", "sort");

    private static final String PAGE_WORDS = "(?:pdp|cart|checkout|home|category|search)";
    private static final Pattern CHANGE_PHRASE = Pattern.compile(
            "(?:change|modify|update|edit|adjust)\\s+([^.,!?]+?)(?:\\s+to|\\s+on|[,.!?]|$)");
    private static final Pattern ON_PAGE_PHRASE = Pattern.compile(
            "([^.,!?]+?)\\s+on\\s+" + PAGE_WORDS);
    private static final Pattern PAGE_FIRST_PHRASE = Pattern.compile(
            PAGE_WORDS + "\\s+([^.,!?]+?)(?:[,.!?]|$)");
    private static final int MAX_BIGRAM_LENGTH = 50;

    private final SelectorSyntaxValidator syntax;
    private final ResolverSettings        settings;

    public SelectorTextExtractor() {
        this(new SelectorSyntaxValidator(), ResolverSettings.defaults());
    }

    public SelectorTextExtractor(SelectorSyntaxValidator syntax, ResolverSettings settings) {
        this.syntax   = syntax;
        this.settings = settings;
    }

    // ── 1. Explicit selectors ─────────────────────────────────────────────

    /**
     * Finds every explicit CSS selector in a message.
     *
     * <p>Candidates are deduplicated (first occurrence wins), ordered by
     * specificity (compound, then attribute, then id/class, then the rest;
     * stable within a tier) and filtered through {@link SelectorSyntaxValidator}.
     *
     * @param message raw user text; may be {@code null}
     * @return valid selectors, most specific first; never {@code null}
     */
    public List<String> extractSelectors(String message) {
        if (message == null || message.isBlank()) return List.of();

        List<String> found = new ArrayList<>();
        collectGroup(QUOTED_ATTR, message, found);
        collectGroup(QUOTED_ID_CLASS, message, found);

        Matcher attr = BARE_ATTR.matcher(message);
        while (attr.find()) {
            if (!isQuoteWrapped(message, attr.start(), attr.end())) {
                found.add(attr.group());
            }
        }

        collectGroup(STANDALONE_ID, message, found);
        collectGroup(STANDALONE_CLASS, message, found);

        Matcher compound = COMPOUND.matcher(message);
        while (compound.find()) {
            found.add(compound.group());
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String s : found) {
            unique.add(s.trim());
        }
        List<String> ordered = new ArrayList<>(unique);
        ordered.sort(Comparator.comparingInt(SelectorTextExtractor::specificity).reversed());

        List<String> valid = new ArrayList<>();
        for (String s : ordered) {
            if (syntax.isValid(s)) valid.add(s);
        }
        log.debug("Extracted {} selector(s) from message: {}", valid.size(), valid);
        return valid;
    }

    /** 3 = compound (tag plus attribute/class/id), 2 = attribute, 1 = id/class, 0 = anything else. */
    static int specificity(String s) {
        if (s.isEmpty()) return 0;
        char first = s.charAt(0);
        boolean hasAttr = s.indexOf('[') >= 0;
        if (Character.isLetter(first) && (hasAttr || s.indexOf('.') > 0 || s.indexOf('#') > 0)) return 3;
        if (hasAttr) return 2;
        if (first == '#' || first == '.') return 1;
        return 0;
    }

    // ── 2. Natural-language id/class references ───────────────────────────

    /**
     * Reads an element id or class named in prose.
     *
     * <p>Returns {@code "#name"} for id phrasing ("id is 'hero'", "the id hero"),
     * {@code ".name"} for class phrasing, and for "it's name" whichever of
     * id/class the message or recent conversation talks about. As a last resort
     * the first non-generic word-like token is returned <em>unprefixed</em>
     * (or prefixed when the conversation mentions id/class), leaving the caller
     * to try both {@code #} and {@code .}.
     *
     * @param message user text; may be {@code null}
     * @param context prior turns, most recent last; may be {@code null}
     * @return the referenced selector or bare name, or {@code null} if none
     */
    public String extractNamedReference(String message, List<ConversationTurn> context) {
        if (message == null || message.isBlank()) return null;

        String recent = recentText(context);
        boolean idContext    = ID_WORD.matcher(recent).find();
        boolean classContext = CLASS_WORD.matcher(recent).find();

        String id = firstGroup(ID_PHRASES, message);
        if (id != null) return "#" + id;

        String cls = firstGroup(CLASS_PHRASES, message);
        if (cls != null) return "." + cls;

        boolean messageSaysId    = ID_WORD.matcher(message).find();
        boolean messageSaysClass = CLASS_WORD.matcher(message).find();
        Matcher its = ITS_PHRASE.matcher(message);
        if (its.find()) {
            if (idContext || messageSaysId) return "#" + its.group(1);
            if (classContext || messageSaysClass) return "." + its.group(1);
        }

        Matcher bare = BARE_NAME.matcher(message);
        while (bare.find()) {
            String token = bare.group(1);
            if (settings.bareNameStopWords().contains(token.toLowerCase(Locale.ROOT))) continue;
            if (idContext) return "#" + token;
            if (classContext) return "." + token;
            return token;
        }
        return null;
    }

    // ── 3. Numbered choices ───────────────────────────────────────────────

    /**
     * Reads a numbered choice such as "use selector 2", "option 3", "number 1",
     * "use 2" or a bare one- or two-digit reply.
     *
     * @return the 1-based choice as typed (range is checked by the caller), or {@code null}
     */
    public Integer extractChoice(String message) {
        if (message == null) return null;
        String text = message.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) return null;

        Matcher m = CHOICE_KEYWORD.matcher(text);
        if (m.find()) return Integer.valueOf(m.group(1));
        m = CHOICE_VERB.matcher(text);
        if (m.find()) return Integer.valueOf(m.group(1));
        if (CHOICE_BARE.matcher(text).matches()) return Integer.valueOf(text);
        return null;
    }

    /**
     * Finds the selector offered as option {@code choice} in an earlier prompt.
     *
     * <p>Understands {@code "N. description (selector: X)"} lines first and
     * falls back to short {@code "N. X"} lines.
     *
     * @param priorMessage the assistant message that listed the options
     * @param choice       1-based option number
     * @return the selector text, or {@code null} if option {@code choice} is not listed
     */
    public String extractChoiceSelector(String priorMessage, int choice) {
        if (priorMessage == null || priorMessage.isBlank() || choice < 0) return null;

        Pattern labelled = Pattern.compile(
                "^" + choice + "\\.\\s+.*?\\(selector:\\s*(.+)\\)\\s*$", Pattern.CASE_INSENSITIVE);
        Pattern bare = Pattern.compile("^" + choice + "\\.\\s+([^\\s)]+)(?:\\s|$)");

        for (String rawLine : priorMessage.split("\n")) {
            String line = rawLine.strip();
            Matcher m = labelled.matcher(line);
            if (m.find()) {
                String selector = m.group(1).trim();
                if (!selector.isEmpty()) return selector;
            }
            Matcher b = bare.matcher(line);
            if (b.find() && line.length() < MAX_BARE_OPTION_LINE) {
                String selector = b.group(1).trim();
                if (!selector.isEmpty() && !selector.startsWith("(")) return selector;
            }
        }
        return null;
    }

    // ── 4. Element description fallback ───────────────────────────────────

    /**
     * Recovers the element phrase from a request such as
     * "modify the checkout button on cart page".
     *
     * @return a lower-case element phrase, or {@code null} when no element keyword is present
     */
    public String extractElementDescription(String message) {
        if (message == null || message.isBlank()) return null;
        String text = message.toLowerCase(Locale.ROOT);

        for (Pattern p : List.of(CHANGE_PHRASE, ON_PAGE_PHRASE, PAGE_FIRST_PHRASE)) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                String phrase = m.group(1).trim();
                if (mentionsElement(phrase)) return phrase;
            }
        }

        for (String keyword : ELEMENT_KEYWORDS) {
            String kw = Pattern.quote(keyword);
            Matcher m = Pattern.compile("\\b(?:\\w+\\s+" + kw + "|" + kw + "\\s+\\w+)\\b").matcher(text);
            if (m.find()) {
                String phrase = m.group().trim();
                if (phrase.length() < MAX_BIGRAM_LENGTH) return phrase;
            }
        }
        return null;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static void collectGroup(Pattern p, String text, List<String> out) {
        Matcher m = p.matcher(text);
        while (m.find()) {
            out.add(m.group(1));
        }
    }

    private static boolean isQuoteWrapped(String text, int start, int end) {
        if (start == 0 || end >= text.length()) return false;
        return isQuote(text.charAt(start - 1)) && isQuote(text.charAt(end));
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static String firstGroup(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    private static boolean mentionsElement(String phrase) {
        for (String keyword : ELEMENT_KEYWORDS) {
            if (phrase.contains(keyword)) return true;
        }
        return false;
    }

    /** Joins the content of the last {@code contextWindow} turns. */
    private String recentText(List<ConversationTurn> context) {
        if (context == null || context.isEmpty()) return "";
        int from = Math.max(0, context.size() - settings.contextWindow());
        StringBuilder sb = new StringBuilder();
        for (ConversationTurn turn : context.subList(from, context.size())) {
            if (turn != null) sb.append(turn.content()).append('\n');
        }
        return sb.toString();
    }
}
