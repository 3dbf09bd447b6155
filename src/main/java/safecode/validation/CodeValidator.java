package safecode.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.catalog.SelectorCatalog;
import safecode.model.CodeRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks generated code against a brand's rules and approved selectors.
 *
 * <h3>Rules</h3>
 * Forbidden patterns are always enforced as case-insensitive substrings.
 * Required patterns and length limits are enforced only when the validator
 * is built with {@code enforceExtendedRules}.
 *
 * <h3>Selectors</h3>
 * Selectors are read from {@code querySelector}/{@code querySelectorAll}/
 * {@code getElementById} calls, {@code classList[...]} access and quoted
 * {@code .class}/{@code #id} literals. A used selector counts as invalid only
 * when it is neither an exact catalog selector nor a substring or superstring
 * of one. That tolerance accepts {@code .button} next to a catalogued
 * {@code .checkout-button}, and can equally let a wrong selector through when
 * it shares a short fragment with a catalogued one. Ids passed to
 * {@code getElementById} are compared as {@code #id}, which is stricter than
 * comparing the bare name: {@code getElementById('x')} is not approved by a
 * catalogued {@code .x-thing}.
 *
 * <p>Stateless and thread-safe; never throws for malformed input.
 */
public class CodeValidator {

    private static final Logger log = LoggerFactory.getLogger(CodeValidator.class);

    /** Quote-delimited call argument; the other quote kind may appear inside, e.g. {@code "a[href='x']"}. */
    private static final String QUOTED_ARG = "\\(\\s*([\"'])(?<sel>.*?)\\1\\s*\\)";

    private static final Pattern QUERY_SELECTOR     = Pattern.compile("querySelector" + QUOTED_ARG);
    private static final Pattern QUERY_SELECTOR_ALL = Pattern.compile("querySelectorAll" + QUOTED_ARG);
    private static final Pattern GET_ELEMENT_BY_ID  = Pattern.compile("getElementById" + QUOTED_ARG);
    private static final Pattern CLASS_LIST_ACCESS  = Pattern.compile("\\.classList\\[\\s*([\"'])(?<sel>.*?)\\1\\s*\\]");
    private static final Pattern QUOTED_ID_CLASS    = Pattern.compile("[\"'](?<sel>[.#][\\w-]+)[\"']");

    private final boolean enforceExtendedRules;

    public CodeValidator() {
        this(false);
    }

    /**
     * @param enforceExtendedRules also check required patterns and length limits
     */
    public CodeValidator(boolean enforceExtendedRules) {
        this.enforceExtendedRules = enforceExtendedRules;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Validates against the selectors of a scoped catalog snapshot. */
    public ValidationResult validate(String code, Collection<CodeRule> rules, SelectorCatalog catalog) {
        return validate(code, rules, catalog.selectors());
    }

    /**
     * @param code              generated code; {@code null} is treated as empty
     * @param rules             brand rules; may be {@code null}
     * @param approvedSelectors catalog selectors the code may use; may be {@code null}
     */
    public ValidationResult validate(String code, Collection<CodeRule> rules, Collection<String> approvedSelectors) {
        String text = code != null ? code : "";

        List<String> violations = checkRules(text, rules);
        List<String> invalid    = checkSelectors(text, approvedSelectors);

        ValidationResult result = new ValidationResult(violations, invalid);
        if (result.isValid()) {
            log.debug("Code passed validation ({} chars)", text.length());
        } else {
            log.info("Code validation found {} rule violation(s) and {} invalid selector(s)",
                    violations.size(), invalid.size());
        }
        return result;
    }

    /**
     * Selectors the code references, in first-seen order. Ids passed to
     * {@code getElementById} are returned with a {@code #} prefix.
     */
    public Set<String> extractUsedSelectors(String code) {
        Set<String> used = new LinkedHashSet<>();
        if (code == null || code.isEmpty()) return used;

        collect(QUERY_SELECTOR, code, used, false);
        collect(QUERY_SELECTOR_ALL, code, used, false);
        collect(GET_ELEMENT_BY_ID, code, used, true);
        collect(CLASS_LIST_ACCESS, code, used, false);
        collect(QUOTED_ID_CLASS, code, used, false);
        return used;
    }

    // ── Rules ─────────────────────────────────────────────────────────────

    private List<String> checkRules(String code, Collection<CodeRule> rules) {
        List<String> violations = new ArrayList<>();
        if (rules == null) return violations;

        String lower = code.toLowerCase(Locale.ROOT);
        for (CodeRule rule : rules) {
            if (rule == null || rule.ruleType() == null) continue;
            String content = rule.ruleContent();

            String violation = switch (rule.ruleType()) {
                case FORBIDDEN_PATTERN -> !content.isEmpty() && lower.contains(content.toLowerCase(Locale.ROOT))
                        ? "Found forbidden pattern: " + content : null;
                case REQUIRED_PATTERN -> enforceExtendedRules && !content.isEmpty()
                        && !lower.contains(content.toLowerCase(Locale.ROOT))
                        ? "Missing required pattern: " + content : null;
                case MAX_LENGTH -> enforceExtendedRules ? checkMaxLength(code, content) : null;
                case MIN_LENGTH -> enforceExtendedRules ? checkMinLength(code, content) : null;
            };
            if (violation != null) {
                log.debug("Rule violation: {}", violation);
                violations.add(violation);
            }
        }
        return violations;
    }

    private static String checkMaxLength(String code, String content) {
        Integer limit = parseLimit(content);
        if (limit == null || code.length() <= limit) return null;
        return "Code length " + code.length() + " exceeds maximum " + limit;
    }

    private static String checkMinLength(String code, String content) {
        Integer limit = parseLimit(content);
        if (limit == null || code.length() >= limit) return null;
        return "Code length " + code.length() + " is below minimum " + limit;
    }

    private static Integer parseLimit(String content) {
        try {
            return Integer.valueOf(content.trim());
        } catch (NumberFormatException e) {
            log.warn("Skipping length rule with non-numeric content '{}'", content);
            return null;
        }
    }

    // ── Selectors ─────────────────────────────────────────────────────────

    private List<String> checkSelectors(String code, Collection<String> approvedSelectors) {
        Set<String> approved = new LinkedHashSet<>();
        if (approvedSelectors != null) {
            for (String s : approvedSelectors) {
                if (s != null && !s.isBlank()) approved.add(s.trim());
            }
        }

        List<String> invalid = new ArrayList<>();
        for (String used : extractUsedSelectors(code)) {
            if (approved.contains(used) || overlapsAny(used, approved)) continue;
            invalid.add(used);
        }
        return invalid;
    }

    private static boolean overlapsAny(String used, Set<String> approved) {
        for (String a : approved) {
            if (a.contains(used) || used.contains(a)) return true;
        }
        return false;
    }

    private static void collect(Pattern p, String code, Set<String> out, boolean idLookup) {
        Matcher m = p.matcher(code);
        while (m.find()) {
            String s = normalize(m.group("sel"));
            if (s.isEmpty()) continue;
            out.add(idLookup && !s.startsWith("#") ? "#" + s : s);
        }
    }

    private static String normalize(String raw) {
        String s = raw.trim();
        while (!s.isEmpty() && (s.charAt(0) == '"' || s.charAt(0) == '\'')) s = s.substring(1);
        while (!s.isEmpty() && (s.charAt(s.length() - 1) == '"' || s.charAt(s.length() - 1) == '\'')) {
            s = s.substring(0, s.length() - 1);
        }
        return s.trim();
    }
}
