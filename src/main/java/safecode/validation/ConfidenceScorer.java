package safecode.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.model.CodeTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Combines template adherence, rule compliance and selector validity into a
 * bounded confidence score and a reviewer recommendation.
 *
 * <pre>
 *   template  (cap 0.3)  function-name overlap with the brand template
 *   rules     (cap 0.4)  minus 0.1 per rule violation
 *   selectors (cap 0.3)  minus 0.05 per invalid selector
 * </pre>
 * Caps, penalties and thresholds come from {@link ScoringSettings}.
 */
public class ConfidenceScorer {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private static final Pattern FUNCTION_NAME = Pattern.compile("\\bfunction\\s+(\\w+)");
    private static final String  QUERY_SELECTOR = "queryselector";

    private final ScoringSettings settings;

    public ConfidenceScorer() {
        this(ScoringSettings.defaults());
    }

    public ConfidenceScorer(ScoringSettings settings) {
        this.settings = settings;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Scores against the first non-null entry of {@code templates}, if any. */
    public ConfidenceBreakdown score(String code, List<CodeTemplate> templates, ValidationResult validation) {
        CodeTemplate template = null;
        if (templates != null) {
            for (CodeTemplate t : templates) {
                if (t != null) {
                    template = t;
                    break;
                }
            }
        }
        return score(code, template, validation);
    }

    /**
     * @param code       generated code; {@code null} is treated as empty
     * @param template   the brand's reference template, or {@code null} when it has none
     * @param result     result of {@link CodeValidator} for the same code; {@code null} reads as clean
     */
    public ConfidenceBreakdown score(String code, CodeTemplate template, ValidationResult result) {
        String text = code != null ? code : "";
        ValidationResult validation = result != null ? result : ValidationResult.clean();

        double templateScore = round(templateScore(text, template));
        double ruleScore     = round(penalised(settings.ruleWeight(), settings.rulePenalty(),
                validation.ruleViolations().size()));
        double selectorScore = round(penalised(settings.selectorWeight(), settings.selectorPenalty(),
                validation.invalidSelectors().size()));

        double overall = Math.min(1.0, Math.max(0.0, round(templateScore + ruleScore + selectorScore)));

        ValidationStatus status = ValidationStatus.of(validation);
        Recommendation recommendation = recommend(overall, validation);

        log.debug("Confidence {} (template={}, rules={}, selectors={}) -> {} / {}",
                String.format("%.2f", overall), String.format("%.2f", templateScore),
                String.format("%.2f", ruleScore), String.format("%.2f", selectorScore), status, recommendation);

        return new ConfidenceBreakdown(overall, templateScore, ruleScore, selectorScore,
                validation.ruleViolations(), validation.invalidSelectors(), validation.isValid(),
                status, recommendation);
    }

    // ── Sub-scores ────────────────────────────────────────────────────────

    double templateScore(String code, CodeTemplate template) {
        if (template == null) return settings.templateAbsentScore();

        String templateCode = template.templateCode() != null ? template.templateCode().toLowerCase(Locale.ROOT) : "";
        String generated    = code.toLowerCase(Locale.ROOT);

        Set<String> templateFunctions = functionNames(templateCode);
        if (!templateFunctions.isEmpty()) {
            Set<String> common = new HashSet<>(templateFunctions);
            common.retainAll(functionNames(generated));
            return (double) common.size() / templateFunctions.size() * settings.templateWeight();
        }

        if (templateCode.contains(QUERY_SELECTOR) && generated.contains(QUERY_SELECTOR)) {
            return settings.querySelectorScore();
        }
        if (templateCode.isBlank() || generated.isEmpty()) return 0.0;

        Set<String> templateWords = words(templateCode);
        Set<String> common = new HashSet<>(templateWords);
        common.retainAll(words(generated));
        return (double) common.size() / templateWords.size() * settings.templateWeight();
    }

    private static double penalised(double cap, double penalty, int count) {
        if (count == 0) return cap;
        return Math.max(0.0, cap - penalty * count);
    }

    /** Four decimals, so that e.g. 0.4 - 0.1 compares equal to 0.3. */
    private static double round(double v) {
        return BigDecimal.valueOf(v).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    private Recommendation recommend(double overall, ValidationResult validation) {
        if (overall >= settings.safeThreshold() && validation.isValid()) return Recommendation.SAFE_TO_USE;
        if (overall >= settings.reviewThreshold())                       return Recommendation.REVIEW_CAREFULLY;
        return Recommendation.NEEDS_FIXES;
    }

    private static Set<String> functionNames(String code) {
        Set<String> names = new HashSet<>();
        Matcher m = FUNCTION_NAME.matcher(code);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    private static Set<String> words(String text) {
        Set<String> out = new HashSet<>(Arrays.asList(text.trim().split("\\s+")));
        out.remove("");
        return out;
    }
}
