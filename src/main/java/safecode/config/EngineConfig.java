package safecode.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.catalog.CatalogSource;
import safecode.generation.CodeGenerationService;
import safecode.generation.CodeGenerator;
import safecode.generation.GeneratedCodeParser;
import safecode.generation.PlaceholderFiller;
import safecode.generation.PromptBuilder;
import safecode.generation.UsageCost;
import safecode.selector.FuzzyCatalogMatcher;
import safecode.selector.MatcherSettings;
import safecode.selector.ResolverSettings;
import safecode.selector.SelectorResolver;
import safecode.selector.SelectorSyntaxValidator;
import safecode.selector.SelectorTextExtractor;
import safecode.selector.SynonymGroup;
import safecode.validation.CodeValidator;
import safecode.validation.ConfidenceScorer;
import safecode.validation.ScoringSettings;
import safecode.validation.TruncationDetector;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Reads engine tuning from {@code config.properties} (classpath) and builds
 * configured components.
 *
 * <p>An optional {@code config.local.properties} on the classpath overrides
 * any value of the base file. Missing keys fall back to the built-in defaults;
 * unparseable numbers log a warning and fall back too.
 *
 * <h3>Key groups</h3>
 * <table>
 *   <tr><th>Prefix</th><th>Feeds</th></tr>
 *   <tr><td>matcher.*</td><td>{@link MatcherSettings}: weights, bonuses, thresholds, stop words, synonym groups</td></tr>
 *   <tr><td>resolver.*</td><td>{@link ResolverSettings}: context window, bare-name stop words</td></tr>
 *   <tr><td>scoring.*</td><td>{@link ScoringSettings}: sub-score caps, penalties, recommendation thresholds</td></tr>
 *   <tr><td>validation.enforce.extended.rules</td><td>{@link CodeValidator}: required/length rules (default false)</td></tr>
 *   <tr><td>generation.*</td><td>{@link UsageCost} prices and the completion token limit</td></tr>
 * </table>
 */
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Matcher keys
    static final String KEY_KEYWORD_WEIGHT        = "matcher.weight.keyword";
    static final String KEY_ELEMENT_TYPE_WEIGHT   = "matcher.weight.element.type";
    static final String KEY_ELEMENT_TYPE_PARTIAL  = "matcher.weight.element.type.partial";
    static final String KEY_RELATIONSHIP_WEIGHT   = "matcher.weight.relationship";
    static final String KEY_TEST_ID_BONUS         = "matcher.bonus.test.id";
    static final String KEY_TRACKING_ID_BONUS     = "matcher.bonus.tracking.id";
    static final String KEY_ID_BONUS              = "matcher.bonus.id";
    static final String KEY_CLASS_BONUS           = "matcher.bonus.class";
    static final String KEY_JACCARD_WEIGHT        = "matcher.overlap.jaccard.weight";
    static final String KEY_RATIO_WEIGHT          = "matcher.overlap.ratio.weight";
    static final String KEY_SUBSTRING_CAP         = "matcher.substring.cap";
    static final String KEY_EXACT_THRESHOLD       = "matcher.threshold.exact";
    static final String KEY_PARTIAL_THRESHOLD     = "matcher.threshold.partial";
    static final String KEY_KEYWORD_THRESHOLD     = "matcher.threshold.keyword";
    static final String KEY_MAX_RESULTS           = "matcher.max.results";
    static final String KEY_MIN_KEYWORD_LENGTH    = "matcher.min.keyword.length";
    static final String KEY_STOP_WORDS            = "matcher.stop.words";
    static final String KEY_SYNONYMS_PREFIX       = "matcher.synonyms.";

    // Resolver keys
    static final String KEY_CONTEXT_WINDOW        = "resolver.context.window";
    static final String KEY_BARE_NAME_STOP_WORDS  = "resolver.bare.name.stop.words";

    // Scoring keys
    static final String KEY_TEMPLATE_WEIGHT       = "scoring.weight.template";
    static final String KEY_RULE_WEIGHT           = "scoring.weight.rule";
    static final String KEY_SELECTOR_WEIGHT       = "scoring.weight.selector";
    static final String KEY_TEMPLATE_ABSENT       = "scoring.template.absent";
    static final String KEY_TEMPLATE_QUERY        = "scoring.template.query.selector";
    static final String KEY_RULE_PENALTY          = "scoring.penalty.rule";
    static final String KEY_SELECTOR_PENALTY      = "scoring.penalty.selector";
    static final String KEY_SAFE_THRESHOLD        = "scoring.threshold.safe";
    static final String KEY_REVIEW_THRESHOLD      = "scoring.threshold.review";

    // Validation / generation keys
    static final String KEY_EXTENDED_RULES        = "validation.enforce.extended.rules";
    static final String KEY_COST_INPUT            = "generation.cost.input.per.million";
    static final String KEY_COST_OUTPUT           = "generation.cost.output.per.million";
    static final String KEY_MAX_TOKENS            = "generation.max.tokens";

    static final int DEFAULT_MAX_TOKENS = 8192;

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads {@code config.properties} and then {@code config.local.properties}
     * from the classpath. Either may be absent.
     *
     * @throws RuntimeException if a present base file cannot be read
     */
    public EngineConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests: uses the given properties as-is,
     * bypassing classpath I/O.
     */
    EngineConfig(Properties props) {
        this.props = props;
    }

    /** Configuration with every value at its built-in default. */
    public static EngineConfig defaults() {
        return new EngineConfig(new Properties());
    }

    // ── Settings ──────────────────────────────────────────────────────────

    public MatcherSettings getMatcherSettings() {
        MatcherSettings d = MatcherSettings.defaults();
        return new MatcherSettings(
                getDouble(KEY_KEYWORD_WEIGHT, d.keywordWeight()),
                getDouble(KEY_JACCARD_WEIGHT, d.jaccardWeight()),
                getDouble(KEY_RATIO_WEIGHT, d.ratioWeight()),
                getDouble(KEY_SUBSTRING_CAP, d.substringCap()),
                getDouble(KEY_ELEMENT_TYPE_WEIGHT, d.elementTypeWeight()),
                getDouble(KEY_ELEMENT_TYPE_PARTIAL, d.elementTypePartialWeight()),
                getDouble(KEY_TEST_ID_BONUS, d.testIdBonus()),
                getDouble(KEY_TRACKING_ID_BONUS, d.trackingIdBonus()),
                getDouble(KEY_ID_BONUS, d.idBonus()),
                getDouble(KEY_CLASS_BONUS, d.classBonus()),
                getDouble(KEY_RELATIONSHIP_WEIGHT, d.relationshipWeight()),
                getDouble(KEY_EXACT_THRESHOLD, d.exactThreshold()),
                getDouble(KEY_PARTIAL_THRESHOLD, d.partialThreshold()),
                getDouble(KEY_KEYWORD_THRESHOLD, d.keywordThreshold()),
                getInt(KEY_MAX_RESULTS, d.maxResults()),
                getInt(KEY_MIN_KEYWORD_LENGTH, d.minKeywordLength()),
                getWordSet(KEY_STOP_WORDS, d.stopWords()),
                getSynonymGroups(d.synonymGroups()));
    }

    public ResolverSettings getResolverSettings() {
        ResolverSettings d = ResolverSettings.defaults();
        return new ResolverSettings(
                getInt(KEY_CONTEXT_WINDOW, d.contextWindow()),
                getWordSet(KEY_BARE_NAME_STOP_WORDS, d.bareNameStopWords()));
    }

    public ScoringSettings getScoringSettings() {
        ScoringSettings d = ScoringSettings.defaults();
        return new ScoringSettings(
                getDouble(KEY_TEMPLATE_WEIGHT, d.templateWeight()),
                getDouble(KEY_RULE_WEIGHT, d.ruleWeight()),
                getDouble(KEY_SELECTOR_WEIGHT, d.selectorWeight()),
                getDouble(KEY_TEMPLATE_ABSENT, d.templateAbsentScore()),
                getDouble(KEY_TEMPLATE_QUERY, d.querySelectorScore()),
                getDouble(KEY_RULE_PENALTY, d.rulePenalty()),
                getDouble(KEY_SELECTOR_PENALTY, d.selectorPenalty()),
                getDouble(KEY_SAFE_THRESHOLD, d.safeThreshold()),
                getDouble(KEY_REVIEW_THRESHOLD, d.reviewThreshold()));
    }

    /** Whether required-pattern and length rules are enforced. Default: {@code false}. */
    public boolean isExtendedRulesEnforced() {
        return getBoolean(KEY_EXTENDED_RULES, false);
    }

    public UsageCost getUsageCost() {
        UsageCost d = UsageCost.defaults();
        return new UsageCost(
                getDouble(KEY_COST_INPUT, d.inputPerMillion()),
                getDouble(KEY_COST_OUTPUT, d.outputPerMillion()));
    }

    /** Completion token limit passed to the generator. Default: {@code 8192}. */
    public int getMaxTokens() {
        return getInt(KEY_MAX_TOKENS, DEFAULT_MAX_TOKENS);
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public SelectorSyntaxValidator syntaxValidator() {
        return new SelectorSyntaxValidator();
    }

    public SelectorTextExtractor textExtractor() {
        return new SelectorTextExtractor(syntaxValidator(), getResolverSettings());
    }

    public FuzzyCatalogMatcher fuzzyMatcher() {
        return new FuzzyCatalogMatcher(getMatcherSettings());
    }

    public SelectorResolver selectorResolver(CatalogSource source) {
        return new SelectorResolver(source, syntaxValidator(), getMatcherSettings(), getResolverSettings());
    }

    public CodeValidator codeValidator() {
        return new CodeValidator(isExtendedRulesEnforced());
    }

    public ConfidenceScorer confidenceScorer() {
        return new ConfidenceScorer(getScoringSettings());
    }

    public TruncationDetector truncationDetector() {
        return new TruncationDetector();
    }

    public CodeGenerationService codeGenerationService(CatalogSource source, CodeGenerator generator) {
        return new CodeGenerationService(source, generator, new PromptBuilder(), new GeneratedCodeParser(),
                new PlaceholderFiller(), codeValidator(), confidenceScorer(), truncationDetector(),
                getUsageCost(), getMaxTokens());
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {}; all engine settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded engine config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new RuntimeException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}; using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** Groups keep their default order; each group's triggers and labels can be overridden. */
    private List<SynonymGroup> getSynonymGroups(List<SynonymGroup> defaults) {
        List<SynonymGroup> groups = new ArrayList<>();
        for (SynonymGroup g : defaults) {
            String key = KEY_SYNONYMS_PREFIX + g.name();
            List<String> triggers = new ArrayList<>(getWordSet(key, new LinkedHashSet<>(g.triggers())));
            List<String> labels   = new ArrayList<>(getWordSet(key + ".labels", new LinkedHashSet<>(g.labels())));
            groups.add(new SynonymGroup(g.name(), triggers, labels));
        }
        return groups;
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    /**
     * Comma-separated, trimmed, lower-cased word set. A missing key yields
     * {@code defaultValue}; a present but empty key yields an empty set.
     */
    private Set<String> getWordSet(String key, Set<String> defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null) return defaultValue;
        Set<String> result = new LinkedHashSet<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) result.add(trimmed);
        }
        return Collections.unmodifiableSet(result);
    }
}
