package safecode.config;

import org.testng.annotations.Test;
import safecode.catalog.CatalogSource;
import safecode.generation.CodeGenerator;
import safecode.generation.GenerationRequest;
import safecode.generation.GenerationResponse;
import safecode.generation.UsageCost;
import safecode.model.BrandProfile;
import safecode.model.CodeRule;
import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;
import safecode.model.TestType;
import safecode.selector.MatcherSettings;
import safecode.selector.ResolverSettings;
import safecode.selector.SelectorResolver;
import safecode.selector.ResolutionRequest;
import safecode.selector.ResolutionStatus;
import safecode.validation.ScoringSettings;

import java.io.IOException;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link EngineConfig}.
 *
 * <p>Uses the package-private {@code EngineConfig(Properties)} constructor
 * to inject property values without touching the classpath.
 */
public class EngineConfigTest {

    private static final List<SelectorCatalogEntry> IMAGES = List.of(
            SelectorCatalogEntry.active(1, PageType.PDP, "#product-image", "Product image"),
            SelectorCatalogEntry.active(1, PageType.PDP, ".hero-image", "Hero image banner"));

    private static EngineConfig with(String key, String value) {
        Properties p = new Properties();
        p.setProperty(key, value);
        return new EngineConfig(p);
    }

    // ── Defaults ──────────────────────────────────────────────────────────

    @Test(description = "All accessors return documented defaults when properties are empty")
    public void testAllDefaults() {
        EngineConfig cfg = EngineConfig.defaults();

        assertThat(cfg.getMatcherSettings()).as("matcher settings").isEqualTo(MatcherSettings.defaults());
        assertThat(cfg.getResolverSettings()).as("resolver settings").isEqualTo(ResolverSettings.defaults());
        assertThat(cfg.getScoringSettings()).as("scoring settings").isEqualTo(ScoringSettings.defaults());
        assertThat(cfg.isExtendedRulesEnforced()).as("extended rules default").isFalse();
        assertThat(cfg.getUsageCost()).as("pricing").isEqualTo(UsageCost.defaults());
        assertThat(cfg.getMaxTokens()).as("max tokens").isEqualTo(8192);
    }

    @Test(description = "The shipped config.properties restates the built-in defaults")
    public void testClasspathConfigMatchesDefaults() {
        EngineConfig cfg = new EngineConfig();

        assertThat(cfg.getMatcherSettings()).isEqualTo(MatcherSettings.defaults());
        assertThat(cfg.getResolverSettings()).isEqualTo(ResolverSettings.defaults());
        assertThat(cfg.getScoringSettings()).isEqualTo(ScoringSettings.defaults());
        assertThat(cfg.getMaxTokens()).isEqualTo(8192);
    }

    // ── Overrides ─────────────────────────────────────────────────────────

    @Test(description = "matcher.max.results limits the fuzzy matcher's output")
    public void testMaxResultsOverride() {
        EngineConfig cfg = with(EngineConfig.KEY_MAX_RESULTS, "1");

        assertThat(cfg.fuzzyMatcher().findMatches("image", IMAGES))
                .extracting(m -> m.selector())
                .containsExactly("#product-image");
    }

    @Test(description = "Unparseable numbers fall back to the default")
    public void testInvalidNumbersFallBack() {
        Properties p = new Properties();
        p.setProperty(EngineConfig.KEY_MAX_RESULTS, "lots");
        p.setProperty(EngineConfig.KEY_SAFE_THRESHOLD, "high");
        p.setProperty(EngineConfig.KEY_MAX_TOKENS, " ");

        EngineConfig cfg = new EngineConfig(p);

        assertThat(cfg.getMatcherSettings().maxResults()).isEqualTo(5);
        assertThat(cfg.getScoringSettings().safeThreshold()).isEqualTo(0.8);
        assertThat(cfg.getMaxTokens()).isEqualTo(8192);
    }

    @Test(description = "Word lists are trimmed, lower-cased and may be emptied")
    public void testWordSetOverride() {
        assertThat(with(EngineConfig.KEY_BARE_NAME_STOP_WORDS, " Banner , WIDGET ,")
                .getResolverSettings().bareNameStopWords())
                .containsExactlyInAnyOrder("banner", "widget");
        assertThat(with(EngineConfig.KEY_STOP_WORDS, "").getMatcherSettings().stopWords()).isEmpty();
    }

    @Test(description = "A synonym group's triggers can be replaced without touching its labels")
    public void testSynonymOverride() {
        EngineConfig cfg = with(EngineConfig.KEY_SYNONYMS_PREFIX + "image", "hero");

        assertThat(cfg.fuzzyMatcher().impliedTypeLabels("hero")).containsExactly("image", "content", "picture");
        assertThat(cfg.fuzzyMatcher().impliedTypeLabels("photo")).isEmpty();
    }

    @Test(description = "resolver.context.window reaches the resolver settings")
    public void testContextWindowOverride() {
        assertThat(with(EngineConfig.KEY_CONTEXT_WINDOW, "2").getResolverSettings().contextWindow()).isEqualTo(2);
    }

    @Test(description = "validation.enforce.extended.rules switches on required-pattern checks")
    public void testExtendedRulesToggle() {
        List<CodeRule> rules = List.of(CodeRule.required("use strict"));

        assertThat(EngineConfig.defaults().codeValidator().validate("var a;", rules, List.of()).isValid()).isTrue();
        assertThat(with(EngineConfig.KEY_EXTENDED_RULES, "true").codeValidator()
                .validate("var a;", rules, List.of()).ruleViolations())
                .containsExactly("Missing required pattern: use strict");
    }

    @Test
    public void testPricingOverride() {
        Properties p = new Properties();
        p.setProperty(EngineConfig.KEY_COST_INPUT, "1.0");
        p.setProperty(EngineConfig.KEY_COST_OUTPUT, "2.0");

        assertThat(new EngineConfig(p).getUsageCost()).isEqualTo(new UsageCost(1.0, 2.0));
    }

    // ── Factories ─────────────────────────────────────────────────────────

    @Test
    public void testSelectorResolverFactory() {
        CatalogSource source = mock(CatalogSource.class);
        when(source.listActiveSelectors(1, PageType.PDP)).thenReturn(IMAGES);

        SelectorResolver resolver = EngineConfig.defaults().selectorResolver(source);

        assertThat(resolver.resolve(ResolutionRequest.of("hero image banner", PageType.PDP, 1)).status())
                .isEqualTo(ResolutionStatus.FOUND_IN_DB);
    }

    @Test(description = "generation.max.tokens is passed to the generator")
    public void testCodeGenerationServiceFactory() throws IOException {
        CatalogSource source = mock(CatalogSource.class);
        when(source.brandProfile(1)).thenReturn(BrandProfile.unnamed(1));
        CodeGenerator generator = mock(CodeGenerator.class);
        when(generator.generate(anyString(), eq(1024)))
                .thenReturn(new GenerationResponse("var a = 1;", 10, 10, "end_turn"));

        with(EngineConfig.KEY_MAX_TOKENS, "1024").codeGenerationService(source, generator)
                .generate(new GenerationRequest(1, PageType.PDP, TestType.PDP, "x"));

        verify(generator).generate(anyString(), eq(1024));
    }
}
