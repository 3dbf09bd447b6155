package safecode.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.catalog.CatalogSource;
import safecode.catalog.SelectorCatalog;
import safecode.model.BrandProfile;
import safecode.model.CodeRule;
import safecode.model.CodeTemplate;
import safecode.validation.CodeValidator;
import safecode.validation.ConfidenceBreakdown;
import safecode.validation.ConfidenceScorer;
import safecode.validation.TruncationDetector;
import safecode.validation.ValidationResult;

import java.io.IOException;
import java.util.List;

/**
 * Generates test code for a brand page and reviews it before it reaches a human.
 *
 * <p>One call reads the brand context once, prompts the {@link CodeGenerator},
 * parses the reply, fills global-template placeholders, then runs truncation
 * detection, rule/selector validation and confidence scoring on the result.
 */
public class CodeGenerationService {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationService.class);

    private final CatalogSource       source;
    private final CodeGenerator       generator;
    private final PromptBuilder       prompts;
    private final GeneratedCodeParser parser;
    private final PlaceholderFiller   placeholders;
    private final CodeValidator       validator;
    private final ConfidenceScorer    scorer;
    private final TruncationDetector  truncation;
    private final UsageCost           pricing;
    private final int                 maxTokens;

    public CodeGenerationService(CatalogSource source, CodeGenerator generator) {
        this(source, generator, new PromptBuilder(), new GeneratedCodeParser(), new PlaceholderFiller(),
                new CodeValidator(), new ConfidenceScorer(), new TruncationDetector(), UsageCost.defaults(), 8192);
    }

    public CodeGenerationService(CatalogSource source, CodeGenerator generator, PromptBuilder prompts,
                                 GeneratedCodeParser parser, PlaceholderFiller placeholders,
                                 CodeValidator validator, ConfidenceScorer scorer, TruncationDetector truncation,
                                 UsageCost pricing, int maxTokens) {
        this.source       = source;
        this.generator    = generator;
        this.prompts      = prompts;
        this.parser       = parser;
        this.placeholders = placeholders;
        this.validator    = validator;
        this.scorer       = scorer;
        this.truncation   = truncation;
        this.pricing      = pricing;
        this.maxTokens    = maxTokens;
    }

    /**
     * Generates and reviews code for one request.
     *
     * @return the code with its confidence breakdown, truncation flag and usage
     * @throws CodeGenerationException if the generator call fails
     */
    public GeneratedCodeReview generate(GenerationRequest request) {
        long brandId = request.brandId();
        BrandProfile       brand     = source.brandProfile(brandId);
        SelectorCatalog    catalog   = SelectorCatalog.fetch(source, brandId, request.pageType());
        List<CodeRule>     rules     = source.listRules(brandId);
        List<CodeTemplate> templates = source.listTemplates(brandId, request.testType());

        String prompt = prompts.build(brand, catalog.entries(), rules, templates, request.description());
        log.debug("Generation prompt for brand {} ({} chars, {} selectors, {} rules)",
                brandId, prompt.length(), catalog.size(), rules.size());

        GenerationResponse response;
        try {
            response = generator.generate(prompt, maxTokens);
        } catch (IOException e) {
            log.error("Code generation failed for brand {}: {}", brandId, e.getMessage());
            throw new CodeGenerationException("Code generation failed: " + e.getMessage(), e);
        }

        if (response.hitTokenLimit()) {
            log.warn("Generator hit the token limit (max_tokens={}); output may be truncated", maxTokens);
        }
        log.info("Generator replied: stop_reason={}, completion_tokens={}/{}",
                response.stopReason(), response.completionTokens(), maxTokens);

        GeneratedCodeParser.ParsedCode parsed = parser.parse(response.text());
        String code = parsed.code();

        boolean truncated = truncation.isTruncated(code);
        if (brand.hasGlobalTemplate()) {
            code = placeholders.fill(code, request.description());
            truncated = truncation.isTruncated(code) || truncated;
        }
        if (truncated) {
            log.warn("Generated code for brand {} appears truncated{}", brandId,
                    response.hitTokenLimit() ? " (token limit reached)" : "");
        }

        ValidationResult validation = validator.validate(code, rules, catalog);
        ConfidenceBreakdown confidence = scorer.score(code, templates, validation);
        double cost = pricing.cost(response.promptTokens(), response.completionTokens());

        log.info("Generated {} chars for brand {}: confidence={} ({}), cost=${}",
                code.length(), brandId, String.format("%.2f", confidence.overallScore()),
                confidence.recommendation().value(), cost);

        return new GeneratedCodeReview(code, parsed.implementationNotes(), parsed.testingChecklist(),
                confidence, truncated, response.stopReason(),
                response.promptTokens(), response.completionTokens(), cost);
    }
}
