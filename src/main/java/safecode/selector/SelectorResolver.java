package safecode.selector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.catalog.CatalogSource;
import safecode.catalog.SelectorCatalog;
import safecode.model.ConversationTurn;
import safecode.model.SelectorCatalogEntry;

import java.util.List;

/**
 * Turns an element description plus chat context into a concrete catalog
 * selector, a disambiguation prompt, or guidance on what to supply next.
 *
 * <p>Strategies are tried in priority order, the first that applies wins:
 * <ol>
 *   <li>An explicit CSS selector typed in the current message. A catalog hit
 *       beats a merely valid selector; a valid selector absent from the
 *       catalog is accepted but flagged for review.</li>
 *   <li>A numbered answer to an earlier disambiguation prompt, read from the
 *       prompt turn's offered options or, for legacy text history, parsed
 *       from its numbered lines.</li>
 *   <li>Fuzzy matching of the description against the scoped catalog.</li>
 * </ol>
 *
 * <p>The catalog is read once per call and treated as an immutable snapshot.
 * Resolution never throws for bad input; every failure is a
 * {@link ResolutionResult} status.
 */
public class SelectorResolver {

    private static final Logger log = LoggerFactory.getLogger(SelectorResolver.class);

    private final CatalogSource           source;
    private final SelectorSyntaxValidator syntax;
    private final SelectorTextExtractor   extractor;
    private final FuzzyCatalogMatcher     matcher;
    private final ResolverSettings        settings;

    public SelectorResolver(CatalogSource source) {
        this(source, new SelectorSyntaxValidator(), MatcherSettings.defaults(), ResolverSettings.defaults());
    }

    public SelectorResolver(CatalogSource source, SelectorSyntaxValidator syntax,
                            MatcherSettings matcherSettings, ResolverSettings settings) {
        this(source, syntax, new SelectorTextExtractor(syntax, settings),
                new FuzzyCatalogMatcher(matcherSettings), settings);
    }

    SelectorResolver(CatalogSource source, SelectorSyntaxValidator syntax, SelectorTextExtractor extractor,
                     FuzzyCatalogMatcher matcher, ResolverSettings settings) {
        this.source    = source;
        this.syntax    = syntax;
        this.extractor = extractor;
        this.matcher   = matcher;
        this.settings  = settings;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Resolves against the active catalog of the request's brand and page type.
     *
     * @param request element description, scope, current message and history
     * @return the resolution; never {@code null}
     */
    public ResolutionResult resolve(ResolutionRequest request) {
        if (isBlank(request.elementDescription())) {
            log.debug("No element description; nothing to resolve");
            return ResolutionResult.noElement();
        }
        return resolve(request, SelectorCatalog.fetch(source, request.brandId(), request.pageType()));
    }

    /**
     * Resolves against an already-fetched catalog snapshot.
     *
     * @param catalog active selectors of the request's brand and page type
     */
    public ResolutionResult resolve(ResolutionRequest request, SelectorCatalog catalog) {
        String description = request.elementDescription();
        if (isBlank(description)) {
            log.debug("No element description; nothing to resolve");
            return ResolutionResult.noElement();
        }
        String message = request.userMessage();

        // ── 1. Explicit selector in the message ──────────────────────────
        ResolutionResult explicit = resolveExplicit(message, catalog);
        if (explicit != null) return explicit;

        // ── 2. Numbered answer to an earlier prompt ──────────────────────
        Integer choice = extractor.extractChoice(message);
        if (choice != null && !request.conversationContext().isEmpty()) {
            ResolutionResult chosen = resolvePriorChoice(choice, request.conversationContext(), catalog);
            if (chosen != null) return chosen;
        }

        // ── 3. Fuzzy catalog match ───────────────────────────────────────
        if (catalog.isEmpty()) {
            log.info("No active selectors for brand {} on {}; asking user to inspect the element",
                    request.brandId(), request.pageType());
            return ResolutionResult.notFound(ResolutionMessages.noSelectorsConfigured(description, request.pageType()));
        }

        List<SelectorMatch> matches = matcher.findMatches(description, catalog);

        if (choice != null && matches.size() > 1) {
            if (choice >= 1 && choice <= matches.size()) {
                SelectorMatch picked = matches.get(choice - 1);
                log.info("User picked fuzzy match #{}: {}", choice, picked.selector());
                return ResolutionResult.foundInDb(picked.selector(), List.of(picked));
            }
            log.info("Choice {} out of range 1..{}", choice, matches.size());
            return ResolutionResult.invalidChoice(matches, ResolutionMessages.invalidChoice(matches.size()));
        }

        if (matches.isEmpty()) {
            log.info("No fuzzy match for '{}'; listing available selectors", description);
            return ResolutionResult.notFound(
                    ResolutionMessages.notFoundWithOptions(description, request.pageType(), catalog.entries()));
        }
        if (matches.size() == 1) {
            SelectorMatch only = matches.get(0);
            log.info("Single fuzzy match for '{}': {} ({})", description, only.selector(),
                    String.format("%.2f", only.confidence()));
            return ResolutionResult.foundInDb(only.selector(), matches);
        }

        log.info("{} fuzzy matches for '{}'; asking user to choose", matches.size(), description);
        return ResolutionResult.multipleMatches(matches, ResolutionMessages.multipleMatches(description, matches));
    }

    /**
     * Resolves an id or class named in prose ("the id is hero-banner").
     *
     * <p>A prefixed reference is looked up as-is. A bare name is tried as
     * {@code #name} then {@code .name}; when neither is catalogued it is
     * returned as {@code #name} for review.
     *
     * @return {@code found_in_db}, {@code valid_but_not_in_db}, or {@code not_found}
     *         when the message names no id or class
     */
    public ResolutionResult resolveNamedReference(ResolutionRequest request) {
        String reference = extractor.extractNamedReference(request.userMessage(), request.conversationContext());
        if (reference == null) {
            return ResolutionResult.notFound(null);
        }
        SelectorCatalog catalog = SelectorCatalog.fetch(source, request.brandId(), request.pageType());

        List<String> candidates = reference.startsWith("#") || reference.startsWith(".")
                ? List.of(reference)
                : List.of("#" + reference, "." + reference);

        for (String candidate : candidates) {
            SelectorCatalogEntry hit = catalog.find(candidate);
            if (hit != null) {
                log.info("Named reference '{}' found in catalog as {}", reference, candidate);
                return ResolutionResult.foundInDb(hit.getSelector(), List.of(SelectorMatch.exact(hit)));
            }
        }

        String fallback = candidates.get(0);
        if (!syntax.isValid(fallback)) {
            log.debug("Named reference '{}' is not a usable selector", reference);
            return ResolutionResult.notFound(null);
        }
        log.info("Named reference '{}' not in catalog; using {} for review", reference, fallback);
        return ResolutionResult.userProvided(fallback, ResolutionMessages.userProvided(fallback));
    }

    // ── Strategies ────────────────────────────────────────────────────────

    private ResolutionResult resolveExplicit(String message, SelectorCatalog catalog) {
        List<String> candidates = extractor.extractSelectors(message);
        if (candidates.isEmpty()) return null;

        for (String candidate : candidates) {
            SelectorCatalogEntry hit = catalog.find(candidate);
            if (hit != null) {
                log.info("Explicit selector found in catalog: {}", candidate);
                return ResolutionResult.foundInDb(candidate, List.of(SelectorMatch.exact(hit)));
            }
        }
        for (String candidate : candidates) {
            if (syntax.isValid(candidate)) {
                log.info("Explicit selector not in catalog, flagged for review: {}", candidate);
                return ResolutionResult.userProvided(candidate, ResolutionMessages.userProvided(candidate));
            }
        }
        return null;
    }

    /**
     * Answers "use N" from the most recent prompt turn in the context window.
     * Returns {@code null} to fall through when no prompt is found or the
     * chosen selector is not an active catalog selector.
     */
    private ResolutionResult resolvePriorChoice(int choice, List<ConversationTurn> context, SelectorCatalog catalog) {
        int from = Math.max(0, context.size() - settings.contextWindow());
        for (int i = context.size() - 1; i >= from; i--) {
            ConversationTurn turn = context.get(i);

            String selected;
            if (turn.hasOfferedOptions()) {
                List<String> options = turn.offeredOptions();
                selected = choice >= 1 && choice <= options.size() ? options.get(choice - 1) : null;
            } else if (ResolutionMessages.isDisambiguationPrompt(turn.content())) {
                selected = extractor.extractChoiceSelector(turn.content(), choice);
            } else {
                continue;
            }

            if (selected == null || !syntax.isValid(selected)) {
                log.debug("Choice {} does not map to a usable option of the last prompt", choice);
                return null;
            }
            SelectorCatalogEntry hit = catalog.find(selected);
            if (hit == null) {
                log.debug("Chosen option {} ('{}') is not an active catalog selector", choice, selected);
                return null;
            }
            log.info("User selected option #{} from earlier prompt: {}", choice, selected);
            return ResolutionResult.foundInDb(hit.getSelector(), List.of(SelectorMatch.exact(hit)));
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
