package safecode.selector;

import org.testng.annotations.Test;
import safecode.model.ConversationTurn;
import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SelectorTextExtractor}: explicit selectors, prose
 * id/class references, numbered choices and element-phrase recovery.
 */
public class SelectorTextExtractorTest {

    private final SelectorTextExtractor extractor = new SelectorTextExtractor();

    // ── Explicit selectors ────────────────────────────────────────────────

    @Test
    public void extractSelectors_standaloneId() {
        assertThat(extractor.extractSelectors("Please use #nonexistent-id for this"))
                .containsExactly("#nonexistent-id");
    }

    @Test
    public void extractSelectors_idFollowedByPunctuation() {
        assertThat(extractor.extractSelectors("The banner is #hero-banner."))
                .containsExactly("#hero-banner");
    }

    @Test
    public void extractSelectors_compoundRanksBeforeBareAttribute() {
        assertThat(extractor.extractSelectors("Use button[data-test-id='add-to-cart'] please"))
                .containsExactly("button[data-test-id='add-to-cart']", "[data-test-id='add-to-cart']");
    }

    @Test
    public void extractSelectors_quotedIdAndClass_keepMessageOrder() {
        assertThat(extractor.extractSelectors("Try \".product-title\" or '#main'"))
                .containsExactly(".product-title", "#main");
    }

    @Test
    public void extractSelectors_quotedAttribute() {
        assertThat(extractor.extractSelectors("the selector is \"[data-testid='promo']\""))
                .containsExactly("[data-testid='promo']");
    }

    @Test
    public void extractSelectors_tagWithClass() {
        assertThat(extractor.extractSelectors("change div.card-body color"))
                .containsExactly("div.card-body");
    }

    @Test(description = "Dotted prose is not a tag.class compound")
    public void extractSelectors_ignoresAbbreviationsAndDomains() {
        assertThat(extractor.extractSelectors("Change the add to cart button, e.g. make it green")).isEmpty();
        assertThat(extractor.extractSelectors("On vans.com make the add to cart button green")).isEmpty();
        assertThat(extractor.extractSelectors("Make it red.Thanks")).isEmpty();
        assertThat(extractor.extractSelectors("i.e. run it at 5 p.m. daily")).isEmpty();
    }

    @Test
    public void extractSelectors_tagWithClassAndId() {
        assertThat(extractor.extractSelectors("style h1.title#main like a[href]"))
                .containsExactly("h1.title#main", "a[href]", "[href]");
    }

    @Test
    public void extractSelectors_duplicatesCollapse() {
        assertThat(extractor.extractSelectors("#promo and again #promo"))
                .containsExactly("#promo");
    }

    @Test
    public void extractSelectors_plainProse_isEmpty() {
        assertThat(extractor.extractSelectors("make the add to cart button red")).isEmpty();
        assertThat(extractor.extractSelectors(null)).isEmpty();
        assertThat(extractor.extractSelectors("version 2.5 is out")).isEmpty();
    }

    @Test
    public void specificity_ordersCompoundAttributeIdClass() {
        assertThat(SelectorTextExtractor.specificity("a[href]")).isEqualTo(3);
        assertThat(SelectorTextExtractor.specificity("[href]")).isEqualTo(2);
        assertThat(SelectorTextExtractor.specificity("#id")).isEqualTo(1);
        assertThat(SelectorTextExtractor.specificity(".cls")).isEqualTo(1);
        assertThat(SelectorTextExtractor.specificity("span")).isEqualTo(0);
    }

    // ── Named id/class references ─────────────────────────────────────────

    @Test
    public void extractNamedReference_idPhrase() {
        assertThat(extractor.extractNamedReference("the id is hero-banner", null)).isEqualTo("#hero-banner");
        assertThat(extractor.extractNamedReference("id='Promo_Top'", null)).isEqualTo("#Promo_Top");
    }

    @Test
    public void extractNamedReference_classPhrase() {
        assertThat(extractor.extractNamedReference("class='promo-banner'", null)).isEqualTo(".promo-banner");
        assertThat(extractor.extractNamedReference("it has the class product-card", null))
                .isEqualTo(".product-card");
    }

    @Test
    public void extractNamedReference_itsUsesConversationContext() {
        List<ConversationTurn> askedForId = List.of(ConversationTurn.assistant("What is the element id?"));
        List<ConversationTurn> askedForClass = List.of(ConversationTurn.assistant("Which class does it use?"));

        assertThat(extractor.extractNamedReference("it's hero-banner", askedForId)).isEqualTo("#hero-banner");
        assertThat(extractor.extractNamedReference("it is hero-banner", askedForClass)).isEqualTo(".hero-banner");
    }

    @Test
    public void extractNamedReference_bareTokenWithoutContext_isUnprefixed() {
        assertThat(extractor.extractNamedReference("hero-banner", List.of())).isEqualTo("hero-banner");
    }

    @Test
    public void extractNamedReference_onlyGenericWords_isNull() {
        assertThat(extractor.extractNamedReference("please use the product", null)).isNull();
        assertThat(extractor.extractNamedReference(null, null)).isNull();
    }

    @Test
    public void extractNamedReference_contextOutsideWindow_isIgnored() {
        ResolverSettings narrow = new ResolverSettings(1, ResolverSettings.DEFAULT_BARE_NAME_STOP_WORDS);
        SelectorTextExtractor windowed = new SelectorTextExtractor(new SelectorSyntaxValidator(), narrow);
        List<ConversationTurn> context = List.of(
                ConversationTurn.assistant("What is the element id?"),
                ConversationTurn.user("hold on"));

        assertThat(windowed.extractNamedReference("hero-banner", context)).isEqualTo("hero-banner");
        assertThat(extractor.extractNamedReference("hero-banner", context)).isEqualTo("#hero-banner");
    }

    @Test
    public void extractNamedReference_customStopWords() {
        SelectorTextExtractor custom = new SelectorTextExtractor(new SelectorSyntaxValidator(),
                new ResolverSettings(5, Set.of("banner")));

        assertThat(custom.extractNamedReference("banner widget", null)).isEqualTo("widget");
    }

    // ── Numbered choices ──────────────────────────────────────────────────

    @Test
    public void extractChoice_recognisedForms() {
        assertThat(extractor.extractChoice("use selector 2")).isEqualTo(2);
        assertThat(extractor.extractChoice("Option 3 please")).isEqualTo(3);
        assertThat(extractor.extractChoice("number 1")).isEqualTo(1);
        assertThat(extractor.extractChoice("use 4")).isEqualTo(4);
        assertThat(extractor.extractChoice(" 12 ")).isEqualTo(12);
    }

    @Test
    public void extractChoice_otherNumbers_areIgnored() {
        assertThat(extractor.extractChoice("I have 2 buttons")).isNull();
        assertThat(extractor.extractChoice("123")).isNull();
        assertThat(extractor.extractChoice("")).isNull();
        assertThat(extractor.extractChoice(null)).isNull();
    }

    @Test
    public void extractChoiceSelector_labelledLines() {
        List<SelectorMatch> matches = List.of(
                new SelectorMatch(SelectorCatalogEntry.active(1, PageType.PDP, "#product-image", "Product image"),
                        0.78, MatchType.PARTIAL),
                new SelectorMatch(SelectorCatalogEntry.active(1, PageType.PDP, ".hero-image", "Hero image banner"),
                        0.34, MatchType.KEYWORD));
        String prompt = ResolutionMessages.multipleMatches("image", matches);

        assertThat(extractor.extractChoiceSelector(prompt, 1)).isEqualTo("#product-image");
        assertThat(extractor.extractChoiceSelector(prompt, 2)).isEqualTo(".hero-image");
        assertThat(extractor.extractChoiceSelector(prompt, 3)).isNull();
    }

    @Test
    public void extractChoiceSelector_selectorWithParentheses() {
        String prompt = "1. Add to cart (selector: button:not(.disabled))";

        assertThat(extractor.extractChoiceSelector(prompt, 1)).isEqualTo("button:not(.disabled)");
    }

    @Test
    public void extractChoiceSelector_bareLines() {
        String prompt = "Pick one:\n  1. #promo\n  2. .banner\n";

        assertThat(extractor.extractChoiceSelector(prompt, 2)).isEqualTo(".banner");
    }

    @Test
    public void extractChoiceSelector_longProseLine_isNotASelector() {
        String prompt = "1. " + "word ".repeat(30);

        assertThat(extractor.extractChoiceSelector(prompt, 1)).isNull();
    }

    // ── Element description ───────────────────────────────────────────────

    @Test
    public void extractElementDescription_changeVerbPhrase() {
        assertThat(extractor.extractElementDescription("Modify the checkout button on cart page"))
                .isEqualTo("the checkout button");
    }

    @Test
    public void extractElementDescription_keywordBigram() {
        assertThat(extractor.extractElementDescription("make the hero image bigger")).isEqualTo("hero image");
    }

    @Test
    public void extractElementDescription_noElementKeyword_isNull() {
        assertThat(extractor.extractElementDescription("hello there")).isNull();
        assertThat(extractor.extractElementDescription(null)).isNull();
    }
}
