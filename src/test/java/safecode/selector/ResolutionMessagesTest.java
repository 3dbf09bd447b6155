package safecode.selector;

import org.testng.annotations.Test;
import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ResolutionMessagesTest {

    @Test
    public void multipleMatches_listsNumberedLabelledOptions() {
        String message = ResolutionMessages.multipleMatches("image", List.of(
                new SelectorMatch(CatalogFixtures.PRODUCT_IMAGE, 0.78, MatchType.PARTIAL),
                new SelectorMatch(CatalogFixtures.HERO_IMAGE, 0.34, MatchType.KEYWORD)));

        assertThat(message)
                .contains("1. Product image (selector: #product-image)")
                .contains("2. Hero image banner (selector: .hero-image)")
                .contains("Which selector should I use?")
                .contains("\"#product-image\"");
        assertThat(ResolutionMessages.isDisambiguationPrompt(message)).isTrue();
    }

    @Test
    public void isDisambiguationPrompt_otherText_isFalse() {
        assertThat(ResolutionMessages.isDisambiguationPrompt("Here is your code")).isFalse();
        assertThat(ResolutionMessages.isDisambiguationPrompt(null)).isFalse();
    }

    @Test
    public void notFoundWithOptions_describedEntriesFirst_atMostFive() {
        List<SelectorCatalogEntry> available = new ArrayList<>();
        available.add(SelectorCatalogEntry.active(1, PageType.PDP, "#bare", null));
        for (int i = 1; i <= 5; i++) {
            available.add(SelectorCatalogEntry.active(1, PageType.PDP, ".item-" + i, "Item " + i));
        }

        String message = ResolutionMessages.notFoundWithOptions("footer", PageType.PDP, available);

        assertThat(message)
                .contains("I couldn't find an exact match for \"footer\" on the PDP page.")
                .contains("1. .item-1 - Item 1")
                .contains("5. .item-5 - Item 5")
                .doesNotContain("#bare");
    }

    @Test
    public void notFoundWithOptions_undescribedEntriesFillRemainingSlots() {
        String message = ResolutionMessages.notFoundWithOptions("footer", PageType.CART, List.of(
                SelectorCatalogEntry.active(1, PageType.CART, "#bare", null),
                SelectorCatalogEntry.active(1, PageType.CART, ".checkout-button", "Checkout button")));

        assertThat(message)
                .contains("1. .checkout-button - Checkout button")
                .contains("2. #bare - No description");
    }

    @Test
    public void noSelectorsConfigured_explainsHowToInspect() {
        String message = ResolutionMessages.noSelectorsConfigured("hero image", PageType.HOME);

        assertThat(message)
                .contains("No selectors are configured for the HOME page")
                .contains("Right-click on the hero image")
                .contains("Inspect");
    }

    @Test
    public void invalidChoiceAndUserProvided_wording() {
        assertThat(ResolutionMessages.invalidChoice(3))
                .isEqualTo("I only found 3 selectors. Please choose a number between 1 and 3.");
        assertThat(ResolutionMessages.userProvided("#promo"))
                .isEqualTo("Using selector '#promo' (not in database, will be flagged for admin review)");
    }
}
