package safecode.selector;

import safecode.model.ElementType;
import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;
import safecode.model.SelectorRelationships;

import java.util.List;

/** Shared PDP catalog entries for brand 1 used across the selector tests. */
final class CatalogFixtures {

    static final SelectorCatalogEntry ADD_TO_CART = SelectorCatalogEntry
            .active(1, PageType.PDP, "button[data-test-id='add-to-cart']", "Add to cart button")
            .withRelationships(new SelectorRelationships(ElementType.INTERACTIVE, ".product-actions", null, null));

    static final SelectorCatalogEntry PRODUCT_IMAGE = SelectorCatalogEntry
            .active(1, PageType.PDP, "#product-image", "Product image")
            .withRelationships(new SelectorRelationships(ElementType.CONTENT, null, null, List.of(".product-title")));

    static final SelectorCatalogEntry HERO_IMAGE =
            SelectorCatalogEntry.active(1, PageType.PDP, ".hero-image", "Hero image banner");

    static final SelectorCatalogEntry PRODUCT_TITLE =
            SelectorCatalogEntry.active(1, PageType.PDP, ".product-title", "Product title");

    static final List<SelectorCatalogEntry> PDP =
            List.of(ADD_TO_CART, PRODUCT_IMAGE, HERO_IMAGE, PRODUCT_TITLE);

    private CatalogFixtures() {}
}
