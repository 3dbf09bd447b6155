package safecode.catalog;

import org.testng.annotations.Test;
import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;
import safecode.model.SelectorStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SelectorCatalogTest {

    private static final SelectorCatalogEntry TITLE =
            SelectorCatalogEntry.active(1, PageType.PDP, ".product-title", "Product title");

    @Test(description = "Entries of other brands, pages or inactive status are dropped")
    public void of_keepsOnlyScopedActiveEntries() {
        SelectorCatalog catalog = SelectorCatalog.of(1, PageType.PDP, List.of(
                TITLE,
                SelectorCatalogEntry.active(2, PageType.PDP, ".other-brand", "Other brand"),
                SelectorCatalogEntry.active(1, PageType.CART, ".cart-only", "Cart only"),
                SelectorCatalogEntry.active(1, PageType.PDP, "#gone", "Gone").withStatus(SelectorStatus.INACTIVE)));

        assertThat(catalog.selectors()).containsExactly(".product-title");
        assertThat(catalog.size()).isEqualTo(1);
    }

    @Test
    public void find_matchesTrimmedExactString() {
        SelectorCatalog catalog = SelectorCatalog.of(1, PageType.PDP, List.of(TITLE));

        assertThat(catalog.find("  .product-title ")).isEqualTo(TITLE);
        assertThat(catalog.find(".product")).isNull();
        assertThat(catalog.find(null)).isNull();
        assertThat(catalog.contains(".product-title")).isTrue();
    }

    @Test
    public void find_duplicateSelectors_firstEntryWins() {
        SelectorCatalogEntry second = SelectorCatalogEntry.active(1, PageType.PDP, ".product-title", "Duplicate");
        SelectorCatalog catalog = SelectorCatalog.of(1, PageType.PDP, List.of(TITLE, second));

        assertThat(catalog.find(".product-title").getDescription()).isEqualTo("Product title");
        assertThat(catalog.entries()).hasSize(2);
    }

    @Test
    public void of_nullEntries_isEmpty() {
        assertThat(SelectorCatalog.of(1, PageType.PDP, null).isEmpty()).isTrue();
        assertThat(SelectorCatalog.empty(1, PageType.HOME).selectors()).isEmpty();
    }

    @Test
    public void fetch_readsFromSource() {
        CatalogSource source = mock(CatalogSource.class);
        when(source.listActiveSelectors(1, PageType.PDP)).thenReturn(List.of(TITLE));

        SelectorCatalog catalog = SelectorCatalog.fetch(source, 1, PageType.PDP);

        assertThat(catalog.contains(".product-title")).isTrue();
        assertThat(catalog.brandId()).isEqualTo(1L);
        assertThat(catalog.pageType()).isEqualTo(PageType.PDP);
        verify(source).listActiveSelectors(1, PageType.PDP);
    }
}
