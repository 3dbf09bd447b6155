package safecode.catalog;

import safecode.model.BrandProfile;
import safecode.model.CodeRule;
import safecode.model.CodeTemplate;
import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;
import safecode.model.TestType;

import java.util.List;

/**
 * Read-only view of the brand data owned by the catalog management service.
 *
 * <p>Implementations return already-materialised lists; callers read them
 * once per request and treat the result as an immutable snapshot.
 */
public interface CatalogSource {

    /** Active selectors for one brand and page type, in catalog order. */
    List<SelectorCatalogEntry> listActiveSelectors(long brandId, PageType pageType);

    /** All code rules configured for the brand. */
    List<CodeRule> listRules(long brandId);

    /** Templates for the brand and test type; callers use at most the first one. */
    List<CodeTemplate> listTemplates(long brandId, TestType testType);

    /** Brand name, domain and global template; defaults to an anonymous profile. */
    default BrandProfile brandProfile(long brandId) {
        return BrandProfile.unnamed(brandId);
    }
}
