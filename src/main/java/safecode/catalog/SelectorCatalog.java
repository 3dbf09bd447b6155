package safecode.catalog;

import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the active selectors for one brand and page type.
 *
 * <p>Entries outside the scope (other brand, other page, not active) are
 * dropped on construction, so every lookup is already scoped. Exact lookups
 * compare the trimmed selector string; the first entry wins on duplicates.
 */
public final class SelectorCatalog {

    private final long                              brandId;
    private final PageType                          pageType;
    private final List<SelectorCatalogEntry>        entries;
    private final Map<String, SelectorCatalogEntry> bySelector;

    private SelectorCatalog(long brandId, PageType pageType, List<SelectorCatalogEntry> entries) {
        this.brandId  = brandId;
        this.pageType = pageType;
        this.entries  = Collections.unmodifiableList(entries);
        Map<String, SelectorCatalogEntry> index = new LinkedHashMap<>();
        for (SelectorCatalogEntry e : entries) {
            index.putIfAbsent(e.getSelector().trim(), e);
        }
        this.bySelector = Collections.unmodifiableMap(index);
    }

    /**
     * Builds a scoped snapshot, keeping only active entries of the given brand and page type.
     *
     * @param entries raw entries; may be {@code null}
     */
    public static SelectorCatalog of(long brandId, PageType pageType,
                                     Collection<SelectorCatalogEntry> entries) {
        List<SelectorCatalogEntry> scoped = new ArrayList<>();
        if (entries != null) {
            for (SelectorCatalogEntry e : entries) {
                if (e != null && e.inScope(brandId, pageType)) {
                    scoped.add(e);
                }
            }
        }
        return new SelectorCatalog(brandId, pageType, scoped);
    }

    /** Reads the active selectors of one scope from a {@link CatalogSource}. */
    public static SelectorCatalog fetch(CatalogSource source, long brandId, PageType pageType) {
        return of(brandId, pageType, source.listActiveSelectors(brandId, pageType));
    }

    public static SelectorCatalog empty(long brandId, PageType pageType) {
        return new SelectorCatalog(brandId, pageType, new ArrayList<>());
    }

    /**
     * Exact-string lookup.
     *
     * @return the entry whose selector equals {@code selector} after trimming, or {@code null}
     */
    public SelectorCatalogEntry find(String selector) {
        if (selector == null) return null;
        return bySelector.get(selector.trim());
    }

    public boolean contains(String selector) {
        return find(selector) != null;
    }

    public List<SelectorCatalogEntry> entries() { return entries; }
    public List<String>               selectors() { return List.copyOf(bySelector.keySet()); }
    public long                       brandId()   { return brandId; }
    public PageType                   pageType()  { return pageType; }
    public boolean                    isEmpty()   { return entries.isEmpty(); }
    public int                        size()      { return entries.size(); }

    @Override
    public String toString() {
        return String.format("SelectorCatalog{brand=%d, page=%s, %d entries}", brandId, pageType, entries.size());
    }
}
