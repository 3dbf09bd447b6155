package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One admin-approved CSS selector for a brand and page type.
 *
 * <p>Entries are owned by the catalog management service; this engine only
 * reads immutable snapshots of them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SelectorCatalogEntry {

    private final String                selector;
    private final String                description;
    private final PageType              pageType;
    private final long                  brandId;
    private final SelectorStatus        status;
    private final SelectorRelationships relationships;

    @JsonCreator
    public SelectorCatalogEntry(@JsonProperty("selector")      String selector,
                                @JsonProperty("description")   String description,
                                @JsonProperty("page_type")     PageType pageType,
                                @JsonProperty("brand_id")      long brandId,
                                @JsonProperty("status")        SelectorStatus status,
                                @JsonProperty("relationships") SelectorRelationships relationships) {
        this.selector      = selector != null ? selector : "";
        this.description   = description;
        this.pageType      = pageType;
        this.brandId       = brandId;
        this.status        = status != null ? status : SelectorStatus.ACTIVE;
        this.relationships = relationships;
    }

    /** Convenience factory for an active entry without relationship metadata. */
    public static SelectorCatalogEntry active(long brandId, PageType pageType,
                                              String selector, String description) {
        return new SelectorCatalogEntry(selector, description, pageType, brandId,
                SelectorStatus.ACTIVE, null);
    }

    @JsonProperty("selector")      public String                getSelector()      { return selector; }
    @JsonProperty("description")   public String                getDescription()   { return description; }
    @JsonProperty("page_type")     public PageType              getPageType()      { return pageType; }
    @JsonProperty("brand_id")      public long                  getBrandId()       { return brandId; }
    @JsonProperty("status")        public SelectorStatus        getStatus()        { return status; }
    @JsonProperty("relationships") public SelectorRelationships getRelationships() { return relationships; }

    @JsonIgnore
    public boolean isActive() {
        return status == SelectorStatus.ACTIVE;
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    /** True when this entry belongs to the given brand/page scope and is active. */
    public boolean inScope(long brandId, PageType pageType) {
        return this.brandId == brandId && this.pageType == pageType && isActive();
    }

    /** Returns a copy of this entry with a different status. */
    public SelectorCatalogEntry withStatus(SelectorStatus newStatus) {
        return new SelectorCatalogEntry(selector, description, pageType, brandId, newStatus, relationships);
    }

    /** Returns a copy of this entry carrying the given relationship metadata. */
    public SelectorCatalogEntry withRelationships(SelectorRelationships rel) {
        return new SelectorCatalogEntry(selector, description, pageType, brandId, status, rel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorCatalogEntry)) return false;
        SelectorCatalogEntry that = (SelectorCatalogEntry) o;
        return brandId == that.brandId
                && selector.equals(that.selector)
                && Objects.equals(description, that.description)
                && pageType == that.pageType
                && status == that.status
                && Objects.equals(relationships, that.relationships);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, description, pageType, brandId, status, relationships);
    }

    @Override
    public String toString() {
        return String.format("SelectorCatalogEntry{'%s' (%s) brand=%d page=%s %s}",
                selector, description, brandId, pageType, status);
    }
}
