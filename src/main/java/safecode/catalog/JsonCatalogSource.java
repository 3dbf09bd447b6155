package safecode.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import safecode.model.BrandProfile;
import safecode.model.CodeRule;
import safecode.model.CodeTemplate;
import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;
import safecode.model.TestType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CatalogSource} backed by a JSON snapshot of one or more brands.
 *
 * <h3>Snapshot format</h3>
 * <pre>{@code
 * {
 *   "schemaVersion": "1.0",
 *   "brands": [
 *     {
 *       "brand_id": 1,
 *       "name": "VANS",
 *       "domain": "vans.com",
 *       "global_template": null,
 *       "selectors": [
 *         { "selector": "button[data-test-id='add-to-cart']",
 *           "description": "Add to cart button",
 *           "page_type": "pdp",
 *           "status": "active",
 *           "relationships": { "element_type": "interactive" } }
 *       ],
 *       "rules":     [ { "rule_type": "forbidden_pattern", "rule_content": "eval(", "priority": 1 } ],
 *       "templates": [ { "test_type": "pdp", "template_code": "..." } ]
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>Selector entries inherit the enclosing brand's id. The snapshot is
 * loaded once and never mutated, so one instance can serve concurrent callers.
 */
public class JsonCatalogSource implements CatalogSource {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogSource.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Map<Long, BrandSnapshot> brands;

    JsonCatalogSource(Snapshot snapshot) {
        Map<Long, BrandSnapshot> index = new LinkedHashMap<>();
        if (snapshot != null && snapshot.brands != null) {
            for (BrandSnapshot b : snapshot.brands) {
                if (b == null) {
                    log.warn("Ignoring null brand entry in catalog snapshot");
                    continue;
                }
                index.put(b.brandId, b.normalised());
            }
        }
        this.brands = Collections.unmodifiableMap(index);
    }

    // ── Factory ───────────────────────────────────────────────────────────

    /**
     * Loads a snapshot from a JSON file.
     * @throws IOException if the file cannot be read or is malformed
     */
    public static JsonCatalogSource load(Path path) throws IOException {
        log.debug("Loading catalog snapshot from {}", path);
        JsonCatalogSource source = new JsonCatalogSource(MAPPER.readValue(path.toFile(), Snapshot.class));
        log.info("Loaded catalog snapshot with {} brand(s) from {}", source.brands.size(), path);
        return source;
    }

    /**
     * Loads a snapshot from a stream, e.g. a classpath resource.
     * @throws IOException if the stream cannot be read or is malformed
     */
    public static JsonCatalogSource load(InputStream in) throws IOException {
        if (in == null) {
            throw new IOException("Catalog snapshot stream is null");
        }
        return new JsonCatalogSource(MAPPER.readValue(in, Snapshot.class));
    }

    // ── CatalogSource ─────────────────────────────────────────────────────

    @Override
    public List<SelectorCatalogEntry> listActiveSelectors(long brandId, PageType pageType) {
        BrandSnapshot b = brands.get(brandId);
        if (b == null) return List.of();
        List<SelectorCatalogEntry> out = new ArrayList<>();
        for (SelectorCatalogEntry e : b.selectors) {
            if (e.inScope(brandId, pageType)) out.add(e);
        }
        return out;
    }

    @Override
    public List<CodeRule> listRules(long brandId) {
        BrandSnapshot b = brands.get(brandId);
        return b == null ? List.of() : b.rules;
    }

    @Override
    public List<CodeTemplate> listTemplates(long brandId, TestType testType) {
        BrandSnapshot b = brands.get(brandId);
        if (b == null) return List.of();
        List<CodeTemplate> out = new ArrayList<>();
        for (CodeTemplate t : b.templates) {
            if (t.testType() == testType) out.add(t);
        }
        return out;
    }

    @Override
    public BrandProfile brandProfile(long brandId) {
        BrandSnapshot b = brands.get(brandId);
        if (b == null) return BrandProfile.unnamed(brandId);
        return new BrandProfile(b.brandId, b.name, b.domain, b.globalTemplate);
    }

    // ── JSON binding ──────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Snapshot {
        @JsonProperty("schemaVersion")
        String schemaVersion;

        @JsonProperty("brands")
        List<BrandSnapshot> brands = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BrandSnapshot {
        @JsonProperty("brand_id")        long   brandId;
        @JsonProperty("name")            String name;
        @JsonProperty("domain")          String domain;
        @JsonProperty("global_template") String globalTemplate;

        @JsonProperty("selectors") List<SelectorCatalogEntry> selectors = new ArrayList<>();
        @JsonProperty("rules")     List<CodeRule>             rules     = new ArrayList<>();
        @JsonProperty("templates") List<CodeTemplate>         templates = new ArrayList<>();

        /**
         * Stamps the brand id onto its selectors and drops rules of unknown type.
         * Null lists read as empty and null elements are skipped.
         */
        BrandSnapshot normalised() {
            List<SelectorCatalogEntry> stamped = new ArrayList<>();
            for (SelectorCatalogEntry e : nonNull(selectors)) {
                stamped.add(new SelectorCatalogEntry(e.getSelector(), e.getDescription(), e.getPageType(),
                        brandId, e.getStatus(), e.getRelationships()));
            }
            List<CodeRule> known = new ArrayList<>();
            for (CodeRule r : nonNull(rules)) {
                if (r.ruleType() != null) {
                    known.add(r);
                } else {
                    log.warn("Ignoring rule with unknown type for brand {}: '{}'", brandId, r.ruleContent());
                }
            }
            selectors = List.copyOf(stamped);
            rules     = List.copyOf(known);
            templates = nonNull(templates);
            return this;
        }

        private static <T> List<T> nonNull(List<T> items) {
            if (items == null) return List.of();
            List<T> kept = new ArrayList<>(items.size());
            for (T item : items) {
                if (item != null) kept.add(item);
            }
            return List.copyOf(kept);
        }
    }
}
