package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Optional structural metadata attached to a catalog selector: the element's
 * coarse type and the selectors of its parent, children and siblings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class SelectorRelationships {

    private final ElementType  elementType;
    private final String       parent;
    private final List<String> children;
    private final List<String> siblings;

    @JsonCreator
    public SelectorRelationships(@JsonProperty("element_type") ElementType elementType,
                                 @JsonProperty("parent")       String parent,
                                 @JsonProperty("children")     List<String> children,
                                 @JsonProperty("siblings")     List<String> siblings) {
        this.elementType = elementType;
        this.parent      = parent;
        this.children    = children != null ? List.copyOf(children) : List.of();
        this.siblings    = siblings != null ? List.copyOf(siblings) : List.of();
    }

    public static SelectorRelationships ofType(ElementType elementType) {
        return new SelectorRelationships(elementType, null, null, null);
    }

    @JsonProperty("element_type") public ElementType  getElementType() { return elementType; }
    @JsonProperty("parent")       public String       getParent()      { return parent; }
    @JsonProperty("children")     public List<String> getChildren()    { return children; }
    @JsonProperty("siblings")     public List<String> getSiblings()    { return siblings; }

    public boolean hasParent() {
        return parent != null && !parent.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorRelationships)) return false;
        SelectorRelationships that = (SelectorRelationships) o;
        return elementType == that.elementType
                && Objects.equals(parent, that.parent)
                && children.equals(that.children)
                && siblings.equals(that.siblings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, parent, children, siblings);
    }

    @Override
    public String toString() {
        return String.format("SelectorRelationships{type=%s, parent='%s', children=%s, siblings=%s}",
                elementType, parent, children, siblings);
    }
}
