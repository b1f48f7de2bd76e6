package webagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * An immutable reference sufficient to relocate one element on the live page.
 *
 * <p>Wire shape: {@code {"type": ..., "attribute": ..., "value": ..., "case_sensitive": ...}}.
 * The value is never empty; construction with a blank value fails fast.
 */
@JsonPropertyOrder({"type", "attribute", "value", "case_sensitive"})
public final class Selector {

    @JsonProperty("type")
    private final SelectorKind kind;

    @JsonProperty("attribute")
    private final String attribute;

    @JsonProperty("value")
    private final String value;

    @JsonProperty("case_sensitive")
    private final boolean caseSensitive;

    @JsonCreator
    public Selector(@JsonProperty("type") SelectorKind kind,
                    @JsonProperty("attribute") String attribute,
                    @JsonProperty("value") String value,
                    @JsonProperty("case_sensitive") boolean caseSensitive) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Selector value must not be empty");
        }
        this.kind          = kind != null ? kind : SelectorKind.ATTRIBUTE_VALUE;
        this.attribute     = attribute != null ? attribute : "";
        this.value         = value;
        this.caseSensitive = caseSensitive;
    }

    /** Attribute-equality selector, case-insensitive. */
    public static Selector attributeValue(String attribute, String value) {
        return new Selector(SelectorKind.ATTRIBUTE_VALUE, attribute, value, false);
    }

    /** Visible-text substring selector, case-insensitive. */
    public static Selector textContains(String text) {
        return new Selector(SelectorKind.TEXT_CONTAINS, "text", text, false);
    }

    /** XPath selector. */
    public static Selector xpath(String expression) {
        return new Selector(SelectorKind.XPATH, "xpath", expression, true);
    }

    public SelectorKind getKind()       { return kind; }
    public String       getAttribute()  { return attribute; }
    public String       getValue()      { return value; }
    public boolean      isCaseSensitive() { return caseSensitive; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selector other)) return false;
        return caseSensitive == other.caseSensitive
                && kind == other.kind
                && attribute.equals(other.attribute)
                && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, attribute, value, caseSensitive);
    }

    @Override
    public String toString() {
        return String.format("Selector{%s %s='%s'%s}",
                kind.wireName(), attribute, value, caseSensitive ? " [CS]" : "");
    }
}
