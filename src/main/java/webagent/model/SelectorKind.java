package webagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a {@link Selector} relocates its element. The wire names are the ones the
 * browser executor understands.
 */
public enum SelectorKind {

    /** Element whose attribute equals the value ({@code [id='login']}). */
    ATTRIBUTE_VALUE("attributeValueSelector"),

    /** Element whose visible text contains the value. */
    TEXT_CONTAINS("tagContainsSelector"),

    /** Element matched by an XPath expression held in the value. */
    XPATH("xpathSelector");

    private final String wireName;

    SelectorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    /**
     * Resolves a wire name, case-insensitively. Unknown or blank names map to
     * {@link #ATTRIBUTE_VALUE}, the executor's default selector type.
     */
    @JsonCreator
    public static SelectorKind fromWireName(String name) {
        if (name == null || name.isBlank()) return ATTRIBUTE_VALUE;
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (SelectorKind kind : values()) {
            if (kind.wireName.toLowerCase(Locale.ROOT).equals(n)) {
                return kind;
            }
        }
        return ATTRIBUTE_VALUE;
    }
}
