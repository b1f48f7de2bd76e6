package webagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One addressable, interactive element surfaced from a page snapshot.
 *
 * <p>Candidates are produced by {@code CandidateExtractor} and carry a contiguous
 * {@code id} (0..n-1) in their final order; the reasoning service refers to them
 * by that id. {@code options} is non-empty only for {@code <select>} elements and
 * is omitted from the JSON otherwise.
 */
@JsonPropertyOrder({"id", "tag", "text", "type", "selector", "attributes", "context", "options"})
public final class Candidate {

    @JsonProperty("id")
    private final int id;

    @JsonProperty("tag")
    private final String tag;

    @JsonProperty("text")
    private final String text;

    /** Element subtype as written in the markup, e.g. the input {@code type}; may be empty. */
    @JsonProperty("type")
    private final String type;

    @JsonProperty("selector")
    private final Selector selector;

    @JsonProperty("attributes")
    private final Map<String, String> attributes;

    /** Nearest structural landmark ({@code form}, {@code nav}, ...) or empty. */
    @JsonProperty("context")
    private final String context;

    @JsonProperty("options")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<String> options;

    public Candidate(int id, String tag, String text, String type, Selector selector,
                     Map<String, String> attributes, String context, List<String> options) {
        this.id         = id;
        this.tag        = Objects.requireNonNull(tag, "tag");
        this.text       = text != null ? text : "";
        this.type       = type != null ? type : "";
        this.selector   = Objects.requireNonNull(selector, "selector");
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
        this.context    = context != null ? context : "";
        this.options    = options != null ? List.copyOf(options) : List.of();
    }

    /** Returns a copy of this candidate carrying a different id. */
    public Candidate withId(int newId) {
        return new Candidate(newId, tag, text, type, selector, attributes, context, options);
    }

    public int                 getId()         { return id; }
    public String              getTag()        { return tag; }
    public String              getText()       { return text; }
    public String              getType()       { return type; }
    public Selector            getSelector()   { return selector; }
    public Map<String, String> getAttributes() { return attributes; }
    public String              getContext()    { return context; }
    public List<String>        getOptions()    { return options; }

    /** Convenience: an allow-listed attribute value, or empty string. */
    public String attribute(String name) {
        return attributes.getOrDefault(name, "");
    }

    @JsonIgnore public boolean hasOptions() { return !options.isEmpty(); }
    @JsonIgnore public boolean hasContext() { return !context.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Candidate other)) return false;
        return id == other.id
                && tag.equals(other.tag)
                && text.equals(other.text)
                && type.equals(other.type)
                && selector.equals(other.selector)
                && attributes.equals(other.attributes)
                && context.equals(other.context)
                && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tag, text, type, selector, attributes, context, options);
    }

    @Override
    public String toString() {
        return String.format("Candidate{id=%d, <%s>, text='%s', selector=%s}", id, tag, text, selector);
    }
}
