package webagent.extract;

import webagent.extract.dom.PageNode;
import webagent.model.Selector;

import java.util.Locale;
import java.util.Optional;

/**
 * Picks the most stable reference to an element, trying in priority order:
 * ID → {@code data-testid} → Name → link target → visible text.
 *
 * <p>Attribute values are trimmed and blank values count as absent. Link targets
 * that use the {@code javascript:} pseudo-protocol are never used. An element for
 * which no strategy applies is unaddressable and yields {@link Optional#empty()}.
 */
public class SelectorSynthesizer {

    /** Maximum number of visible-text characters used for the text-match fallback. */
    static final int TEXT_MATCH_MAX_CHARS = 80;

    private static final String SCRIPT_PROTOCOL = "javascript:";

    /**
     * @param element the element to address
     * @return the highest-confidence selector, or empty when the element is unaddressable
     */
    public Optional<Selector> synthesize(PageNode element) {
        // ── 1. ID ──────────────────────────────────────────────────────
        String id = element.attr("id").strip();
        if (!id.isEmpty()) {
            return Optional.of(Selector.attributeValue("id", id));
        }

        // ── 2. Test ID ─────────────────────────────────────────────────
        String testId = element.attr("data-testid").strip();
        if (!testId.isEmpty()) {
            return Optional.of(Selector.attributeValue("data-testid", testId));
        }

        // ── 3. Name ────────────────────────────────────────────────────
        String name = element.attr("name").strip();
        if (!name.isEmpty()) {
            return Optional.of(Selector.attributeValue("name", name));
        }

        // ── 4. Link target ─────────────────────────────────────────────
        if (element.is("a")) {
            String href = element.attr("href").strip();
            if (!href.isEmpty() && !href.toLowerCase(Locale.ROOT).startsWith(SCRIPT_PROTOCOL)) {
                return Optional.of(Selector.attributeValue("href", href));
            }
        }

        // ── 5. Visible text ────────────────────────────────────────────
        String text = ElementText.truncate(ElementText.visible(element), TEXT_MATCH_MAX_CHARS).strip();
        if (!text.isEmpty()) {
            return Optional.of(Selector.textContains(text));
        }

        return Optional.empty();
    }
}
