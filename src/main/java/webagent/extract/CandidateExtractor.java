package webagent.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webagent.extract.dom.HtmlPages;
import webagent.extract.dom.PageNode;
import webagent.model.Candidate;
import webagent.model.Selector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts the interactive elements of an HTML snapshot as a bounded,
 * deduplicated, priority-ordered list of {@link Candidate}s.
 *
 * <p>Elements are harvested in three passes over the cleaned document:
 * <ol>
 *   <li>interactive tags ({@code a, button, input, textarea, select});</li>
 *   <li>elements with an interactive ARIA {@code role};</li>
 *   <li>elements with an inline {@code onclick} handler.</li>
 * </ol>
 * Hidden inputs, disabled elements and elements without a synthesizable selector
 * are dropped. Duplicates (same tag, selector value and text prefix) keep their
 * first occurrence. The survivors are stable-sorted so form fields come first and
 * links last, truncated to {@code maxCandidates}, and numbered 0..n-1.
 *
 * <p>{@link #extract(String)} never throws: null, blank or unparsable input
 * yields an empty list.
 */
public class CandidateExtractor {

    private static final Logger log = LoggerFactory.getLogger(CandidateExtractor.class);

    public static final int DEFAULT_MAX_CANDIDATES = 40;

    /** Subtrees removed before harvesting. */
    static final List<String> NON_SEMANTIC_TAGS = List.of("script", "style", "noscript", "svg", "path");

    private static final Set<String> INTERACTIVE_TAGS =
            Set.of("a", "button", "input", "textarea", "select");
    private static final Set<String> CLICKABLE_ROLES =
            Set.of("button", "link", "tab", "menuitem", "checkbox", "radio", "switch");
    private static final Set<String> LANDMARK_TAGS =
            Set.of("form", "nav", "header", "footer", "main", "aside");
    private static final Set<String> LANDMARK_ROLES =
            Set.of("navigation", "banner", "main", "form");
    private static final Set<String> FREE_TEXT_INPUT_TYPES =
            Set.of("text", "email", "password", "search", "tel", "url");

    /** Attributes copied onto each candidate, in this order. */
    private static final List<String> CAPTURED_ATTRIBUTES =
            List.of("name", "placeholder", "href", "value", "aria-label", "title");

    private static final int ATTRIBUTE_MAX_CHARS   = 100;
    private static final int MAX_OPTIONS           = 10;
    private static final int OPTION_MAX_CHARS      = 40;
    private static final int LABEL_MAX_CHARS       = 60;
    private static final int DEDUP_TEXT_PREFIX     = 30;

    private final int maxCandidates;
    private final SelectorSynthesizer selectors;

    public CandidateExtractor() {
        this(DEFAULT_MAX_CANDIDATES);
    }

    public CandidateExtractor(int maxCandidates) {
        this(maxCandidates, new SelectorSynthesizer());
    }

    /**
     * @param maxCandidates upper bound on the returned list size (must be &gt;= 0)
     * @param selectors     selector strategy for each harvested element
     */
    public CandidateExtractor(int maxCandidates, SelectorSynthesizer selectors) {
        if (maxCandidates < 0) {
            throw new IllegalArgumentException("maxCandidates must be >= 0, got " + maxCandidates);
        }
        this.maxCandidates = maxCandidates;
        this.selectors     = selectors;
    }

    public int getMaxCandidates() { return maxCandidates; }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Parses an HTML snapshot and extracts its candidates.
     *
     * @param html raw page HTML; may be null, empty or malformed
     * @return candidates numbered 0..n-1, never null
     */
    public List<Candidate> extract(String html) {
        return HtmlPages.parse(html, NON_SEMANTIC_TAGS)
                .map(this::extract)
                .orElse(List.of());
    }

    /**
     * Extracts candidates from an already parsed document.
     *
     * @param root the document root
     * @return candidates numbered 0..n-1, never null
     */
    public List<Candidate> extract(PageNode root) {
        List<PageNode> elements = semanticElements(root);
        Map<String, String> labelsByFor = labelsByFor(elements);

        Map<String, Draft> byKey = new LinkedHashMap<>();
        int harvested = 0;

        // ── a. Interactive tags ────────────────────────────────────────
        for (PageNode el : elements) {
            if (INTERACTIVE_TAGS.contains(el.tagName())) {
                harvested += offer(byKey, el, labelsByFor);
            }
        }

        // ── b. Interactive roles ───────────────────────────────────────
        for (PageNode el : elements) {
            if (CLICKABLE_ROLES.contains(role(el))) {
                harvested += offer(byKey, el, labelsByFor);
            }
        }

        // ── c. Inline click handlers ───────────────────────────────────
        for (PageNode el : elements) {
            if (el.hasAttr("onclick")) {
                harvested += offer(byKey, el, labelsByFor);
            }
        }

        List<Draft> drafts = new ArrayList<>(byKey.values());
        drafts.sort(Comparator.comparingInt(Draft::priority));

        int limit = Math.min(maxCandidates, drafts.size());
        List<Candidate> candidates = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            candidates.add(drafts.get(i).candidate().withId(i));
        }

        log.debug("Extracted {} candidate(s) from {} harvested element(s), {} unique, max {}",
                candidates.size(), harvested, drafts.size(), maxCandidates);
        return List.copyOf(candidates);
    }

    // ── Harvesting ────────────────────────────────────────────────────────

    private static List<PageNode> semanticElements(PageNode root) {
        List<PageNode> out = new ArrayList<>();
        root.accept(node -> {
            if (NON_SEMANTIC_TAGS.contains(node.tagName())) {
                return false;
            }
            out.add(node);
            return true;
        });
        return out;
    }

    /**
     * Text of the first non-empty {@code label[for]} per target id, in document order.
     */
    private static Map<String, String> labelsByFor(List<PageNode> elements) {
        Map<String, String> labels = new HashMap<>();
        for (PageNode el : elements) {
            if (el.is("label") && !el.attr("for").isEmpty()) {
                String text = ElementText.collapse(el.text());
                if (!text.isEmpty()) {
                    labels.putIfAbsent(el.attr("for"), ElementText.truncate(text, LABEL_MAX_CHARS));
                }
            }
        }
        return labels;
    }

    /** Adds the element's draft unless its dedup key is already taken; returns 1 if harvested. */
    private int offer(Map<String, Draft> byKey, PageNode el, Map<String, String> labelsByFor) {
        Optional<Draft> draft = toDraft(el, labelsByFor);
        draft.ifPresent(d -> byKey.putIfAbsent(d.key(), d));
        return draft.isPresent() ? 1 : 0;
    }

    private Optional<Draft> toDraft(PageNode el, Map<String, String> labelsByFor) {
        String tag  = el.tagName();
        String type = el.attr("type").strip();

        if (tag.equals("option")) {
            return Optional.empty(); // folded into the owning select
        }
        if (tag.equals("input") && type.equalsIgnoreCase("hidden")) {
            return Optional.empty();
        }
        if (el.hasAttr("disabled")) {
            return Optional.empty();
        }

        Optional<Selector> selector = selectors.synthesize(el);
        if (selector.isEmpty()) {
            log.trace("Dropping unaddressable <{}>", tag);
            return Optional.empty();
        }

        String text = ElementText.visible(el);
        if (text.isEmpty()) {
            text = associatedLabel(el, labelsByFor);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        for (String name : CAPTURED_ATTRIBUTES) {
            String value = el.attr(name);
            if (!value.isEmpty()) {
                attributes.put(name, ElementText.truncate(value, ATTRIBUTE_MAX_CHARS));
            }
        }

        List<String> options = tag.equals("select") ? options(el) : List.of();

        Candidate candidate = new Candidate(-1, tag, text, type, selector.get(),
                attributes, context(el), options);
        String key = tag + ":" + selector.get().getValue() + ":"
                + ElementText.truncate(text, DEDUP_TEXT_PREFIX);
        return Optional.of(new Draft(key, priority(tag, type), candidate));
    }

    // ── Element details ───────────────────────────────────────────────────

    private static String role(PageNode el) {
        return el.attr("role").strip().toLowerCase(Locale.ROOT);
    }

    /** Nearest landmark ancestor: a structural tag, or an equivalent ARIA role. */
    private static String context(PageNode el) {
        for (PageNode p = el.parent(); p != null; p = p.parent()) {
            if (LANDMARK_TAGS.contains(p.tagName())) {
                return p.tagName();
            }
            String role = role(p);
            if (LANDMARK_ROLES.contains(role)) {
                return role;
            }
        }
        return "";
    }

    private static List<String> options(PageNode select) {
        List<String> texts = new ArrayList<>();
        List<PageNode> optionNodes = select.findAll(n -> n.is("option"));
        for (PageNode option : optionNodes.subList(0, Math.min(MAX_OPTIONS, optionNodes.size()))) {
            String text = ElementText.collapse(option.text());
            if (!text.isEmpty()) {
                texts.add(ElementText.truncate(text, OPTION_MAX_CHARS));
            }
        }
        return texts;
    }

    /**
     * Text of the label bound to the element: a {@code label[for=id]} anywhere in
     * the document, else an ancestor {@code label} whose text differs from the
     * element's own.
     */
    private static String associatedLabel(PageNode el, Map<String, String> labelsByFor) {
        String id = el.attr("id");
        if (!id.isEmpty() && labelsByFor.containsKey(id)) {
            return labelsByFor.get(id);
        }

        Optional<PageNode> wrapping = el.closestAncestor(n -> n.is("label"));
        if (wrapping.isPresent()) {
            String labelText = ElementText.truncate(ElementText.collapse(wrapping.get().text()), LABEL_MAX_CHARS);
            if (!labelText.equals(ElementText.collapse(el.text()))) {
                return labelText;
            }
        }
        return "";
    }

    /**
     * Sort rank, lower first: free-text inputs, textarea, select, submit inputs,
     * buttons, checkboxes/radios, links, everything else. An input without a
     * {@code type} is a text input.
     */
    static int priority(String tag, String type) {
        String t = type.toLowerCase(Locale.ROOT);
        if (tag.equals("input") && t.isEmpty()) {
            t = "text";
        }
        if (tag.equals("input") && FREE_TEXT_INPUT_TYPES.contains(t)) return 10;
        if (tag.equals("textarea"))                                   return 11;
        if (tag.equals("select"))                                     return 12;
        if (tag.equals("input") && t.equals("submit"))                return 15;
        if (tag.equals("button"))                                     return 20;
        if (tag.equals("input") && (t.equals("checkbox") || t.equals("radio"))) return 25;
        if (tag.equals("a"))                                          return 30;
        return 40;
    }

    /** Harvested element before ordering; the key and priority never leave this class. */
    private record Draft(String key, int priority, Candidate candidate) {}
}
