package webagent.extract;

import webagent.extract.dom.HtmlPages;
import webagent.extract.dom.PageNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a short text digest of a page (title, leading headings, form fields)
 * that gives the reasoning service context beyond the candidate list.
 *
 * <p>Example output:
 * <pre>
 * Page: Sign in
 * Headings:
 *   h1: Welcome back
 * Forms:
 *   Form fields: Email, Password
 * </pre>
 */
public class PageDigester {

    /** Returned for null or blank HTML. */
    public static final String EMPTY_PAGE = "Empty page.";

    /** Returned when the page has content but no title, headings or labelled forms. */
    public static final String GENERIC_PAGE = "Page with interactive elements.";

    private static final List<String> STRIPPED_TAGS = List.of("script", "style", "noscript");
    private static final Set<String> HEADING_TAGS = Set.of("h1", "h2", "h3");
    private static final Set<String> FIELD_TAGS = Set.of("input", "textarea", "select");

    private static final int MAX_HEADINGS        = 5;
    private static final int HEADING_MAX_CHARS   = 80;
    private static final int MAX_FORMS           = 3;
    private static final int MAX_FIELDS_PER_FORM = 5;
    private static final int FIELD_LABEL_MAX_CHARS = 40;

    public String digest(String html) {
        if (html == null || html.isBlank()) {
            return EMPTY_PAGE;
        }
        return HtmlPages.parse(html, STRIPPED_TAGS)
                .map(this::digest)
                .orElse(GENERIC_PAGE);
    }

    public String digest(PageNode root) {
        List<String> parts = new ArrayList<>();

        Optional<PageNode> title = root.findAll(n -> n.is("title")).stream().findFirst();
        String titleText = title.map(t -> ElementText.collapse(t.text())).orElse("");
        if (!titleText.isEmpty()) {
            parts.add("Page: " + titleText);
        }

        List<String> headings = new ArrayList<>();
        List<PageNode> headingNodes = root.findAll(n -> HEADING_TAGS.contains(n.tagName()));
        for (PageNode h : headingNodes.subList(0, Math.min(MAX_HEADINGS, headingNodes.size()))) {
            String text = ElementText.truncate(ElementText.collapse(h.text()), HEADING_MAX_CHARS);
            if (!text.isEmpty()) {
                headings.add("  " + h.tagName() + ": " + text);
            }
        }
        if (!headings.isEmpty()) {
            parts.add("Headings:\n" + String.join("\n", headings));
        }

        List<String> forms = new ArrayList<>();
        List<PageNode> formNodes = root.findAll(n -> n.is("form"));
        for (PageNode form : formNodes.subList(0, Math.min(MAX_FORMS, formNodes.size()))) {
            List<PageNode> fields = form.findAll(n -> FIELD_TAGS.contains(n.tagName()));
            List<String> labels = new ArrayList<>();
            for (PageNode field : fields.subList(0, Math.min(MAX_FIELDS_PER_FORM, fields.size()))) {
                String label = fieldLabel(field);
                if (!label.isEmpty()) {
                    labels.add(label);
                }
            }
            if (!labels.isEmpty()) {
                forms.add("  Form fields: " + String.join(", ", labels));
            }
        }
        if (!forms.isEmpty()) {
            parts.add("Forms:\n" + String.join("\n", forms));
        }

        return parts.isEmpty() ? GENERIC_PAGE : String.join("\n", parts);
    }

    /**
     * Label for a form field: a sibling {@code label[for=id]}, then placeholder,
     * name or aria-label, then the field type.
     */
    private static String fieldLabel(PageNode field) {
        String id = field.attr("id");
        if (!id.isEmpty() && field.parent() != null) {
            Optional<PageNode> label = field.parent()
                    .findAll(n -> n.is("label") && n.attr("for").equals(id))
                    .stream().findFirst();
            if (label.isPresent()) {
                return ElementText.truncate(ElementText.collapse(label.get().text()), FIELD_LABEL_MAX_CHARS);
            }
        }
        for (String attr : List.of("placeholder", "name", "aria-label")) {
            String value = field.attr(attr);
            if (!value.isEmpty()) {
                return ElementText.truncate(value, FIELD_LABEL_MAX_CHARS);
            }
        }
        return field.hasAttr("type") ? field.attr("type") : "input";
    }
}
