package webagent.extract;

import webagent.extract.dom.PageNode;

/**
 * Text helpers shared by the extraction components.
 */
final class ElementText {

    static final int VISIBLE_TEXT_MAX_CHARS = 120;

    private ElementText() {}

    /**
     * Visible label of an element: rendered text with whitespace collapsed,
     * falling back to {@code aria-label} then {@code title}, bounded at
     * {@value #VISIBLE_TEXT_MAX_CHARS} characters.
     */
    static String visible(PageNode node) {
        String text = collapse(node.text());
        if (text.isEmpty()) {
            text = collapse(node.attr("aria-label"));
        }
        if (text.isEmpty()) {
            text = collapse(node.attr("title"));
        }
        return truncate(text, VISIBLE_TEXT_MAX_CHARS).strip();
    }

    /** Collapses whitespace runs to single spaces and trims; null-safe. */
    static String collapse(String s) {
        if (s == null || s.isEmpty()) return "";
        return s.replaceAll("\\s+", " ").strip();
    }

    /** First {@code maxChars} code points of {@code s}; a surrogate pair is never split. */
    static String truncate(String s, int maxChars) {
        if (s == null) return "";
        if (s.codePointCount(0, s.length()) <= maxChars) return s;
        return s.substring(0, s.offsetByCodePoints(0, maxChars));
    }
}
