package webagent.locator;

import org.openqa.selenium.By;
import webagent.model.Selector;

import java.util.Locale;

/**
 * Converts a {@link Selector} into a Selenium {@link By} so a WebDriver-based
 * executor can relocate the element:
 * <ul>
 *   <li>attribute match on {@code id} / {@code name} → {@code By.id} / {@code By.name};</li>
 *   <li>any other attribute → CSS {@code [attr='value']}, with the {@code i} flag
 *       when the selector is case-insensitive;</li>
 *   <li>text match → XPath selecting the innermost element whose normalized text
 *       contains the value;</li>
 *   <li>XPath → used verbatim.</li>
 * </ul>
 */
public final class SelectorLocators {

    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";

    private SelectorLocators() {}

    public static By toBy(Selector selector) {
        switch (selector.getKind()) {
            case XPATH:
                return By.xpath(selector.getValue());
            case TEXT_CONTAINS:
                return By.xpath(textXpath(selector.getValue(), selector.isCaseSensitive()));
            case ATTRIBUTE_VALUE:
            default:
                String attribute = selector.getAttribute();
                if ("id".equals(attribute))   return By.id(selector.getValue());
                if ("name".equals(attribute)) return By.name(selector.getValue());
                return By.cssSelector(attributeCss(attribute, selector.getValue(), selector.isCaseSensitive()));
        }
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    static String attributeCss(String attribute, String value, boolean caseSensitive) {
        return "[" + attribute + "='" + cssEscape(value) + "'" + (caseSensitive ? "" : " i") + "]";
    }

    /**
     * XPath for the deepest element whose text contains {@code text}: it matches
     * and none of its child elements does.
     */
    static String textXpath(String text, boolean caseSensitive) {
        String haystack = caseSensitive
                ? "normalize-space(string(.))"
                : "translate(normalize-space(string(.)),'" + UPPER + "','" + LOWER + "')";
        String needle = xpathLiteral(caseSensitive ? text : text.toLowerCase(Locale.ROOT));
        String contains = "contains(" + haystack + "," + needle + ")";
        return "//*[" + contains + " and not(*[" + contains + "])]";
    }

    /** Quotes a string for XPath 1.0, which has no escape syntax. */
    static String xpathLiteral(String s) {
        if (!s.contains("'")) return "'" + s + "'";
        if (!s.contains("\"")) return "\"" + s + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = s.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(",\"'\",");
            sb.append("'").append(parts[i]).append("'");
        }
        return sb.append(")").toString();
    }

    private static String cssEscape(String raw) {
        return raw.replace("\\", "\\\\").replace("'", "\\'");
    }
}
