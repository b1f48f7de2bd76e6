package webagent.extract;

import webagent.model.Candidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a candidate list as the compact numbered block embedded in the
 * reasoning prompt, one line per candidate:
 * <pre>
 * [0] &lt;input type=email&gt; Email [form]
 * [1] &lt;button&gt; "Log in" [form]
 * [2] &lt;a&gt; "Pricing" href=/pricing [nav]
 * </pre>
 */
public class CandidateFormatter {

    public static final String NO_CANDIDATES = "No interactive elements found on this page.";

    private static final int TEXT_MAX_CHARS          = 60;
    private static final int CURRENT_VALUE_MAX_CHARS = 30;
    private static final int HREF_MAX_CHARS          = 60;
    private static final int OPTIONS_SHOWN           = 5;

    public String format(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return NO_CANDIDATES;
        }
        List<String> lines = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            lines.add(formatLine(c));
        }
        return String.join("\n", lines);
    }

    String formatLine(Candidate c) {
        String text = ElementText.truncate(c.getText(), TEXT_MAX_CHARS);
        List<String> parts = new ArrayList<>();
        parts.add("[" + c.getId() + "]");

        switch (c.getTag()) {
            case "input" -> {
                String inputType = c.getType().isEmpty() ? "text" : c.getType();
                String label = firstNonEmpty(text, c.attribute("placeholder"), c.attribute("name"), inputType);
                String desc = "<input type=" + inputType + "> " + label;
                String value = c.attribute("value");
                if (!value.isEmpty()) {
                    desc += " (current: \"" + ElementText.truncate(value, CURRENT_VALUE_MAX_CHARS) + "\")";
                }
                parts.add(desc);
            }
            case "textarea" -> parts.add("<textarea> " + firstNonEmpty(text, c.attribute("placeholder")));
            case "select" -> {
                List<String> shown = c.getOptions().subList(0, Math.min(OPTIONS_SHOWN, c.getOptions().size()));
                if (!shown.isEmpty()) {
                    parts.add("<select> " + firstNonEmpty(text, c.attribute("name"))
                            + " options=[" + String.join(", ", shown) + "]");
                } else {
                    parts.add("<select> " + text);
                }
            }
            case "a" -> {
                parts.add("<a> \"" + text + "\"");
                String href = c.attribute("href");
                if (!href.isEmpty() && !href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
                    parts.add("href=" + ElementText.truncate(href, HREF_MAX_CHARS));
                }
            }
            case "button" -> parts.add("<button> \"" + text + "\"");
            default -> parts.add("<" + c.getTag() + "> \"" + text + "\"");
        }

        if (c.hasContext()) {
            parts.add("[" + c.getContext() + "]");
        }
        return String.join(" ", parts);
    }

    private static String firstNonEmpty(String... values) {
        for (String v : values) {
            if (v != null && !v.isEmpty()) return v;
        }
        return "";
    }
}
