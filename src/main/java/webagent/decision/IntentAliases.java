package webagent.decision;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the free-form action names a reasoning service emits ({@code "ClickAction"},
 * {@code "fill"}, {@code "goto"}, {@code "done"}, ...) onto an {@link Intent}.
 *
 * <p>Names are first normalized: lower-cased, trimmed, and stripped of a trailing
 * {@code action} suffix. An exact alias match wins. Otherwise the table is scanned
 * in declaration order and the first alias that contains the name, or is contained
 * in it, wins. The order of {@link #ALIASES} therefore decides ties between
 * overlapping aliases and must not be changed casually. A name that normalizes to
 * the empty string (e.g. {@code "Action"}) is contained in every alias and
 * resolves to the first entry.
 */
public final class IntentAliases {

    /** Ordered (alias, intent) pairs. */
    static final List<Map.Entry<String, Intent>> ALIASES = List.of(
            Map.entry("click",                Intent.CLICK),
            Map.entry("type",                 Intent.TYPE),
            Map.entry("input",                Intent.TYPE),
            Map.entry("fill",                 Intent.TYPE),
            Map.entry("select",               Intent.SELECT),
            Map.entry("selectdropdown",       Intent.SELECT),
            Map.entry("selectdropdownoption", Intent.SELECT),
            Map.entry("dropdown",             Intent.SELECT),
            Map.entry("navigate",             Intent.NAVIGATE),
            Map.entry("goto",                 Intent.NAVIGATE),
            Map.entry("go",                   Intent.NAVIGATE),
            Map.entry("scroll",               Intent.SCROLL),
            Map.entry("scrolldown",           Intent.SCROLL_DOWN),
            Map.entry("scrollup",             Intent.SCROLL_UP),
            Map.entry("wait",                 Intent.WAIT),
            Map.entry("sleep",                Intent.WAIT),
            Map.entry("pause",                Intent.WAIT),
            Map.entry("done",                 Intent.IDLE),
            Map.entry("complete",             Intent.IDLE),
            Map.entry("finish",               Intent.IDLE),
            Map.entry("idle",                 Intent.IDLE),
            Map.entry("submit",               Intent.SUBMIT),
            Map.entry("hover",                Intent.HOVER)
    );

    private static final String ACTION_SUFFIX = "action";

    private IntentAliases() {}

    /**
     * Lower-cases, trims and strips a trailing {@code action} suffix:
     * {@code "SelectDropDownOptionAction"} → {@code "selectdropdownoption"}.
     */
    public static String normalize(String rawName) {
        String name = rawName.toLowerCase(Locale.ROOT).strip();
        if (name.endsWith(ACTION_SUFFIX)) {
            name = name.substring(0, name.length() - ACTION_SUFFIX.length());
        }
        return name.strip();
    }

    /**
     * Resolves a raw action name.
     *
     * @return the intent, or empty when no alias matches
     */
    public static Optional<Intent> resolve(String rawName) {
        if (rawName == null) {
            return Optional.empty();
        }
        String name = normalize(rawName);

        for (Map.Entry<String, Intent> alias : ALIASES) {
            if (alias.getKey().equals(name)) {
                return Optional.of(alias.getValue());
            }
        }
        for (Map.Entry<String, Intent> alias : ALIASES) {
            if (alias.getKey().contains(name) || name.contains(alias.getKey())) {
                return Optional.of(alias.getValue());
            }
        }
        return Optional.empty();
    }
}
