package webagent.decision;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Untyped key-value decision recovered from the reasoning service, with
 * lenient typed accessors.
 *
 * <p>Field names and value types coming from a text generator are unreliable, so
 * no accessor throws: a missing key, a {@code null} value or a value of the wrong
 * type is reported as absent and the caller's default applies. Accessors that take
 * several names return the first name holding a usable value.
 */
public final class Decision {

    private final Map<String, Object> fields;

    public Decision(Map<String, ?> fields) {
        this.fields = fields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
                : Collections.emptyMap();
    }

    public static Decision of(Map<String, ?> fields) {
        return new Decision(fields);
    }

    /** The raw mapping, read-only. */
    public Map<String, Object> asMap() { return fields; }

    public boolean has(String key) {
        return fields.get(key) != null;
    }

    // ── Strings ───────────────────────────────────────────────────────────

    /**
     * First value among {@code keys} that renders as text. Strings are returned as
     * is, numbers and booleans in their literal form; objects and arrays are skipped.
     */
    public Optional<String> string(String... keys) {
        for (String key : keys) {
            Optional<String> s = scalarText(fields.get(key));
            if (s.isPresent()) return s;
        }
        return Optional.empty();
    }

    /** Like {@link #string(String...)}, returning {@code defaultValue} when none match. */
    public String stringOr(String defaultValue, String... keys) {
        return string(keys).orElse(defaultValue);
    }

    // ── Numbers ───────────────────────────────────────────────────────────

    /**
     * Integral value of {@code key}: an integral JSON number within {@code int}
     * range, or a string holding one (surrounding whitespace allowed). Anything
     * else, including decimals and booleans, is absent.
     */
    public OptionalInt integer(String key) {
        Object v = fields.get(key);
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return OptionalInt.of(((Number) v).intValue());
        }
        if (v instanceof Long || v instanceof BigInteger) {
            BigInteger big = v instanceof BigInteger b ? b : BigInteger.valueOf((Long) v);
            return big.bitLength() < 32 ? OptionalInt.of(big.intValue()) : OptionalInt.empty();
        }
        if (v instanceof String s) {
            try {
                return OptionalInt.of(Integer.parseInt(s.strip()));
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Floating value of the first key present among {@code keys}: a JSON number or
     * a numeric string. If that value cannot be read as a finite number the result
     * is empty; later keys are not consulted.
     */
    public Optional<Double> decimal(String... keys) {
        for (String key : keys) {
            Object v = fields.get(key);
            if (v == null) continue;
            Double d = null;
            if (v instanceof Number n) {
                d = n.doubleValue();
            } else if (v instanceof String s) {
                try {
                    d = Double.parseDouble(s.strip());
                } catch (NumberFormatException e) {
                    d = null;
                }
            }
            return d != null && Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        }
        return Optional.empty();
    }

    // ── Nested objects ────────────────────────────────────────────────────

    /** Nested object under {@code key}, as its own {@link Decision}. */
    public Optional<Decision> object(String key) {
        Object v = fields.get(key);
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, val) -> copy.put(String.valueOf(k), val));
            return Optional.of(new Decision(copy));
        }
        return Optional.empty();
    }

    /** Boolean under {@code key}: a JSON boolean or the strings true/false. */
    public Optional<Boolean> bool(String key) {
        Object v = fields.get(key);
        if (v instanceof Boolean b) return Optional.of(b);
        if (v instanceof String s) {
            String t = s.strip();
            if (t.equalsIgnoreCase("true"))  return Optional.of(Boolean.TRUE);
            if (t.equalsIgnoreCase("false")) return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    private static Optional<String> scalarText(Object v) {
        if (v instanceof String s) return Optional.of(s);
        if (v instanceof Boolean b) return Optional.of(b.toString());
        if (v instanceof BigDecimal bd) return Optional.of(bd.toPlainString());
        if (v instanceof Number n) return Optional.of(n.toString());
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Decision other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Decision" + fields;
    }
}
