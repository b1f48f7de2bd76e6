package webagent.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recovers a JSON object decision from raw reasoning-service text.
 *
 * <p>Recovery strategies, first success wins:
 * <ol>
 *   <li>the whole trimmed text is a JSON object;</li>
 *   <li>a triple-backtick fenced block (optionally tagged {@code json}) holds one;</li>
 *   <li>the first balanced {@code {...}} span in the text that parses as an object.</li>
 * </ol>
 * Top-level arrays and scalars are rejected. When nothing is recoverable the
 * result is empty; this class never throws on its input.
 */
public class DecisionParser {

    private static final Logger log = LoggerFactory.getLogger(DecisionParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String FENCE = "```";

    /** Language tag alone on the opening line of a fenced block, e.g. {@code json}. */
    private static final Pattern LANGUAGE_TAG = Pattern.compile("^[ \\t]*[A-Za-z][\\w+.-]*[ \\t]*\\R");

    private static final int LOG_SNIPPET_CHARS = 200;

    private static final int UNSCANNED = -2;

    /**
     * @param rawText the generator's full response; may be null
     * @return the recovered decision, or empty when no strategy succeeds
     */
    public Optional<Decision> parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Optional.empty();
        }
        String text = rawText.strip();

        // ── 1. Whole text ──────────────────────────────────────────────
        Optional<Decision> whole = readObject(text);
        if (whole.isPresent()) {
            return whole;
        }

        // ── 2. Fenced code blocks ──────────────────────────────────────
        if (text.contains(FENCE)) {
            String[] segments = text.split(Pattern.quote(FENCE), -1);
            // Odd segments lie between an opening and a closing fence.
            for (int i = 1; i < segments.length - 1; i += 2) {
                String body = LANGUAGE_TAG.matcher(segments[i]).replaceFirst("").strip();
                if (body.startsWith("{")) {
                    Optional<Decision> fenced = readObject(body);
                    if (fenced.isPresent()) {
                        log.debug("Decision recovered from fenced block");
                        return fenced;
                    }
                }
            }
        }

        // ── 3. First balanced brace span ───────────────────────────────
        int[] closers = new int[text.length()];
        Arrays.fill(closers, UNSCANNED);
        for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
            if (closers[start] == UNSCANNED) {
                scanSpans(text, start, closers);
            }
            int end = closers[start];
            if (end < 0) {
                continue;
            }
            Optional<Decision> embedded = readObject(text.substring(start, end + 1));
            if (embedded.isPresent()) {
                log.debug("Decision recovered from embedded object at offset {}", start);
                return embedded;
            }
        }

        log.warn("Failed to parse decision JSON: {}",
                text.length() > LOG_SNIPPET_CHARS ? text.substring(0, LOG_SNIPPET_CHARS) + "..." : text);
        return Optional.empty();
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private static Optional<Decision> readObject(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(new Decision(MAPPER.convertValue(node, MAP_TYPE)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Scans from the brace at {@code start} until it closes or the text ends,
     * recording in {@code closers} the closing index (or -1) of every opening
     * brace met outside a string literal. A later scan starting at any of those
     * braces would see the same string state, so their entries are final.
     */
    private static void scanSpans(String text, int start, int[] closers) {
        Deque<Integer> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                open.push(i);
            } else if (c == '}') {
                closers[open.pop()] = i;
                if (open.isEmpty()) {
                    return;
                }
            }
        }
        while (!open.isEmpty()) {
            closers[open.pop()] = -1;
        }
    }
}
