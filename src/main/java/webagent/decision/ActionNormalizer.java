package webagent.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webagent.action.Action;
import webagent.model.Candidate;
import webagent.model.Selector;
import webagent.model.SelectorKind;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Turns a {@link Decision} plus the step's candidate list into one canonical
 * {@link Action}.
 *
 * <p>The action name is read from {@code action} (or {@code type}) and resolved
 * through {@link IntentAliases}. A {@code candidate_id} (integer or numeric
 * string) in {@code [0, candidates.size())} binds that candidate's selector.
 * Each intent then has its own construction rule; when a rule's requirements are
 * not met the result is empty. Empty is a normal outcome, never an error: the
 * caller decides on a fallback.
 *
 * <p>Stateless and safe for concurrent use.
 */
public class ActionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ActionNormalizer.class);

    static final String CANDIDATE_ID = "candidate_id";

    private static final double DEFAULT_WAIT_SECONDS = 1.0;

    /**
     * @param decision   recovered decision
     * @param candidates this step's candidates, ids 0..n-1
     * @return the action, or empty when none can be built
     */
    public Optional<Action> normalize(Decision decision, List<Candidate> candidates) {
        return resolve(decision, candidates).toOptional();
    }

    /** Convenience overload for a raw mapping. */
    public Optional<Action> normalize(Map<String, ?> decision, List<Candidate> candidates) {
        return normalize(Decision.of(decision), candidates);
    }

    /**
     * Like {@link #normalize(Decision, List)} but reports why no action was built.
     */
    public NormalizationResult resolve(Decision decision, List<Candidate> candidates) {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(candidates, "candidates");

        Optional<String> rawName = decision.string("action", "type").filter(s -> !s.isBlank());
        if (rawName.isEmpty()) {
            log.debug("Decision has no action field: {}", decision);
            return NormalizationResult.missingAction();
        }

        Optional<Intent> intent = IntentAliases.resolve(rawName.get());
        if (intent.isEmpty()) {
            log.warn("Unknown action type: '{}' (normalized: '{}')",
                    rawName.get(), IntentAliases.normalize(rawName.get()));
            return NormalizationResult.unknownAction(rawName.get());
        }

        Optional<Selector> bound = boundSelector(decision, candidates);
        NormalizationResult result = build(intent.get(), decision, bound);

        if (result.isBuilt()) {
            log.debug("Decision {} -> {}", decision, result.action());
        } else {
            log.debug("No {} action from {}: {}", intent.get(), decision, result.detail());
        }
        return result;
    }

    // ── Per-intent construction ───────────────────────────────────────────

    private NormalizationResult build(Intent intent, Decision decision, Optional<Selector> bound) {
        switch (intent) {
            case CLICK: {
                Optional<Selector> selector = bound.isPresent() ? bound : inlineSelector(decision);
                return selector
                        .map(s -> NormalizationResult.built(intent, Action.click(s)))
                        .orElseGet(() -> NormalizationResult.unresolved(intent, "no valid candidate_id or inline selector"));
            }
            case TYPE: {
                if (bound.isEmpty()) {
                    return NormalizationResult.unresolved(intent, "no valid candidate_id");
                }
                String text = decision.stringOr("", "text", "value");
                return NormalizationResult.built(intent, Action.type(bound.get(), text));
            }
            case SELECT: {
                if (bound.isEmpty()) {
                    return NormalizationResult.unresolved(intent, "no valid candidate_id");
                }
                Optional<String> option = decision.string("text", "option", "value").filter(s -> !s.isEmpty());
                return option
                        .map(o -> NormalizationResult.built(intent, Action.select(bound.get(), o)))
                        .orElseGet(() -> NormalizationResult.unresolved(intent, "no option text"));
            }
            case NAVIGATE: {
                Optional<String> url = decision.string("url").map(String::strip).filter(s -> !s.isEmpty());
                return url
                        .map(u -> NormalizationResult.built(intent, Action.navigate(u)))
                        .orElseGet(() -> NormalizationResult.unresolved(intent, "no url"));
            }
            case SCROLL:
            case SCROLL_DOWN:
            case SCROLL_UP: {
                String direction = decision.stringOr("down", "direction").strip().toLowerCase(Locale.ROOT);
                boolean up = intent == Intent.SCROLL_UP || direction.equals("up");
                return NormalizationResult.built(intent, Action.scroll(!up));
            }
            case WAIT: {
                double seconds = decision.decimal("seconds", "time", "time_seconds").orElse(DEFAULT_WAIT_SECONDS);
                return NormalizationResult.built(intent, Action.waitFor(seconds));
            }
            case IDLE:
                return NormalizationResult.built(intent, Action.idle());
            case SUBMIT:
                return bound
                        .map(s -> NormalizationResult.built(intent, Action.submit(s)))
                        .orElseGet(() -> NormalizationResult.unresolved(intent, "no valid candidate_id"));
            case HOVER:
                return bound
                        .map(s -> NormalizationResult.built(intent, Action.hover(s)))
                        .orElseGet(() -> NormalizationResult.unresolved(intent, "no valid candidate_id"));
            default:
                throw new IllegalStateException("Unhandled intent " + intent);
        }
    }

    // ── Selector binding ──────────────────────────────────────────────────

    /** Selector of the candidate named by {@code candidate_id}, when the id is in range. */
    static Optional<Selector> boundSelector(Decision decision, List<Candidate> candidates) {
        OptionalInt id = decision.integer(CANDIDATE_ID);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        int index = id.getAsInt();
        if (index < 0 || index >= candidates.size()) {
            log.debug("candidate_id {} out of range [0, {})", index, candidates.size());
            return Optional.empty();
        }
        return Optional.of(candidates.get(index).getSelector());
    }

    /**
     * Selector object supplied directly in the decision, e.g.
     * {@code {"selector": {"type": "attributeValueSelector", "attribute": "id", "value": "go"}}}.
     * Requires a non-blank {@code value}.
     */
    static Optional<Selector> inlineSelector(Decision decision) {
        Optional<Decision> raw = decision.object("selector");
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Decision sel = raw.get();
        Optional<String> value = sel.string("value").map(String::strip).filter(s -> !s.isEmpty());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        SelectorKind kind = SelectorKind.fromWireName(sel.stringOr("", "type", "kind"));
        String defaultAttribute = switch (kind) {
            case TEXT_CONTAINS -> "text";
            case XPATH -> "xpath";
            default -> "id";
        };
        String attribute = sel.string("attribute").filter(s -> !s.isBlank()).orElse(defaultAttribute);
        boolean caseSensitive = sel.bool("case_sensitive").orElse(false);
        return Optional.of(new Selector(kind, attribute, value.get(), caseSensitive));
    }
}
