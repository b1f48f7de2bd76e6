package webagent.decision;

import webagent.action.Action;

import java.util.Optional;

/**
 * Outcome of normalizing one decision, for callers that need to know why no
 * action was produced.
 *
 * @param outcome what happened
 * @param action  the constructed action; {@code null} unless {@code outcome == ACTION}
 * @param intent  the resolved intent; {@code null} for missing or unknown actions
 * @param detail  human-readable explanation; {@code null} on success
 */
public record NormalizationResult(Outcome outcome, Action action, Intent intent, String detail) {

    public enum Outcome {
        /** An action was built. */
        ACTION,
        /** The decision names no action. */
        MISSING_ACTION,
        /** The action name matches no alias. */
        UNKNOWN_ACTION,
        /** The intent is known but a required selector or field is missing. */
        UNRESOLVED
    }

    public static NormalizationResult built(Intent intent, Action action) {
        return new NormalizationResult(Outcome.ACTION, action, intent, null);
    }

    public static NormalizationResult missingAction() {
        return new NormalizationResult(Outcome.MISSING_ACTION, null, null, "decision has no action field");
    }

    public static NormalizationResult unknownAction(String rawName) {
        return new NormalizationResult(Outcome.UNKNOWN_ACTION, null, null, "unknown action '" + rawName + "'");
    }

    public static NormalizationResult unresolved(Intent intent, String reason) {
        return new NormalizationResult(Outcome.UNRESOLVED, null, intent, reason);
    }

    public boolean isBuilt() { return outcome == Outcome.ACTION; }

    /** The action as an optional; empty for every outcome other than {@code ACTION}. */
    public Optional<Action> toOptional() {
        return Optional.ofNullable(action);
    }
}
