package webagent.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Pauses for {@code timeSeconds}; negative or non-finite durations collapse to zero. */
public record WaitAction(@JsonProperty("time_seconds") double timeSeconds) implements Action {

    public WaitAction {
        if (!Double.isFinite(timeSeconds) || timeSeconds < 0) {
            timeSeconds = 0.0;
        }
    }

    @Override
    public ActionType actionType() { return ActionType.WAIT; }
}
