package webagent.action;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Scrolls the viewport one step vertically. Exactly one of {@code up} and
 * {@code down} is set; horizontal scrolling is never requested.
 */
@JsonPropertyOrder({"down", "up", "left", "right"})
public record ScrollAction(boolean down, boolean up, boolean left, boolean right) implements Action {

    public ScrollAction {
        if (down == up) {
            throw new IllegalArgumentException("Exactly one of up/down must be set");
        }
        if (left || right) {
            throw new IllegalArgumentException("Horizontal scrolling is not supported");
        }
    }

    public static ScrollAction of(boolean down) {
        return new ScrollAction(down, !down, false, false);
    }

    @Override
    public ActionType actionType() { return ActionType.SCROLL; }
}
