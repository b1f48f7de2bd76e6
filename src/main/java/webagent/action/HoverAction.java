package webagent.action;

import webagent.model.Selector;

import java.util.Objects;

/** Moves the pointer over the element the selector resolves to. */
public record HoverAction(Selector selector) implements Action {

    public HoverAction {
        Objects.requireNonNull(selector, "selector");
    }

    @Override
    public ActionType actionType() { return ActionType.HOVER; }
}
