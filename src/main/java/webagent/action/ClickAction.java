package webagent.action;

import webagent.model.Selector;

import java.util.Objects;

/** Clicks the element the selector resolves to. */
public record ClickAction(Selector selector) implements Action {

    public ClickAction {
        Objects.requireNonNull(selector, "selector");
    }

    @Override
    public ActionType actionType() { return ActionType.CLICK; }
}
