package webagent.action;

import webagent.model.Selector;

import java.util.Objects;

/** Submits the form that owns the element the selector resolves to. */
public record SubmitAction(Selector selector) implements Action {

    public SubmitAction {
        Objects.requireNonNull(selector, "selector");
    }

    @Override
    public ActionType actionType() { return ActionType.SUBMIT; }
}
