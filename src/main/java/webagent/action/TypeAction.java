package webagent.action;

import webagent.model.Selector;

import java.util.Objects;

/**
 * Types {@code text} into the element. An empty text is valid and clears the field.
 */
public record TypeAction(Selector selector, String text) implements Action {

    public TypeAction {
        Objects.requireNonNull(selector, "selector");
        text = text != null ? text : "";
    }

    @Override
    public ActionType actionType() { return ActionType.TYPE; }
}
