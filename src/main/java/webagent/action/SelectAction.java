package webagent.action;

import webagent.model.Selector;

import java.util.Objects;

/** Picks the dropdown option whose visible text is {@code text}. */
public record SelectAction(Selector selector, String text) implements Action {

    public SelectAction {
        Objects.requireNonNull(selector, "selector");
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Option text must not be empty");
        }
    }

    @Override
    public ActionType actionType() { return ActionType.SELECT; }
}
