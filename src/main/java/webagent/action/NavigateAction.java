package webagent.action;

/** Loads {@code url} in the current tab. */
public record NavigateAction(String url) implements Action {

    public NavigateAction {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Navigation URL must not be blank");
        }
    }

    @Override
    public ActionType actionType() { return ActionType.NAVIGATE; }
}
