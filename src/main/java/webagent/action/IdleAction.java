package webagent.action;

/** No-op; the reasoning service considers the task complete. Carries no fields. */
public record IdleAction() implements Action {

    static final IdleAction INSTANCE = new IdleAction();

    @Override
    public ActionType actionType() { return ActionType.IDLE; }
}
