package webagent.action;

/**
 * The closed set of action variants the browser executor accepts, with the
 * {@code type} discriminator each one carries on the wire.
 */
public enum ActionType {
    CLICK("ClickAction"),
    TYPE("TypeAction"),
    SELECT("SelectDropDownOptionAction"),
    NAVIGATE("NavigateAction"),
    SCROLL("ScrollAction"),
    WAIT("WaitAction"),
    IDLE("IdleAction"),
    SUBMIT("SubmitAction"),
    HOVER("HoverAction");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
