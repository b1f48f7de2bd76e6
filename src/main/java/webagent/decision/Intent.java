package webagent.decision;

/**
 * Canonical action category a decision resolves to after alias matching.
 * Scroll has three intents because the direction may be part of the name.
 */
public enum Intent {
    CLICK, TYPE, SELECT, NAVIGATE, SCROLL, SCROLL_DOWN, SCROLL_UP, WAIT, IDLE, SUBMIT, HOVER
}
