package webagent.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import webagent.model.Selector;

/**
 * A fully constructed browser instruction. Every variant is a record with a
 * fixed field set and is tagged on the wire by its {@link ActionType#wireName()}
 * in a {@code type} property.
 *
 * <p>Instances are created through the static factories below; a variant is
 * never returned partially filled.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClickAction.class,    name = "ClickAction"),
        @JsonSubTypes.Type(value = TypeAction.class,     name = "TypeAction"),
        @JsonSubTypes.Type(value = SelectAction.class,   name = "SelectDropDownOptionAction"),
        @JsonSubTypes.Type(value = NavigateAction.class, name = "NavigateAction"),
        @JsonSubTypes.Type(value = ScrollAction.class,   name = "ScrollAction"),
        @JsonSubTypes.Type(value = WaitAction.class,     name = "WaitAction"),
        @JsonSubTypes.Type(value = IdleAction.class,     name = "IdleAction"),
        @JsonSubTypes.Type(value = SubmitAction.class,   name = "SubmitAction"),
        @JsonSubTypes.Type(value = HoverAction.class,    name = "HoverAction")
})
public interface Action {

    /** The variant of this action. */
    ActionType actionType();

    // ── Factories ─────────────────────────────────────────────────────────

    static Action click(Selector selector) {
        return new ClickAction(selector);
    }

    static Action type(Selector selector, String text) {
        return new TypeAction(selector, text);
    }

    static Action select(Selector selector, String optionText) {
        return new SelectAction(selector, optionText);
    }

    static Action navigate(String url) {
        return new NavigateAction(url);
    }

    static Action scroll(boolean down) {
        return ScrollAction.of(down);
    }

    static Action waitFor(double seconds) {
        return new WaitAction(seconds);
    }

    static Action idle() {
        return IdleAction.INSTANCE;
    }

    static Action submit(Selector selector) {
        return new SubmitAction(selector);
    }

    static Action hover(Selector selector) {
        return new HoverAction(selector);
    }
}
