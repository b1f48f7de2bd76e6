package webagent.action;

/**
 * Unchecked exception thrown when serialized action JSON does not match the
 * shape declared for its variant in {@code action-schema.json}.
 */
public class ActionSchemaException extends RuntimeException {

    public ActionSchemaException(String msg) {
        super(msg);
    }
}
