package webagent.extract.dom;

/**
 * Callback for {@link PageNode#accept(PageVisitor)}.
 */
@FunctionalInterface
public interface PageVisitor {

    /**
     * @param node the element being visited
     * @return {@code true} to descend into the element's children, {@code false} to skip them
     */
    boolean visit(PageNode node);
}
