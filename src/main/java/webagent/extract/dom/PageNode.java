package webagent.extract.dom;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read-only view of one element in a parsed HTML document.
 *
 * <p>The extraction code works only against this interface, so it does not depend
 * on a particular HTML parser; {@link JsoupPageNode} is the production adapter.
 * Implementations must return element children in document order and render
 * {@link #text()} without script or style data.
 */
public interface PageNode {

    /** Lower-case tag name; the document root reports {@code #root}. */
    String tagName();

    /** Attribute value, or empty string when the attribute is absent. */
    String attr(String name);

    /** Whether the attribute is present, even with an empty value. */
    boolean hasAttr(String name);

    /** Rendered text of this element and its descendants, whitespace-normalized and trimmed. */
    String text();

    /** Parent element, or {@code null} for the document root. */
    PageNode parent();

    /** Element children in document order. */
    List<PageNode> children();

    // ── Traversal ─────────────────────────────────────────────────────────

    /**
     * Visits every descendant in document (pre-)order. A visitor that returns
     * {@code false} for a node skips that node's subtree. The walk keeps its own
     * stack, so nesting depth is bounded only by the heap.
     */
    default void accept(PageVisitor visitor) {
        Deque<PageNode> pending = new ArrayDeque<>();
        pushChildren(pending, this);
        while (!pending.isEmpty()) {
            PageNode node = pending.pop();
            if (visitor.visit(node)) {
                pushChildren(pending, node);
            }
        }
    }

    private static void pushChildren(Deque<PageNode> pending, PageNode node) {
        List<PageNode> children = node.children();
        for (ListIterator<PageNode> it = children.listIterator(children.size()); it.hasPrevious(); ) {
            pending.push(it.previous());
        }
    }

    /** All descendants matching {@code filter}, in document order. */
    default List<PageNode> findAll(Predicate<PageNode> filter) {
        List<PageNode> found = new ArrayList<>();
        accept(node -> {
            if (filter.test(node)) found.add(node);
            return true;
        });
        return found;
    }

    /** Nearest ancestor (excluding this node) matching {@code filter}. */
    default Optional<PageNode> closestAncestor(Predicate<PageNode> filter) {
        for (PageNode p = parent(); p != null; p = p.parent()) {
            if (filter.test(p)) return Optional.of(p);
        }
        return Optional.empty();
    }

    /** Top of the tree this node belongs to. */
    default PageNode root() {
        PageNode node = this;
        while (node.parent() != null) {
            node = node.parent();
        }
        return node;
    }

    default boolean is(String tag) {
        return tag.equals(tagName());
    }
}
