package webagent.extract.dom;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link PageNode} backed by a jsoup {@link Element}.
 */
public final class JsoupPageNode implements PageNode {

    private final Element element;

    public JsoupPageNode(Element element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    @Override
    public String tagName() {
        return element.tagName().toLowerCase(Locale.ROOT);
    }

    @Override
    public String attr(String name) {
        return element.attr(name);
    }

    @Override
    public boolean hasAttr(String name) {
        return element.hasAttr(name);
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public PageNode parent() {
        Element p = element.parent();
        return p != null ? new JsoupPageNode(p) : null;
    }

    @Override
    public List<PageNode> children() {
        List<PageNode> kids = new ArrayList<>(element.childrenSize());
        for (Element child : element.children()) {
            kids.add(new JsoupPageNode(child));
        }
        return kids;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsoupPageNode other && element == other.element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return "<" + tagName() + ">";
    }
}
