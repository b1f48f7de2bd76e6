package webagent.extract.dom;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;

/**
 * Parses HTML snapshots into {@link PageNode} trees with jsoup.
 */
public final class HtmlPages {

    private static final Logger log = LoggerFactory.getLogger(HtmlPages.class);

    private HtmlPages() {}

    /**
     * Parses {@code html} leniently and removes every element whose tag is in
     * {@code stripTags} (with its subtree) before wrapping the document.
     *
     * @return the document root, or empty for null/blank input or a parser failure
     */
    public static Optional<PageNode> parse(String html, Collection<String> stripTags) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        try {
            Document doc = Jsoup.parse(html);
            for (String tag : stripTags) {
                doc.getElementsByTag(tag).remove();
            }
            return Optional.of(new JsoupPageNode(doc));
        } catch (RuntimeException e) {
            log.warn("HTML snapshot could not be parsed ({} chars): {}", html.length(), e.getMessage());
            return Optional.empty();
        }
    }
}
