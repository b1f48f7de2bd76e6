package webagent.extract;

import org.testng.annotations.Test;
import webagent.extract.dom.HtmlPages;
import webagent.extract.dom.PageNode;
import webagent.model.Selector;
import webagent.model.SelectorKind;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SelectorSynthesizer}: strategy priority and fallbacks.
 */
public class SelectorSynthesizerTest {

    private final SelectorSynthesizer synthesizer = new SelectorSynthesizer();

    private static PageNode first(String html, String tag) {
        PageNode root = HtmlPages.parse(html, List.of()).orElseThrow();
        return root.findAll(n -> n.is(tag)).get(0);
    }

    @Test
    public void id_winsOverEveryOtherStrategy() {
        PageNode el = first("<a id=\"home\" data-testid=\"t\" name=\"n\" href=\"/\">Home</a>", "a");
        assertThat(synthesizer.synthesize(el)).contains(Selector.attributeValue("id", "home"));
    }

    @Test
    public void testId_beforeName() {
        PageNode el = first("<button data-testid=\"save-btn\" name=\"save\">Save</button>", "button");
        assertThat(synthesizer.synthesize(el)).contains(Selector.attributeValue("data-testid", "save-btn"));
    }

    @Test
    public void blankId_fallsThroughToName() {
        PageNode el = first("<input id=\"   \" name=\" email \">", "input");
        assertThat(synthesizer.synthesize(el)).contains(Selector.attributeValue("name", "email"));
    }

    @Test
    public void href_usedForLinksOnly() {
        PageNode link   = first("<a href=\"/cart\">Cart</a>", "a");
        PageNode button = first("<button href=\"/cart\">Cart</button>", "button");

        assertThat(synthesizer.synthesize(link)).contains(Selector.attributeValue("href", "/cart"));
        assertThat(synthesizer.synthesize(button)).contains(Selector.textContains("Cart"));
    }

    @Test
    public void javascriptHref_isNeverUsed() {
        PageNode el = first("<a href=\"JavaScript:void(0)\">More</a>", "a");
        Optional<Selector> s = synthesizer.synthesize(el);

        assertThat(s).isPresent();
        assertThat(s.get().getKind()).isEqualTo(SelectorKind.TEXT_CONTAINS);
        assertThat(s.get().getValue()).isEqualTo("More");
    }

    @Test
    public void textFallback_isCollapsedAndBounded() {
        PageNode el = first("<span>  Read \n  the   " + "long ".repeat(40) + "</span>", "span");
        Optional<Selector> s = synthesizer.synthesize(el);

        assertThat(s).isPresent();
        assertThat(s.get().getValue()).startsWith("Read the long");
        assertThat(s.get().getValue()).hasSizeLessThanOrEqualTo(SelectorSynthesizer.TEXT_MATCH_MAX_CHARS);
        assertThat(s.get().getValue()).doesNotEndWith(" ");
    }

    @Test
    public void titleAttribute_isTextFallback() {
        PageNode el = first("<button title=\"Settings\"></button>", "button");
        assertThat(synthesizer.synthesize(el)).contains(Selector.textContains("Settings"));
    }

    @Test
    public void nothingToAddress_returnsEmpty() {
        PageNode el = first("<div><button class=\"icon\"></button></div>", "button");
        assertThat(synthesizer.synthesize(el)).isEmpty();
    }
}
