package webagent.extract;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link PageDigester}.
 */
public class PageDigesterTest {

    private final PageDigester digester = new PageDigester();

    @Test
    public void digest_emptyInput_returnsEmptyPageMarker() {
        assertThat(digester.digest((String) null)).isEqualTo(PageDigester.EMPTY_PAGE);
        assertThat(digester.digest("")).isEqualTo(PageDigester.EMPTY_PAGE);
        assertThat(digester.digest("  \n")).isEqualTo(PageDigester.EMPTY_PAGE);
    }

    @Test
    public void digest_nothingRecognized_returnsGenericMarker() {
        assertThat(digester.digest("<div><span>plain</span></div>")).isEqualTo(PageDigester.GENERIC_PAGE);
    }

    @Test
    public void digest_titleHeadingsAndForm() {
        String html = "<html><head><title> Shop </title><script>var h1 = 1;</script></head><body>"
                + "<h1>Welcome</h1><h2>Today's   deals</h2>"
                + "<form><label for=\"q\">Search</label><input id=\"q\">"
                + "<input name=\"zip\"><input type=\"password\"><input></form>"
                + "</body></html>";

        assertThat(digester.digest(html)).isEqualTo(
                "Page: Shop\n"
                        + "Headings:\n"
                        + "  h1: Welcome\n"
                        + "  h2: Today's deals\n"
                        + "Forms:\n"
                        + "  Form fields: Search, zip, password, input");
    }

    @Test
    public void digest_boundsHeadingsFormsAndFields() {
        StringBuilder html = new StringBuilder();
        for (int i = 1; i <= 7; i++) {
            html.append("<h2>Section ").append(i).append("</h2>");
        }
        for (int f = 1; f <= 4; f++) {
            html.append("<form>");
            for (int i = 1; i <= 7; i++) {
                html.append("<input name=\"f").append(f).append('_').append(i).append("\">");
            }
            html.append("</form>");
        }

        String digest = digester.digest(html.toString());

        assertThat(digest).contains("  h2: Section 5").doesNotContain("Section 6");
        assertThat(digest).contains("Form fields: f1_1, f1_2, f1_3, f1_4, f1_5\n");
        assertThat(digest).doesNotContain("f1_6").doesNotContain("f4_1");
        assertThat(digest).endsWith("Form fields: f3_1, f3_2, f3_3, f3_4, f3_5");
    }

    @Test
    public void digest_fieldLabelFallbacks() {
        String html = "<form>"
                + "<textarea placeholder=\"Your message\"></textarea>"
                + "<select aria-label=\"Country\"></select>"
                + "<input type=\"email\">"
                + "</form>";

        assertThat(digester.digest(html)).isEqualTo("Forms:\n  Form fields: Your message, Country, email");
    }

    @Test
    public void digest_longHeadingTruncated() {
        String digest = digester.digest("<h1>" + "a".repeat(100) + "</h1>");
        assertThat(digest).isEqualTo("Headings:\n  h1: " + "a".repeat(80));
    }
}
