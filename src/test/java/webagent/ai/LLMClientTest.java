package webagent.ai;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.moreThanOrExactly;
import static com.github.tomakehurst.wiremock.client.WireMock.notContaining;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LLMClient} using WireMock to mock the chat-completions endpoint.
 *
 * <p>A WireMockServer is started on a random ephemeral port before the test class
 * and reset before every test so stubs and request journals do not leak.
 */
public class LLMClientTest {

    private static final String PATH = "/v1/chat/completions";
    private static final String OK_BODY =
            "{\"choices\":[{\"message\":{\"content\":\"  {\\\"action\\\":\\\"idle\\\"}  \",\"role\":\"assistant\"}}]}";

    private WireMockServer wireMock;

    @BeforeClass
    public void setup() {
        wireMock = new WireMockServer(0); // 0 → random available port
        wireMock.start();
    }

    @AfterClass
    public void teardown() {
        if (wireMock != null) {
            wireMock.stop();
        }
    }

    @BeforeMethod
    public void reset() {
        wireMock.resetAll();
    }

    private LLMClient client(String apiKey, boolean jsonMode) {
        return new LLMClient(
                "http://127.0.0.1:" + wireMock.port() + "/v1/",
                apiKey,
                "test-model",
                0.1,
                100,
                jsonMode,
                10,  // timeoutSec
                1,   // retryCount
                50   // retryDelayMs
        );
    }

    private static List<ReasoningService.ChatMessage> messages() {
        return List.of(
                ReasoningService.ChatMessage.system("You are a web agent."),
                ReasoningService.ChatMessage.user("Log in."));
    }

    // ── Successful response ───────────────────────────────────────────────

    @Test
    public void complete_success_returnsTrimmedContent() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(OK_BODY)));

        assertThat(client(null, false).complete(messages())).isEqualTo("{\"action\":\"idle\"}");
    }

    @Test
    public void complete_sendsModelMessagesAndJsonMode() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(OK_BODY)));

        client(null, true).complete(messages());

        wireMock.verify(postRequestedFor(urlEqualTo(PATH))
                .withRequestBody(matchingJsonPath("$.model", equalTo("test-model")))
                .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
                .withRequestBody(matchingJsonPath("$.messages[1].content", equalTo("Log in.")))
                .withRequestBody(matchingJsonPath("$.response_format.type", equalTo("json_object"))));
    }

    @Test
    public void complete_jsonModeOff_omitsResponseFormat() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(OK_BODY)));

        client(null, false).complete(messages());

        wireMock.verify(postRequestedFor(urlEqualTo(PATH))
                .withRequestBody(notContaining("response_format")));
    }

    @Test
    public void complete_nullContent_returnsEmpty() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(
                "{\"choices\":[{\"message\":{\"content\":null,\"role\":\"assistant\"}}]}")));

        assertThat(client(null, false).complete(messages())).isEmpty();
    }

    // ── Headers ───────────────────────────────────────────────────────────

    @Test
    public void complete_apiKeyAndTaskId_sentAsHeaders() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(OK_BODY)));

        client("sk-test", false).complete(messages(), "task-42");

        wireMock.verify(postRequestedFor(urlEqualTo(PATH))
                .withHeader("Authorization", equalTo("Bearer sk-test"))
                .withHeader(LLMClient.TASK_ID_HEADER, equalTo("task-42")));
    }

    @Test
    public void complete_noApiKey_sendsNoAuthorization() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(OK_BODY)));

        client("  ", false).complete(messages());

        wireMock.verify(postRequestedFor(urlEqualTo(PATH))
                .withoutHeader("Authorization")
                .withoutHeader(LLMClient.TASK_ID_HEADER));
    }

    // ── Retries ───────────────────────────────────────────────────────────

    @Test
    public void complete_500_retriesThenThrows() {
        wireMock.stubFor(post(urlEqualTo(PATH))
                .willReturn(aResponse().withStatus(503).withBody("Service Unavailable")));

        assertThatThrownBy(() -> client(null, false).complete(messages()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("2 attempt(s)");
        wireMock.verify(2, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    public void complete_500ThenSuccess_returnsContent() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).inScenario("flaky")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(500))
                .willSetStateTo("recovered"));
        wireMock.stubFor(post(urlEqualTo(PATH)).inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(okJson(OK_BODY)));

        assertThat(client(null, false).complete(messages())).isEqualTo("{\"action\":\"idle\"}");
        wireMock.verify(2, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    public void complete_connectionFault_isRetried() {
        wireMock.stubFor(post(urlEqualTo(PATH))
                .willReturn(aResponse().withFault(Fault.EMPTY_RESPONSE)));

        assertThatThrownBy(() -> client(null, false).complete(messages()))
                .isInstanceOf(IOException.class);
        wireMock.verify(moreThanOrExactly(2), postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    public void complete_4xx_notRetried() {
        wireMock.stubFor(post(urlEqualTo(PATH))
                .willReturn(aResponse().withStatus(401).withBody("Unauthorized")));

        assertThatThrownBy(() -> client("bad", false).complete(messages()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("401");
        wireMock.verify(1, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    public void complete_malformedJson_notRetried() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody("not-valid-json")));

        assertThatThrownBy(() -> client(null, false).complete(messages()))
                .isInstanceOf(IOException.class);
        wireMock.verify(1, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    public void complete_emptyChoices_throws() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"choices\":[]}")));

        assertThatThrownBy(() -> client(null, false).complete(messages()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("choices");
    }

    // ── JSON-mode fallback ────────────────────────────────────────────────

    @Test
    public void complete_400WithJsonMode_repeatsWithoutResponseFormat() throws Exception {
        wireMock.stubFor(post(urlEqualTo(PATH)).atPriority(1)
                .withRequestBody(containing("response_format"))
                .willReturn(aResponse().withStatus(400).withBody("response_format not supported")));
        wireMock.stubFor(post(urlEqualTo(PATH)).atPriority(5)
                .willReturn(okJson(OK_BODY)));

        assertThat(client(null, true).complete(messages())).isEqualTo("{\"action\":\"idle\"}");
        wireMock.verify(1, postRequestedFor(urlEqualTo(PATH)).withRequestBody(containing("response_format")));
        wireMock.verify(1, postRequestedFor(urlEqualTo(PATH)).withRequestBody(notContaining("response_format")));
    }

    @Test
    public void complete_400WithoutJsonMode_failsImmediately() {
        wireMock.stubFor(post(urlEqualTo(PATH))
                .willReturn(aResponse().withStatus(400).withBody("Bad Request")));

        assertThatThrownBy(() -> client(null, false).complete(messages()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("400");
        wireMock.verify(1, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    public void complete_400AfterFallback_fails() {
        wireMock.stubFor(post(urlEqualTo(PATH))
                .willReturn(aResponse().withStatus(400).withBody("Bad Request")));

        assertThatThrownBy(() -> client(null, true).complete(messages()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("400");
        wireMock.verify(2, postRequestedFor(urlEqualTo(PATH)));
    }

    // ── ChatMessage factory methods ───────────────────────────────────────

    @Test
    public void chatMessage_factoriesSetRoles() {
        assertThat(ReasoningService.ChatMessage.system("s").role()).isEqualTo("system");
        assertThat(ReasoningService.ChatMessage.user("u").role()).isEqualTo("user");
    }
}
