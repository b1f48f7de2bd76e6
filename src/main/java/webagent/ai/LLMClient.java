package webagent.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI-compatible HTTP client for the {@code /chat/completions} endpoint.
 *
 * <p>Retries HTTP 5xx responses and I/O errors up to {@code retryCount} times with
 * a fixed delay; 4xx responses and malformed bodies fail immediately. When JSON
 * mode is on the request asks for {@code response_format: json_object}; if the
 * server rejects that with HTTP 400 the request is repeated once without it.
 */
public class LLMClient implements ReasoningService {

    private static final Logger log = LoggerFactory.getLogger(LLMClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Header carrying the agent task id, used by the gateway for tracing and billing. */
    static final String TASK_ID_HEADER = "IWA-Task-ID";

    private static final int ERROR_BODY_MAX_CHARS = 500;

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final boolean jsonMode;
    private final int retryCount;
    private final long retryDelayMs;
    private final OkHttpClient httpClient;

    /**
     * @param baseUrl      endpoint root, e.g. {@code https://api.openai.com/v1}
     * @param apiKey       bearer token; blank or null sends no Authorization header
     * @param model        model identifier
     * @param temperature  sampling temperature
     * @param maxTokens    completion token cap
     * @param jsonMode     request {@code response_format: json_object}
     * @param timeoutSec   read timeout per attempt
     * @param retryCount   retries after the first attempt on 5xx / I/O errors
     * @param retryDelayMs delay between attempts
     */
    public LLMClient(String baseUrl, String apiKey, String model, double temperature, int maxTokens,
                     boolean jsonMode, int timeoutSec, int retryCount, long retryDelayMs) {
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey       = apiKey;
        this.model        = model;
        this.temperature  = temperature;
        this.maxTokens    = maxTokens;
        this.jsonMode     = jsonMode;
        this.retryCount   = retryCount;
        this.retryDelayMs = retryDelayMs;
        this.httpClient   = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public String complete(List<ChatMessage> messages, String taskId) throws IOException {
        messages.stream()
                .filter(m -> "user".equals(m.role()))
                .findFirst()
                .ifPresent(m -> {
                    String snippet = m.content().length() > 500
                            ? m.content().substring(0, 500) + "..."
                            : m.content();
                    log.debug("LLM request to {} | model={} | task={} | user_prompt_start={}",
                            baseUrl, model, taskId, snippet);
                });

        String url = baseUrl + "/chat/completions";
        boolean useResponseFormat = jsonMode;
        String requestJson = buildRequestJson(messages, useResponseFormat);

        IOException lastException = null;
        int attempt = 0;

        while (attempt <= retryCount) {
            if (attempt > 0) {
                log.warn("Retrying LLM request (attempt {}/{}) after {}ms delay",
                        attempt, retryCount, retryDelayMs);
                try {
                    Thread.sleep(retryDelayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted during retry delay", ie);
                }
            }

            Request request = buildRequest(url, requestJson, taskId);

            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                String body = response.body() != null ? response.body().string() : "";

                if (statusCode >= 500) {
                    log.warn("LLM endpoint returned {} on attempt {}: {}", statusCode, attempt + 1, abbreviate(body));
                    lastException = new IOException(
                            "LLM server error " + statusCode + " after " + (attempt + 1) + " attempt(s): " + abbreviate(body));
                    attempt++;
                    continue;
                }

                if (statusCode == 400 && useResponseFormat) {
                    log.warn("LLM endpoint rejected response_format (400); repeating without it");
                    useResponseFormat = false;
                    requestJson = buildRequestJson(messages, false);
                    continue;
                }

                if (!response.isSuccessful()) {
                    throw new NonRetriableException("LLM request failed with HTTP " + statusCode + ": " + abbreviate(body));
                }

                return parseContent(body);

            } catch (NonRetriableException e) {
                throw e;
            } catch (IOException e) {
                log.warn("LLM request I/O error on attempt {}: {}", attempt + 1, e.getMessage());
                lastException = e;
                attempt++;
            }
        }

        throw new IOException(
                "LLM request failed after " + (retryCount + 1) + " attempt(s). Last error: "
                        + (lastException != null ? lastException.getMessage() : "unknown"),
                lastException);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private Request buildRequest(String url, String requestJson, String taskId) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(requestJson, JSON))
                .header("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        if (taskId != null && !taskId.isBlank()) {
            builder.header(TASK_ID_HEADER, taskId);
        }
        return builder.build();
    }

    /**
     * Builds the JSON request body for the /chat/completions endpoint.
     */
    private String buildRequestJson(List<ChatMessage> messages, boolean withResponseFormat) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", model);
        root.put("temperature", temperature);
        root.put("max_tokens", maxTokens);
        root.put("stream", false);
        if (withResponseFormat) {
            root.putObject("response_format").put("type", "json_object");
        }

        ArrayNode msgs = root.putArray("messages");
        for (ChatMessage msg : messages) {
            ObjectNode msgNode = msgs.addObject();
            msgNode.put("role", msg.role());
            msgNode.put("content", msg.content());
        }

        return MAPPER.writeValueAsString(root);
    }

    /**
     * Extracts the assistant content string from the choices[0].message.content path.
     * A null content (e.g. a refusal) is returned as empty text.
     */
    private String parseContent(String responseBody) throws IOException {
        try {
            JsonNode root = MAPPER.readTree(responseBody);
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new NonRetriableException("LLM response missing 'choices' array: " + abbreviate(responseBody));
            }
            JsonNode content = choices.get(0).path("message").path("content");
            if (content.isMissingNode()) {
                throw new NonRetriableException("LLM response missing choices[0].message.content: " + abbreviate(responseBody));
            }
            return content.isNull() ? "" : content.asText().trim();
        } catch (JsonProcessingException e) {
            throw new NonRetriableException("Failed to parse LLM response JSON: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null || body.isEmpty()) return "<empty>";
        return body.length() > ERROR_BODY_MAX_CHARS ? body.substring(0, ERROR_BODY_MAX_CHARS) + "..." : body;
    }

    /** HTTP 4xx and malformed responses: retrying would not help. */
    private static final class NonRetriableException extends IOException {
        NonRetriableException(String msg) {
            super(msg);
        }

        NonRetriableException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }
}
