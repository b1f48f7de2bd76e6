package webagent.ai;

import java.io.IOException;
import java.util.List;

/**
 * The external reasoning service that decides the agent's next step.
 *
 * <p>Contract: one blocking request/response exchange per call, bounded by a
 * timeout. Implementations retry transient (server-class or I/O) failures a
 * bounded number of times and never retry client-class failures. A terminal
 * failure surfaces as {@link IOException}.
 */
public interface ReasoningService {

    /**
     * Sends the conversation and returns the assistant's reply text.
     *
     * @param messages conversation in order
     * @param taskId   identifier of the agent task, forwarded for tracing; may be null
     * @return the reply text, trimmed
     * @throws IOException if the exchange fails after all retries
     */
    String complete(List<ChatMessage> messages, String taskId) throws IOException;

    default String complete(List<ChatMessage> messages) throws IOException {
        return complete(messages, null);
    }

    /**
     * Simple record representing a single chat turn.
     */
    record ChatMessage(String role, String content) {

        /** Creates a system-role message. */
        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        /** Creates a user-role message. */
        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }
}
