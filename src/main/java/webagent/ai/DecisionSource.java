package webagent.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webagent.decision.Decision;
import webagent.decision.DecisionParser;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks the {@link ReasoningService} for the next step and recovers the decision
 * object from its reply.
 *
 * <p>Transport failures propagate as {@link IOException}; an unusable reply is
 * an empty result so the caller can pick its own fallback.
 */
public class DecisionSource {

    private static final Logger log = LoggerFactory.getLogger(DecisionSource.class);

    private final ReasoningService service;
    private final DecisionParser parser;

    public DecisionSource(ReasoningService service) {
        this(service, new DecisionParser());
    }

    public DecisionSource(ReasoningService service, DecisionParser parser) {
        this.service = Objects.requireNonNull(service, "service");
        this.parser  = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @param messages conversation to send
     * @param taskId   agent task id forwarded to the service; may be null
     * @return the recovered decision, or empty when the reply holds no JSON object
     * @throws IOException if the service call fails
     */
    public Optional<Decision> requestDecision(List<ReasoningService.ChatMessage> messages, String taskId)
            throws IOException {
        String reply = service.complete(messages, taskId);
        Optional<Decision> decision = parser.parse(reply);
        if (decision.isEmpty()) {
            log.warn("Reasoning service reply held no decision object (task={})", taskId);
        } else {
            log.debug("Decision for task {}: {}", taskId, decision.get());
        }
        return decision;
    }

    public Optional<Decision> requestDecision(List<ReasoningService.ChatMessage> messages) throws IOException {
        return requestDecision(messages, null);
    }
}
