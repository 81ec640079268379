package com.openforge.clusterlens.investigation;

import java.util.List;

/**
 * The model-inference collaborator: one request/response round per call.
 *
 * Implementations throw an unchecked exception when the endpoint cannot
 * answer; the orchestrator classifies it and aborts the turn.
 */
@FunctionalInterface
public interface ModelInference {

    /**
     * @param prompt              the user-side text of this round
     * @param systemPrompt        instructions, including the tool catalog
     * @param conversationHistory earlier user/assistant messages; never contains tool messages
     * @return the model's free-text reply, possibly containing TOOL: lines
     */
    String complete(String prompt, String systemPrompt, List<Message> conversationHistory);
}
