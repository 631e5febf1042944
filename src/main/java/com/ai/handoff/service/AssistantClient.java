package com.ai.handoff.service;

import com.ai.handoff.dto.AssistantReply;
import com.ai.handoff.dto.AssistantRequest;

/**
 * Reply generation and intent signals. Implementations return
 * {@link AssistantReply#empty()} rather than throwing.
 */
public interface AssistantClient {

    AssistantReply reply(AssistantRequest request);
}
