package com.ai.handoff.service;

import com.ai.handoff.conversation.SessionRef;

/**
 * Sends a text to the customer on the session's channel.
 */
public interface OutboundMessenger {

    void send(SessionRef ref, String text);
}
