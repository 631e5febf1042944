package com.ai.handoff.service;

import com.ai.handoff.conversation.SessionRef;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default messenger until a transport adapter is plugged in.
 */
@Component
public class LoggingOutboundMessenger implements OutboundMessenger {

    private static final Logger log = LoggerFactory.getLogger(LoggingOutboundMessenger.class);

    @Override
    public void send(SessionRef ref, String text) {
        log.info("[{}] OUT: {}", ref, StringUtils.abbreviate(text, 200));
    }
}
