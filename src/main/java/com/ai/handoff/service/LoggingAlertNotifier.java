package com.ai.handoff.service;

import com.ai.handoff.conversation.HandoffPriority;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.OrphanLeadAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    @Override
    public void orphanLead(OrphanLeadAlert alert) {
        log.warn("[{}:{}] ORPHAN LEAD contact={} reason={}",
                alert.identity(), alert.channel(), alert.contactId(), alert.reason());
    }

    @Override
    public void outOfHours(SessionRef ref, HandoffPriority priority) {
        log.warn("[{}] Handoff with priority {} requested outside business hours", ref, priority);
    }
}
