package com.ai.handoff.service;

import com.ai.handoff.conversation.HandoffPriority;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.OrphanLeadAlert;

/**
 * Fire-and-forget alert channel for the human team.
 */
public interface AlertNotifier {

    void orphanLead(OrphanLeadAlert alert);

    /** A handoff was requested while nobody is on shift. */
    void outOfHours(SessionRef ref, HandoffPriority priority);
}
