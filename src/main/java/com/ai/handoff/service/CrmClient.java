package com.ai.handoff.service;

import com.ai.handoff.dto.CrmLeadUpdate;

/**
 * Pushes owner and handoff changes to the CRM. Failures are logged by implementations.
 */
public interface CrmClient {

    void syncLead(CrmLeadUpdate update);
}
