package com.ai.handoff.service;

import com.ai.handoff.dto.CrmLeadUpdate;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestCrmClientTest {

    private final MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
    private final RestCrmClient client = new RestCrmClient(new RestTemplateBuilder(customizer));
    private final MockRestServiceServer server = customizer.getServer();

    @Test
    void posts_the_lead_with_its_owner() {
        ReflectionTestUtils.setField(client, "baseUrl", "http://crm.local");
        server.expect(requestTo("http://crm.local/leads"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.identity").value("+573001234567"))
                .andExpect(jsonPath("$.owner_id").value("87367331"))
                .andExpect(jsonPath("$.channel").value("facebook"))
                .andRespond(withSuccess());

        client.syncLead(new CrmLeadUpdate("+573001234567", "87367331", "Client request", "facebook"));

        server.verify();
    }

    @Test
    void crm_failure_is_not_propagated() {
        ReflectionTestUtils.setField(client, "baseUrl", "http://crm.local");
        server.expect(requestTo("http://crm.local/leads")).andRespond(withServerError());

        client.syncLead(new CrmLeadUpdate("+573001234567", null, null, "facebook"));

        server.verify();
    }
}
