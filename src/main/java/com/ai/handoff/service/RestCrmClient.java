package com.ai.handoff.service;

import com.ai.handoff.dto.CrmLeadUpdate;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class RestCrmClient implements CrmClient {

    private static final Logger log = LoggerFactory.getLogger(RestCrmClient.class);

    private final RestTemplate restTemplate;

    @Value("${crm.base-url:}")
    private String baseUrl;

    @Value("${crm.api-key:}")
    private String apiKey;

    public RestCrmClient(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    @Override
    public void syncLead(CrmLeadUpdate update) {
        if (StringUtils.isBlank(baseUrl)) {
            log.warn("crm.base-url not set; skipping lead sync for {}", update.identity());
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(apiKey)) {
            headers.setBearerAuth(apiKey);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("identity", update.identity());
        body.put("owner_id", update.ownerId());
        body.put("handoff_reason", update.handoffReason());
        body.put("channel", update.channel());

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    StringUtils.removeEnd(baseUrl, "/") + "/leads", new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("[{}:{}] CRM sync returned {}", update.identity(), update.channel(), response.getStatusCode());
            }
        } catch (RestClientException e) {
            log.error("[{}:{}] CRM sync failed", update.identity(), update.channel(), e);
        }
    }
}
