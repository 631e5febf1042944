package com.ai.handoff.service;

import com.ai.handoff.conversation.AssistantSignal;
import com.ai.handoff.conversation.HandoffPriority;
import com.ai.handoff.dto.AssistantReply;
import com.ai.handoff.dto.AssistantRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the assistant service over HTTP: POST {@code {base-url}/reply} with the request
 * as JSON, expecting {@code {"reply": "...", "signal": {"handoff_priority": ...}}}.
 */
@Service
public class HttpAssistantClient implements AssistantClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAssistantClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${assistant.base-url:}")
    private String baseUrl;

    @Value("${assistant.api-key:}")
    private String apiKey;

    public HttpAssistantClient(RestTemplateBuilder builder,
                               @Value("${assistant.timeout:20s}") Duration timeout) {
        this.restTemplate = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Override
    public AssistantReply reply(AssistantRequest request) {
        if (StringUtils.isBlank(baseUrl)) {
            log.warn("assistant.base-url not set; skipping reply for {}", request.identity());
            return AssistantReply.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(apiKey)) {
            headers.setBearerAuth(apiKey);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("identity", request.identity());
        body.put("channel", request.channel());
        body.put("message", request.text());
        body.put("status", request.status().name());
        body.put("timeout_signal", request.timeoutSignal().name());
        body.put("display_name", request.displayName());
        body.put("message_count", request.messageCount());

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    StringUtils.removeEnd(baseUrl, "/") + "/reply", new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                log.warn("[{}:{}] Assistant returned {}", request.identity(), request.channel(), response.getStatusCode());
                return AssistantReply.empty();
            }
            return parse(response.getBody());
        } catch (RestClientException | IOException e) {
            log.error("[{}:{}] Assistant call failed", request.identity(), request.channel(), e);
            return AssistantReply.empty();
        }
    }

    AssistantReply parse(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        String text = root.path("reply").asText(root.path("text").asText("")).trim();
        JsonNode signal = root.path("signal");
        HandoffPriority priority = HandoffPriority.fromValue(
                signal.path("handoff_priority").asText(signal.path("handoffPriority").asText(null)));
        boolean visitIntent = signal.path("visit_intent").asBoolean(signal.path("visitIntent").asBoolean(false));
        int sentiment = signal.path("sentiment_score").asInt(signal.path("sentimentScore").asInt(0));
        return new AssistantReply(text, new AssistantSignal(priority, visitIntent, sentiment));
    }
}
