package com.legal.consult.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.consult.dto.ChatMessage;
import com.legal.consult.dto.ModelConfig;
import com.legal.consult.dto.ProviderReply;
import com.legal.consult.exception.ProviderException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared client for OpenAI-compatible {@code /chat/completions} endpoints.
 * Subclasses name the provider and add vendor-specific request fields.
 */
public abstract class ChatCompletionAdapter implements LlmProviderAdapter {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final ApiKeyService apiKeyService;
    private final String baseUrl;
    private final ModelConfig defaults;

    protected ChatCompletionAdapter(RestTemplate restTemplate,
                                    ObjectMapper mapper,
                                    ApiKeyService apiKeyService,
                                    String baseUrl,
                                    ModelConfig defaults) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.apiKeyService = apiKeyService;
        this.baseUrl = StringUtils.removeEnd(baseUrl.trim(), "/");
        this.defaults = defaults;
    }

    @Override
    public ModelConfig defaultModelConfig() {
        return defaults;
    }

    /** Adds provider-specific fields to the request body. */
    protected abstract void customizeBody(Map<String, Object> body);

    @Override
    public ProviderReply send(List<ChatMessage> messages, ModelConfig modelConfig) {
        ModelConfig config = modelConfig != null ? modelConfig : defaults;
        String apiKey = apiKeyService.getActiveKey(provider());

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> payloadMessages = new ArrayList<>();
        for (ChatMessage msg : messages) {
            Map<String, String> m = new LinkedHashMap<>();
            m.put("role", msg.getRole());
            m.put("content", msg.getContent());
            payloadMessages.add(m);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("messages", payloadMessages);
        body.put("max_tokens", config.getMaxTokens());
        body.put("temperature", config.getTemperature());
        customizeBody(body);

        String url = baseUrl + "/chat/completions";
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException ex) {
            log.error("{} returned HTTP {}: {}", provider().key(), ex.getStatusCode().value(),
                    StringUtils.abbreviate(ex.getResponseBodyAsString(), 500));
            throw new ProviderException(provider(), "HTTP " + ex.getStatusCode().value(), ex.getStatusCode().value(), ex);
        } catch (ResourceAccessException ex) {
            log.error("{} request failed: {}", provider().key(), ex.getMessage());
            throw new ProviderException(provider(), "I/O error: " + ex.getMessage(), null, ex);
        } catch (RestClientException ex) {
            log.error("{} request failed", provider().key(), ex);
            throw new ProviderException(provider(), ex.getMessage(), null, ex);
        }

        ProviderReply reply = readReply(response.getBody(), config);
        log.info("{} reply model={} tokens={}", provider().key(), reply.getModel(), reply.getTokensUsed());
        return reply;
    }

    private ProviderReply readReply(String responseBody, ModelConfig config) {
        if (StringUtils.isBlank(responseBody)) {
            throw new ProviderException(provider(), "empty response body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException ex) {
            throw new ProviderException(provider(), "malformed response payload", null, ex);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ProviderException(provider(), "response has no choices[0].message.content");
        }
        int tokens = root.path("usage").path("total_tokens").asInt(0);
        String model = root.path("model").asText(config.getModel());
        return new ProviderReply(content.asText(), tokens, model);
    }
}
