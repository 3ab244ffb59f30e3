package com.legal.consult.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.consult.conversation.AiProvider;
import com.legal.consult.dto.ModelConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * DeepSeek chat API (OpenAI-compatible wire format, non-streaming).
 */
@Service
public class DeepSeekAdapter extends ChatCompletionAdapter {

    public DeepSeekAdapter(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                           ObjectMapper mapper,
                           ApiKeyService apiKeyService,
                           @Value("${ai.deepseek.base-url:https://api.deepseek.com/v1}") String baseUrl,
                           @Value("${ai.deepseek.model:deepseek-chat}") String model,
                           @Value("${ai.max-tokens:2000}") int maxTokens,
                           @Value("${ai.temperature:0.7}") double temperature) {
        super(restTemplate, mapper, apiKeyService, baseUrl, new ModelConfig(model, maxTokens, temperature));
    }

    @Override
    public AiProvider provider() {
        return AiProvider.DEEPSEEK;
    }

    @Override
    protected void customizeBody(Map<String, Object> body) {
        body.put("stream", false);
    }
}
