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
 * OpenAI Chat Completions.
 */
@Service
public class OpenAiAdapter extends ChatCompletionAdapter {

    public OpenAiAdapter(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                         ObjectMapper mapper,
                         ApiKeyService apiKeyService,
                         @Value("${ai.openai.base-url:https://api.openai.com/v1}") String baseUrl,
                         @Value("${ai.openai.model:gpt-4-turbo-preview}") String model,
                         @Value("${ai.max-tokens:2000}") int maxTokens,
                         @Value("${ai.temperature:0.7}") double temperature) {
        super(restTemplate, mapper, apiKeyService, baseUrl, new ModelConfig(model, maxTokens, temperature));
    }

    @Override
    public AiProvider provider() {
        return AiProvider.OPENAI;
    }

    @Override
    protected void customizeBody(Map<String, Object> body) {
        body.put("top_p", 1);
        body.put("frequency_penalty", 0);
        body.put("presence_penalty", 0);
    }
}
