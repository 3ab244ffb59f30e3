package com.legal.consult.config;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.entity.AiApiKey;
import com.legal.consult.repository.AiApiKeyRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;

/**
 * Idempotent bootstrap: copies provider keys from configuration into the key store
 * when that provider has no active key yet. Safe to re-run.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final AiApiKeyRepository apiKeyRepository;
    private final Map<AiProvider, String> configuredKeys = new EnumMap<>(AiProvider.class);

    public DataInitializer(AiApiKeyRepository apiKeyRepository,
                           @Value("${ai.openai.api-key:}") String openAiKey,
                           @Value("${ai.deepseek.api-key:}") String deepSeekKey) {
        this.apiKeyRepository = apiKeyRepository;
        configuredKeys.put(AiProvider.OPENAI, openAiKey);
        configuredKeys.put(AiProvider.DEEPSEEK, deepSeekKey);
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        configuredKeys.forEach((provider, key) -> {
            if (StringUtils.isBlank(key)) {
                return;
            }
            if (apiKeyRepository.existsByProviderAndActiveTrue(provider.key())) {
                log.debug("Active {} key already stored, skipping bootstrap", provider.key());
                return;
            }
            apiKeyRepository.save(AiApiKey.builder()
                    .provider(provider.key())
                    .apiKey(key.trim())
                    .label("bootstrap")
                    .active(true)
                    .build());
            log.info("Bootstrapped {} API key from configuration", provider.key());
        });
    }
}
