package com.legal.consult.service;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter lookup by provider. The configured default only applies when a caller names no provider.
 */
@Service
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<AiProvider, LlmProviderAdapter> adapters = new EnumMap<>(AiProvider.class);
    private final AiProvider defaultProvider;

    public ProviderRegistry(List<LlmProviderAdapter> adapters,
                            @Value("${ai.default-provider:openai}") String defaultProvider) {
        for (LlmProviderAdapter adapter : adapters) {
            this.adapters.put(adapter.provider(), adapter);
        }
        this.defaultProvider = AiProvider.fromKey(defaultProvider).orElseGet(() -> {
            log.warn("Unknown ai.default-provider '{}', falling back to openai", defaultProvider);
            return AiProvider.OPENAI;
        });
        log.info("LLM providers available={} default={}", this.adapters.keySet(), this.defaultProvider.key());
    }

    public AiProvider defaultProvider() {
        return defaultProvider;
    }

    /** Blank means the default provider; an unknown name is a bad request. */
    public AiProvider resolve(String requested) {
        if (requested == null || requested.isBlank()) return defaultProvider;
        return AiProvider.fromKey(requested)
                .orElseThrow(() -> new InvalidRequestException("Unknown provider: " + requested));
    }

    public LlmProviderAdapter adapterFor(AiProvider provider) {
        LlmProviderAdapter adapter = adapters.get(provider != null ? provider : defaultProvider);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for " + provider);
        }
        return adapter;
    }

    public Map<AiProvider, LlmProviderAdapter> adapters() {
        return Collections.unmodifiableMap(adapters);
    }
}
