package com.legal.consult.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Optional;

/**
 * LLM backends the orchestrator can talk to. {@link #key()} is the provider name used in the key store.
 */
public enum AiProvider {
    OPENAI("openai"),
    DEEPSEEK("deepseek");

    private final String key;

    AiProvider(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<AiProvider> fromKey(String value) {
        if (StringUtils.isBlank(value)) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(p -> p.key.equalsIgnoreCase(v) || p.name().equalsIgnoreCase(v))
                .findFirst();
    }
}
