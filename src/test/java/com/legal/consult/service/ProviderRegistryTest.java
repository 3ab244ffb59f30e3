package com.legal.consult.service;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProviderRegistryTest {

    private static LlmProviderAdapter adapter(AiProvider provider) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.provider()).thenReturn(provider);
        return adapter;
    }

    @Test
    void explicitProviderOverridesDefault() {
        LlmProviderAdapter openAi = adapter(AiProvider.OPENAI);
        LlmProviderAdapter deepSeek = adapter(AiProvider.DEEPSEEK);
        ProviderRegistry registry = new ProviderRegistry(List.of(openAi, deepSeek), "openai");

        assertEquals(AiProvider.OPENAI, registry.resolve(null));
        assertEquals(AiProvider.DEEPSEEK, registry.resolve("DeepSeek"));
        assertSame(deepSeek, registry.adapterFor(AiProvider.DEEPSEEK));
    }

    @Test
    void defaultComesFromConfiguration() {
        ProviderRegistry registry = new ProviderRegistry(
                List.of(adapter(AiProvider.OPENAI), adapter(AiProvider.DEEPSEEK)), "deepseek");

        assertEquals(AiProvider.DEEPSEEK, registry.defaultProvider());
        assertEquals(AiProvider.DEEPSEEK, registry.resolve(" "));
    }

    @Test
    void unknownDefaultFallsBackToOpenAi() {
        ProviderRegistry registry = new ProviderRegistry(List.of(adapter(AiProvider.OPENAI)), "gemini");

        assertEquals(AiProvider.OPENAI, registry.defaultProvider());
    }

    @Test
    void unknownRequestedProviderIsBadRequest() {
        ProviderRegistry registry = new ProviderRegistry(List.of(adapter(AiProvider.OPENAI)), "openai");

        assertThrows(InvalidRequestException.class, () -> registry.resolve("gemini"));
    }
}
