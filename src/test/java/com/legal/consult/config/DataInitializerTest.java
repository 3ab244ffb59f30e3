package com.legal.consult.config;

import com.legal.consult.entity.AiApiKey;
import com.legal.consult.repository.AiApiKeyRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataInitializerTest {

    @Mock
    private AiApiKeyRepository repository;

    @Test
    void storesConfiguredKeyWhenProviderHasNone() {
        when(repository.existsByProviderAndActiveTrue("openai")).thenReturn(false);

        new DataInitializer(repository, " sk-from-env ", "").seed();

        ArgumentCaptor<AiApiKey> saved = ArgumentCaptor.forClass(AiApiKey.class);
        verify(repository).save(saved.capture());
        assertEquals("openai", saved.getValue().getProvider());
        assertEquals("sk-from-env", saved.getValue().getApiKey());
        verify(repository, never()).existsByProviderAndActiveTrue("deepseek");
    }

    @Test
    void existingActiveKeyIsKept() {
        when(repository.existsByProviderAndActiveTrue("openai")).thenReturn(true);
        when(repository.existsByProviderAndActiveTrue("deepseek")).thenReturn(true);

        new DataInitializer(repository, "sk-1", "ds-1").seed();

        verify(repository, never()).save(any());
    }
}
