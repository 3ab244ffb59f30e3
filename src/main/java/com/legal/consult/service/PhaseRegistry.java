package com.legal.consult.service;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.dto.PromptTemplate;
import com.legal.consult.entity.PromptTemplateEntity;
import com.legal.consult.repository.PromptTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the system prompt for a phase. Active templates in the store win;
 * otherwise the built-in prompt for the provider's language is used. Never fails.
 */
@Service
public class PhaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhaseRegistry.class);

    private final PromptTemplateRepository repository;
    private final JsonMetadataMapper metadataMapper;
    private final Map<AiProvider, Map<ConversationPhase, String>> builtIn = new EnumMap<>(AiProvider.class);

    public PhaseRegistry(PromptTemplateRepository repository, JsonMetadataMapper metadataMapper) {
        this.repository = repository;
        this.metadataMapper = metadataMapper;
        builtIn.put(AiProvider.OPENAI, loadBuiltIn("en"));
        builtIn.put(AiProvider.DEEPSEEK, loadBuiltIn("zh"));
    }

    public PromptTemplate templateFor(ConversationPhase phase, AiProvider provider) {
        ConversationPhase effective = ConversationPhase.orDefault(phase);
        Optional<PromptTemplateEntity> stored;
        try {
            stored = repository.findFirstByPhaseAndActiveTrueOrderByVersionDesc(effective);
        } catch (RuntimeException ex) {
            log.error("Template lookup failed for phase {}, using built-in prompt", effective, ex);
            stored = Optional.empty();
        }
        if (stored.isPresent()) {
            PromptTemplateEntity t = stored.get();
            log.debug("Using stored template phase={} version={}", effective, t.getVersion());
            return new PromptTemplate(effective, t.getTemplateContent(),
                    metadataMapper.readStrings(t.getVariables()), PromptTemplate.Source.STORE);
        }
        return builtInTemplate(effective, provider);
    }

    public PromptTemplate builtInTemplate(ConversationPhase phase, AiProvider provider) {
        ConversationPhase effective = ConversationPhase.orDefault(phase);
        Map<ConversationPhase, String> byPhase = builtIn.get(provider != null ? provider : AiProvider.OPENAI);
        return new PromptTemplate(effective, byPhase.get(effective), Collections.emptyMap(), PromptTemplate.Source.BUILT_IN);
    }

    private static Map<ConversationPhase, String> loadBuiltIn(String language) {
        Map<ConversationPhase, String> byPhase = new EnumMap<>(ConversationPhase.class);
        for (ConversationPhase phase : ConversationPhase.values()) {
            ClassPathResource resource = new ClassPathResource("prompts/" + language + "/" + phase.name() + ".txt");
            try (InputStream in = resource.getInputStream()) {
                byPhase.put(phase, StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim());
            } catch (IOException e) {
                throw new UncheckedIOException("Missing built-in prompt " + resource.getPath(), e);
            }
        }
        return byPhase;
    }
}
