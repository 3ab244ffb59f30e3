package com.legal.consult.service;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.dto.AiResponse;
import com.legal.consult.dto.ChatMessage;
import com.legal.consult.dto.ParsedResponse;
import com.legal.consult.dto.PromptTemplate;
import com.legal.consult.dto.ProviderReply;
import com.legal.consult.dto.TurnResult;
import com.legal.consult.entity.Conversation;
import com.legal.consult.entity.ConversationMessage;
import com.legal.consult.exception.ConcurrentTurnException;
import com.legal.consult.exception.ConversationNotFoundException;
import com.legal.consult.exception.InvalidRequestException;
import com.legal.consult.exception.LegalConsultException;
import com.legal.consult.exception.PersistenceException;
import com.legal.consult.repository.ConversationMessageRepository;
import com.legal.consult.repository.ConversationRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handles one inbound user message: build context, call the provider, parse the phase marker, persist.
 * Nothing is written unless the provider call succeeded; the provider call runs outside any transaction.
 */
@Service
public class ConversationTurnService {

    private static final Logger log = LoggerFactory.getLogger(ConversationTurnService.class);

    private final ConversationRepository conversationRepository;
    private final ConversationMessageRepository messageRepository;
    private final PhaseRegistry phaseRegistry;
    private final ConversationContextBuilder contextBuilder;
    private final ProviderRegistry providerRegistry;
    private final PhaseMarkerParser parser;
    private final ConversationStateUpdater stateUpdater;
    private final ConversationMapper mapper;

    public ConversationTurnService(ConversationRepository conversationRepository,
                                   ConversationMessageRepository messageRepository,
                                   PhaseRegistry phaseRegistry,
                                   ConversationContextBuilder contextBuilder,
                                   ProviderRegistry providerRegistry,
                                   PhaseMarkerParser parser,
                                   ConversationStateUpdater stateUpdater,
                                   ConversationMapper mapper) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.phaseRegistry = phaseRegistry;
        this.contextBuilder = contextBuilder;
        this.providerRegistry = providerRegistry;
        this.parser = parser;
        this.stateUpdater = stateUpdater;
        this.mapper = mapper;
    }

    public TurnResult processTurn(String conversationId, String userMessage, ConversationPhase requestedPhase) {
        return processTurn(conversationId, userMessage, requestedPhase, providerRegistry.defaultProvider(), null);
    }

    public TurnResult processTurn(String conversationId,
                                  String userMessage,
                                  ConversationPhase requestedPhase,
                                  AiProvider provider,
                                  Map<String, Object> userMetadata) {
        if (StringUtils.isBlank(userMessage)) {
            throw new InvalidRequestException("message must not be blank");
        }
        AiProvider effectiveProvider = provider != null ? provider : providerRegistry.defaultProvider();

        Conversation conversation = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        Long observedVersion = conversation.getVersion();
        ConversationPhase phase = requestedPhase != null ? requestedPhase : conversation.getCurrentPhase();

        List<ConversationMessage> history = new ArrayList<>(
                messageRepository.findTop10ByConversationIdOrderByCreatedAtDescIdDesc(conversationId));
        Collections.reverse(history);

        PromptTemplate template = phaseRegistry.templateFor(phase, effectiveProvider);
        List<ChatMessage> messages = contextBuilder.build(userMessage, history, template);

        LlmProviderAdapter adapter = providerRegistry.adapterFor(effectiveProvider);
        ProviderReply reply;
        try {
            reply = adapter.send(messages, adapter.defaultModelConfig());
        } catch (LegalConsultException ex) {
            log.error("[{}] {} call failed in phase {}: {}", conversationId, effectiveProvider.key(), phase, ex.getMessage());
            throw ex;
        }

        ParsedResponse parsed = parser.parse(reply.getRawText(), phase);
        AiResponse aiResponse = new AiResponse(parsed.getContent(), parsed.getNextPhase(), parsed.isTransitioned(),
                buildMetadata(effectiveProvider, reply, phase, conversation.getCurrentPhase(), template, parsed));

        ConversationStateUpdater.AppliedTurn applied;
        try {
            applied = stateUpdater.apply(conversationId, observedVersion, userMessage, userMetadata, aiResponse);
        } catch (OptimisticLockingFailureException ex) {
            throw new ConcurrentTurnException(conversationId, ex);
        } catch (DataAccessException | TransactionException ex) {
            log.error("[{}] failed to persist turn", conversationId, ex);
            throw new PersistenceException("Failed to persist turn for conversation " + conversationId, ex);
        }

        log.info("[{}] turn processed provider={} phase={} next={} transitioned={}",
                conversationId, effectiveProvider.key(), phase, applied.getCurrentPhase(), applied.isPhaseChanged());

        return TurnResult.builder()
                .userTurn(mapper.toDto(applied.getUserTurn()))
                .assistantTurn(mapper.toDto(applied.getAssistantTurn()))
                .nextPhase(applied.getCurrentPhase())
                .transitioned(applied.isPhaseChanged())
                .provider(effectiveProvider)
                .build();
    }

    /**
     * {@code phase} is the phase whose template answered; {@code original_phase} is the stored pointer
     * before this turn. They differ only when the request named a phase.
     */
    private static Map<String, Object> buildMetadata(AiProvider provider, ProviderReply reply, ConversationPhase phase,
                                                     ConversationPhase storedPhase, PromptTemplate template,
                                                     ParsedResponse parsed) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", provider.key());
        metadata.put("model", reply.getModel());
        metadata.put("tokens_used", reply.getTokensUsed());
        metadata.put("phase", phase.name());
        metadata.put("template_source", template.getSource().name());
        metadata.put("phase_transition", parsed.isTransitioned());
        metadata.put("original_phase", ConversationPhase.orDefault(storedPhase).name());
        if (parsed.getRejectedPhase() != null) {
            metadata.put("rejected_phase", parsed.getRejectedPhase());
        }
        return metadata;
    }
}
