package com.legal.consult.service;

import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.conversation.SenderType;
import com.legal.consult.dto.AiResponse;
import com.legal.consult.entity.Conversation;
import com.legal.consult.entity.ConversationMessage;
import com.legal.consult.exception.ConcurrentTurnException;
import com.legal.consult.exception.ConversationNotFoundException;
import com.legal.consult.repository.ConversationMessageRepository;
import com.legal.consult.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Writes one completed turn: the user message, the assistant reply and the phase pointer, in a single transaction.
 */
@Service
@RequiredArgsConstructor
public class ConversationStateUpdater {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateUpdater.class);

    private final ConversationRepository conversationRepository;
    private final ConversationMessageRepository messageRepository;
    private final JsonMetadataMapper metadataMapper;

    /**
     * @param expectedVersion conversation version read before the provider call; a different version means
     *                        another turn was committed in between
     */
    @Transactional
    public AppliedTurn apply(String conversationId,
                             Long expectedVersion,
                             String userMessage,
                             Map<String, Object> userMetadata,
                             AiResponse response) {
        Conversation conversation = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        if (expectedVersion != null && !Objects.equals(expectedVersion, conversation.getVersion())) {
            throw new ConcurrentTurnException(conversationId, null);
        }

        Instant now = Instant.now();
        ConversationMessage userTurn = messageRepository.save(ConversationMessage.builder()
                .conversationId(conversationId)
                .senderType(SenderType.USER)
                .content(userMessage)
                .metadata(metadataMapper.write(userMetadata))
                .createdAt(now)
                .build());
        ConversationMessage assistantTurn = messageRepository.save(ConversationMessage.builder()
                .conversationId(conversationId)
                .senderType(SenderType.ASSISTANT)
                .content(response.getContent())
                .metadata(metadataMapper.write(response.getMetadata()))
                .createdAt(now)
                .build());

        ConversationPhase previous = conversation.getCurrentPhase();
        boolean phaseChanged = response.isTransitioned()
                && response.getNextPhase() != null
                && response.getNextPhase() != previous;
        if (phaseChanged) {
            conversation.setCurrentPhase(response.getNextPhase());
            log.info("[{}] phase {} -> {}", conversationId, previous, response.getNextPhase());
        }
        conversation.setMessageCount(conversation.getMessageCount() + 2);
        conversationRepository.saveAndFlush(conversation);

        return new AppliedTurn(userTurn, assistantTurn, conversation.getCurrentPhase(), phaseChanged);
    }

    public static final class AppliedTurn {
        private final ConversationMessage userTurn;
        private final ConversationMessage assistantTurn;
        private final ConversationPhase currentPhase;
        private final boolean phaseChanged;

        public AppliedTurn(ConversationMessage userTurn, ConversationMessage assistantTurn,
                           ConversationPhase currentPhase, boolean phaseChanged) {
            this.userTurn = userTurn;
            this.assistantTurn = assistantTurn;
            this.currentPhase = currentPhase;
            this.phaseChanged = phaseChanged;
        }

        public ConversationMessage getUserTurn() {
            return userTurn;
        }

        public ConversationMessage getAssistantTurn() {
            return assistantTurn;
        }

        public ConversationPhase getCurrentPhase() {
            return currentPhase;
        }

        public boolean isPhaseChanged() {
            return phaseChanged;
        }
    }
}
