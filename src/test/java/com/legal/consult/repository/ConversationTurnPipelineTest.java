package com.legal.consult.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.consult.conversation.AiProvider;
import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.conversation.SenderType;
import com.legal.consult.dto.AiResponse;
import com.legal.consult.dto.ChatMessage;
import com.legal.consult.dto.ModelConfig;
import com.legal.consult.dto.ProviderReply;
import com.legal.consult.dto.TurnResult;
import com.legal.consult.entity.Conversation;
import com.legal.consult.entity.ConversationMessage;
import com.legal.consult.exception.ConcurrentTurnException;
import com.legal.consult.exception.ProviderException;
import com.legal.consult.service.ConversationContextBuilder;
import com.legal.consult.service.ConversationMapper;
import com.legal.consult.service.ConversationStateUpdater;
import com.legal.consult.service.ConversationTurnService;
import com.legal.consult.service.JsonMetadataMapper;
import com.legal.consult.service.LlmProviderAdapter;
import com.legal.consult.service.PhaseMarkerParser;
import com.legal.consult.service.PhaseRegistry;
import com.legal.consult.service.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the turn pipeline against real repositories with a scripted provider.
 */
@DataJpaTest
class ConversationTurnPipelineTest {

    @Autowired
    private ConversationRepository conversationRepository;
    @Autowired
    private ConversationMessageRepository messageRepository;
    @Autowired
    private PromptTemplateRepository templateRepository;
    @Autowired
    private TestEntityManager em;

    private final ScriptedAdapter adapter = new ScriptedAdapter();
    private ConversationStateUpdater stateUpdater;
    private ConversationTurnService turnService;

    @BeforeEach
    void setUp() {
        JsonMetadataMapper metadataMapper = new JsonMetadataMapper(new ObjectMapper());
        stateUpdater = new ConversationStateUpdater(conversationRepository, messageRepository, metadataMapper);
        turnService = new ConversationTurnService(
                conversationRepository,
                messageRepository,
                new PhaseRegistry(templateRepository, metadataMapper),
                new ConversationContextBuilder(),
                new ProviderRegistry(List.of(adapter), "openai"),
                new PhaseMarkerParser(),
                stateUpdater,
                new ConversationMapper(metadataMapper));
    }

    private Conversation newConversation() {
        Conversation c = conversationRepository.saveAndFlush(Conversation.builder()
                .contactId("5b1f0f5e-6a43-4a4e-9d8b-0c3c1a9d2f11")
                .subject("Car accident")
                .build());
        em.clear();
        return c;
    }

    @Test
    void firstTurnWithMarkerMovesToCaseAnalysis() {
        Conversation c = newConversation();
        adapter.reply = "I'm sorry to hear that. Were you injured? [NEXT_PHASE:CASE_ANALYSIS]";

        TurnResult result = turnService.processTurn(c.getId(), "I was in a car accident yesterday", null);
        em.flush();
        em.clear();

        assertEquals(ConversationPhase.CASE_ANALYSIS, result.getNextPhase());
        assertEquals(ConversationPhase.CASE_ANALYSIS,
                conversationRepository.findById(c.getId()).orElseThrow().getCurrentPhase());

        List<ConversationMessage> turns = messageRepository.findByConversationIdOrderByCreatedAtAscIdAsc(c.getId());
        assertEquals(2, turns.size());
        assertEquals(SenderType.USER, turns.get(0).getSenderType());
        assertEquals("I was in a car accident yesterday", turns.get(0).getContent());
        assertEquals(SenderType.ASSISTANT, turns.get(1).getSenderType());
        assertEquals("I'm sorry to hear that. Were you injured?", turns.get(1).getContent());
        assertTrue(turns.get(1).getMetadata().contains("\"phase_transition\":true"));
        assertEquals(2, conversationRepository.findById(c.getId()).orElseThrow().getMessageCount());
    }

    @Test
    void secondTurnSeesFirstTurnInContext() {
        Conversation c = newConversation();
        adapter.reply = "When did it happen?";
        turnService.processTurn(c.getId(), "I need help with a car accident", null);
        em.flush();
        em.clear();

        adapter.reply = "Thanks. [NEXT_PHASE:CASE_ANALYSIS]";
        turnService.processTurn(c.getId(), "Yesterday", null);

        List<ChatMessage> sent = adapter.lastMessages;
        assertEquals(4, sent.size());
        assertEquals(new ChatMessage("user", "I need help with a car accident"), sent.get(1));
        assertEquals(new ChatMessage("assistant", "When did it happen?"), sent.get(2));
        assertEquals(new ChatMessage("user", "Yesterday"), sent.get(3));
    }

    @Test
    void providerFailureLeavesConversationUntouched() {
        Conversation c = newConversation();
        adapter.failure = new ProviderException(AiProvider.OPENAI, "HTTP 502", 502, null);

        assertThrows(ProviderException.class,
                () -> turnService.processTurn(c.getId(), "I was in a car accident yesterday", null));
        em.flush();
        em.clear();

        assertEquals(0, messageRepository.countByConversationId(c.getId()));
        assertEquals(ConversationPhase.INFO_COLLECTION,
                conversationRepository.findById(c.getId()).orElseThrow().getCurrentPhase());
    }

    @Test
    void staleVersionIsRejected() {
        Conversation c = newConversation();
        AiResponse response = new AiResponse("reply", ConversationPhase.CASE_ANALYSIS, true, Map.of());

        stateUpdater.apply(c.getId(), c.getVersion(), "first", null, response);
        em.flush();
        em.clear();

        assertThrows(ConcurrentTurnException.class,
                () -> stateUpdater.apply(c.getId(), c.getVersion(), "racing", null, response));
    }

    @Test
    void searchFiltersByPhase() {
        Conversation c = newConversation();
        adapter.reply = "[NEXT_PHASE:CASE_ANALYSIS] Let's analyze.";
        turnService.processTurn(c.getId(), "enough details", null);
        newConversation();
        em.flush();

        assertEquals(1, conversationRepository.search(null, ConversationPhase.CASE_ANALYSIS,
                org.springframework.data.domain.PageRequest.of(0, 10)).getTotalElements());
        assertEquals(2, conversationRepository.search(Conversation.Status.ACTIVE, null,
                org.springframework.data.domain.PageRequest.of(0, 10)).getTotalElements());
    }

    private static final class ScriptedAdapter implements LlmProviderAdapter {
        private String reply = "";
        private RuntimeException failure;
        private List<ChatMessage> lastMessages;

        @Override
        public AiProvider provider() {
            return AiProvider.OPENAI;
        }

        @Override
        public ModelConfig defaultModelConfig() {
            return new ModelConfig("scripted", 100, 0.0);
        }

        @Override
        public ProviderReply send(List<ChatMessage> messages, ModelConfig modelConfig) {
            lastMessages = messages;
            if (failure != null) throw failure;
            return new ProviderReply(reply, 42, modelConfig.getModel());
        }
    }
}
