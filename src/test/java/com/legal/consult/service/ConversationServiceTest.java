package com.legal.consult.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.conversation.SenderType;
import com.legal.consult.dto.ConversationDto;
import com.legal.consult.dto.CreateConversationRequest;
import com.legal.consult.dto.PageResponse;
import com.legal.consult.entity.Conversation;
import com.legal.consult.entity.ConversationMessage;
import com.legal.consult.exception.ConversationNotFoundException;
import com.legal.consult.exception.InvalidRequestException;
import com.legal.consult.repository.ConversationMessageRepository;
import com.legal.consult.repository.ConversationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

    @Mock
    private ConversationRepository conversationRepository;
    @Mock
    private ConversationMessageRepository messageRepository;

    private ConversationService service;

    @BeforeEach
    void setUp() {
        JsonMetadataMapper metadataMapper = new JsonMetadataMapper(new ObjectMapper());
        service = new ConversationService(conversationRepository, messageRepository,
                new ConversationMapper(metadataMapper), metadataMapper);
    }

    @Test
    void listTranslatesOneBasedPagingAndFilters() {
        Conversation c = Conversation.builder().id("c1").contactId("x").currentPhase(ConversationPhase.CASE_ANALYSIS).build();
        when(conversationRepository.search(eq(Conversation.Status.ACTIVE), eq(ConversationPhase.CASE_ANALYSIS), any()))
                .thenAnswer(inv -> new PageImpl<>(List.of(c), inv.getArgument(2, Pageable.class), 21));

        PageResponse<ConversationDto> page = service.list(2, 10, "active", "case_analysis");

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(conversationRepository).search(any(), any(), pageable.capture());
        assertEquals(1, pageable.getValue().getPageNumber());
        assertEquals(10, pageable.getValue().getPageSize());
        assertEquals(21, page.getPagination().getTotal());
        assertEquals(3, page.getPagination().getPages());
        assertEquals("c1", page.getItems().get(0).getId());
    }

    @Test
    void listClampsLimit() {
        when(conversationRepository.search(isNull(), isNull(), any()))
                .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, ConversationService.MAX_PAGE_SIZE), 0));

        PageResponse<ConversationDto> page = service.list(0, 5000, null, " ");

        assertEquals(1, page.getPagination().getPage());
        assertEquals(ConversationService.MAX_PAGE_SIZE, page.getPagination().getLimit());
    }

    @Test
    void listRejectsUnknownStatus() {
        assertThrows(InvalidRequestException.class, () -> service.list(1, 20, "deleted", null));
    }

    @Test
    void getIncludesMessagesOldestFirst() {
        when(conversationRepository.findById("c1")).thenReturn(Optional.of(
                Conversation.builder().id("c1").contactId("x").build()));
        when(messageRepository.findByConversationIdOrderByCreatedAtAscIdAsc("c1")).thenReturn(List.of(
                ConversationMessage.builder().id(1L).senderType(SenderType.USER).content("hi").build(),
                ConversationMessage.builder().id(2L).senderType(SenderType.ASSISTANT).content("hello")
                        .metadata("{\"provider\":\"openai\"}").build()));

        ConversationDto dto = service.get("c1", true);

        assertEquals(2, dto.getMessages().size());
        assertEquals("openai", dto.getMessages().get(1).getMetadata().get("provider"));
    }

    @Test
    void getWithoutMessagesSkipsMessageQuery() {
        when(conversationRepository.findById("c1")).thenReturn(Optional.of(
                Conversation.builder().id("c1").contactId("x").build()));

        assertNull(service.get("c1", false).getMessages());
        verifyNoInteractions(messageRepository);
    }

    @Test
    void getUnknownIsNotFound() {
        when(conversationRepository.findById("zz")).thenReturn(Optional.empty());

        assertThrows(ConversationNotFoundException.class, () -> service.get("zz", true));
    }

    @Test
    void createStartsInInfoCollection() {
        when(conversationRepository.save(any(Conversation.class))).thenAnswer(inv -> inv.getArgument(0));

        ConversationDto dto = service.create(new CreateConversationRequest(
                "5b1f0f5e-6a43-4a4e-9d8b-0c3c1a9d2f11", "Unpaid wages", Map.of("source", "web")));

        assertEquals(ConversationPhase.INFO_COLLECTION, dto.getCurrentPhase());
        assertEquals(Conversation.Status.ACTIVE, dto.getStatus());
        assertEquals("web", dto.getMetadata().get("source"));
    }

    @Test
    void updateStatusIsCaseInsensitive() {
        Conversation c = Conversation.builder().id("c1").contactId("x").build();
        when(conversationRepository.findById("c1")).thenReturn(Optional.of(c));
        when(conversationRepository.save(c)).thenReturn(c);

        assertEquals(Conversation.Status.CLOSED, service.updateStatus("c1", "Closed").getStatus());
    }

    @Test
    void updateStatusRejectsUnknownValue() {
        assertThrows(InvalidRequestException.class, () -> service.updateStatus("c1", "deleted"));
        verifyNoInteractions(conversationRepository);
    }

    @Test
    void phaseFilterParsingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(ConversationPhase.INFO_COLLECTION, ConversationService.parsePhase("info_collection"));
            assertEquals(ConversationPhase.PRODUCT_RECOMMENDATION, ConversationService.parsePhase(" product_recommendation "));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
