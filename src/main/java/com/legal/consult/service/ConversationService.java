package com.legal.consult.service;

import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.dto.ConversationDto;
import com.legal.consult.dto.CreateConversationRequest;
import com.legal.consult.dto.MessageDto;
import com.legal.consult.dto.PageResponse;
import com.legal.consult.entity.Conversation;
import com.legal.consult.exception.ConversationNotFoundException;
import com.legal.consult.exception.InvalidRequestException;
import com.legal.consult.repository.ConversationMessageRepository;
import com.legal.consult.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Conversation lifecycle outside the turn pipeline: create, list, inspect, change status.
 */
@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final ConversationRepository conversationRepository;
    private final ConversationMessageRepository messageRepository;
    private final ConversationMapper mapper;
    private final JsonMetadataMapper metadataMapper;

    @Transactional(readOnly = true)
    public PageResponse<ConversationDto> list(int page, int limit, String status, String phase) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        Conversation.Status statusFilter = StringUtils.isBlank(status) ? null : parseStatus(status);
        ConversationPhase phaseFilter = StringUtils.isBlank(phase) ? null : parsePhase(phase);

        Page<Conversation> result = conversationRepository.search(statusFilter, phaseFilter,
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "updatedAt")));

        List<ConversationDto> items = result.getContent().stream()
                .map(c -> mapper.toDto(c, null))
                .collect(Collectors.toList());
        return new PageResponse<>(items, new PageResponse.Pagination(
                safePage, safeLimit, result.getTotalElements(), result.getTotalPages()));
    }

    @Transactional(readOnly = true)
    public ConversationDto get(String id, boolean includeMessages) {
        Conversation conversation = conversationRepository.findById(id)
                .orElseThrow(() -> new ConversationNotFoundException(id));
        List<MessageDto> messages = null;
        if (includeMessages) {
            messages = messageRepository.findByConversationIdOrderByCreatedAtAscIdAsc(id).stream()
                    .map(mapper::toDto)
                    .collect(Collectors.toList());
        }
        return mapper.toDto(conversation, messages);
    }

    @Transactional
    public ConversationDto create(CreateConversationRequest request) {
        Conversation saved = conversationRepository.save(Conversation.builder()
                .contactId(request.getContactId())
                .subject(request.getSubject())
                .metadata(metadataMapper.write(request.getMetadata()))
                .build());
        log.info("New conversation created: {}", saved.getId());
        return mapper.toDto(saved, null);
    }

    @Transactional
    public ConversationDto updateStatus(String id, String status) {
        Conversation.Status newStatus = parseStatus(status);
        Conversation conversation = conversationRepository.findById(id)
                .orElseThrow(() -> new ConversationNotFoundException(id));
        conversation.setStatus(newStatus);
        Conversation saved = conversationRepository.save(conversation);
        log.info("Conversation {} status -> {}", id, newStatus);
        return mapper.toDto(saved, null);
    }

    static Conversation.Status parseStatus(String status) {
        if (StringUtils.isBlank(status)) {
            throw new InvalidRequestException("Status must be one of: active, closed, archived");
        }
        return Arrays.stream(Conversation.Status.values())
                .filter(s -> s.name().equalsIgnoreCase(status.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException("Status must be one of: active, closed, archived"));
    }

    public static ConversationPhase parsePhase(String phase) {
        return ConversationPhase.fromName(phase.trim().toUpperCase(Locale.ROOT))
                .orElseThrow(() -> new InvalidRequestException("Unknown phase: " + phase));
    }
}
