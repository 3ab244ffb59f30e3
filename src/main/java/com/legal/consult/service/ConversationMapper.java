package com.legal.consult.service;

import com.legal.consult.dto.ConversationDto;
import com.legal.consult.dto.MessageDto;
import com.legal.consult.entity.Conversation;
import com.legal.consult.entity.ConversationMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ConversationMapper {

    private final JsonMetadataMapper metadataMapper;

    public MessageDto toDto(ConversationMessage message) {
        return MessageDto.builder()
                .id(message.getId())
                .conversationId(message.getConversationId())
                .senderType(message.getSenderType())
                .content(message.getContent())
                .metadata(metadataMapper.read(message.getMetadata()))
                .createdAt(message.getCreatedAt())
                .build();
    }

    public ConversationDto toDto(Conversation conversation, List<MessageDto> messages) {
        return ConversationDto.builder()
                .id(conversation.getId())
                .contactId(conversation.getContactId())
                .subject(conversation.getSubject())
                .status(conversation.getStatus())
                .currentPhase(conversation.getCurrentPhase())
                .messageCount(conversation.getMessageCount())
                .metadata(metadataMapper.read(conversation.getMetadata()))
                .createdAt(conversation.getCreatedAt())
                .updatedAt(conversation.getUpdatedAt())
                .messages(messages)
                .build();
    }
}
