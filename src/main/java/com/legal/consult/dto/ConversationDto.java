package com.legal.consult.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.entity.Conversation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationDto {
    private String id;
    private String contactId;
    private String subject;
    private Conversation.Status status;
    private ConversationPhase currentPhase;
    private int messageCount;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;
    private List<MessageDto> messages;
}
