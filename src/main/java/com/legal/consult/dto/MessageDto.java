package com.legal.consult.dto;

import com.legal.consult.conversation.SenderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDto {
    private Long id;
    private String conversationId;
    private SenderType senderType;
    private String content;
    private Map<String, Object> metadata;
    private Instant createdAt;
}
