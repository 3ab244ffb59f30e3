package com.legal.consult.dto;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.conversation.ConversationPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResult {
    private MessageDto userTurn;
    private MessageDto assistantTurn;
    private ConversationPhase nextPhase;
    private boolean transitioned;
    private AiProvider provider;
}
