package com.legal.consult.dto;

import com.legal.consult.conversation.ConversationPhase;

/**
 * Reply text with the phase marker removed, plus the transition it requested.
 */
public final class ParsedResponse {

    private final String content;
    private final ConversationPhase nextPhase;
    private final boolean transitioned;
    private final String rejectedPhase;

    public ParsedResponse(String content, ConversationPhase nextPhase, boolean transitioned, String rejectedPhase) {
        this.content = content;
        this.nextPhase = nextPhase;
        this.transitioned = transitioned;
        this.rejectedPhase = rejectedPhase;
    }

    public String getContent() {
        return content;
    }

    public ConversationPhase getNextPhase() {
        return nextPhase;
    }

    public boolean isTransitioned() {
        return transitioned;
    }

    /** Marker token that named no known phase, or null. */
    public String getRejectedPhase() {
        return rejectedPhase;
    }

    public boolean hasMarker() {
        return transitioned || rejectedPhase != null;
    }
}
