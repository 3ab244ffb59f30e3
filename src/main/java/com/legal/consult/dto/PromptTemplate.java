package com.legal.consult.dto;

import com.legal.consult.conversation.ConversationPhase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * System prompt resolved for a phase, either from the template store or the built-in defaults.
 */
public final class PromptTemplate {

    public enum Source { STORE, BUILT_IN }

    private final ConversationPhase phase;
    private final String content;
    private final Map<String, String> variables;
    private final Source source;

    public PromptTemplate(ConversationPhase phase, String content, Map<String, String> variables, Source source) {
        this.phase = phase;
        this.content = content != null ? content : "";
        this.variables = variables == null ? Collections.emptyMap() : new LinkedHashMap<>(variables);
        this.source = source;
    }

    public ConversationPhase getPhase() {
        return phase;
    }

    public String getContent() {
        return content;
    }

    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Source getSource() {
        return source;
    }
}
