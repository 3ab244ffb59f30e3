package com.legal.consult.service;

import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.dto.ParsedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the {@code [NEXT_PHASE:X]} marker out of a model reply. Only the first marker counts
 * and only that one is removed. A token outside {@link ConversationPhase} does not move the
 * conversation; it is stripped and reported as rejected.
 */
@Component
public class PhaseMarkerParser {

    private static final Logger log = LoggerFactory.getLogger(PhaseMarkerParser.class);

    static final Pattern NEXT_PHASE = Pattern.compile("\\[NEXT_PHASE:([A-Z_]+)\\]");

    public ParsedResponse parse(String rawText, ConversationPhase currentPhase) {
        String text = rawText != null ? rawText : "";
        Matcher m = NEXT_PHASE.matcher(text);
        if (!m.find()) {
            return new ParsedResponse(text, currentPhase, false, null);
        }

        String token = m.group(1);
        String content = (text.substring(0, m.start()) + text.substring(m.end())).trim();
        Optional<ConversationPhase> next = ConversationPhase.fromName(token);
        if (next.isEmpty()) {
            log.warn("Ignoring unknown phase marker '{}' (current phase {})", token, currentPhase);
            return new ParsedResponse(content, currentPhase, false, token);
        }
        return new ParsedResponse(content, next.get(), true, null);
    }
}
