package com.legal.consult.conversation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Scripted stages of a legal consultation. The order is the nominal flow;
 * transitions are requested by the model through a phase marker.
 */
public enum ConversationPhase {
    INFO_COLLECTION("Information Collection"),
    CASE_ANALYSIS("Case Analysis"),
    PRODUCT_RECOMMENDATION("Product Recommendation"),
    SALES_CONVERSION("Sales Conversion");

    public static final ConversationPhase DEFAULT = INFO_COLLECTION;

    private final String displayName;

    ConversationPhase(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Exact, case-sensitive lookup. Markers are upper snake case, so anything else is unknown.
     */
    public static Optional<ConversationPhase> fromName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(p -> p.name().equals(name))
                .findFirst();
    }

    public static ConversationPhase orDefault(ConversationPhase phase) {
        return phase != null ? phase : DEFAULT;
    }
}
