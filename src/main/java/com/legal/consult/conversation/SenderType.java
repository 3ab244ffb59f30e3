package com.legal.consult.conversation;

/**
 * Who wrote a turn. Maps one-to-one onto chat completion roles.
 */
public enum SenderType {
    USER("user"),
    ASSISTANT("assistant");

    private final String role;

    SenderType(String role) {
        this.role = role;
    }

    public String role() {
        return role;
    }
}
