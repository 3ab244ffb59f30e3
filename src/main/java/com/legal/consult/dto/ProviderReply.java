package com.legal.consult.dto;

public final class ProviderReply {

    private final String rawText;
    private final int tokensUsed;
    private final String model;

    public ProviderReply(String rawText, int tokensUsed, String model) {
        this.rawText = rawText != null ? rawText : "";
        this.tokensUsed = tokensUsed;
        this.model = model;
    }

    public String getRawText() {
        return rawText;
    }

    public int getTokensUsed() {
        return tokensUsed;
    }

    public String getModel() {
        return model;
    }
}
