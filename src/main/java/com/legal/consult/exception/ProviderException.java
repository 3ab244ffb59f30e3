package com.legal.consult.exception;

import com.legal.consult.conversation.AiProvider;

/**
 * Network failure, non-2xx status or unreadable payload from an LLM provider.
 */
public class ProviderException extends LegalConsultException {

    private final AiProvider provider;
    private final Integer statusCode;

    public ProviderException(AiProvider provider, String message, Integer statusCode, Throwable cause) {
        super(provider.key() + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public ProviderException(AiProvider provider, String message) {
        this(provider, message, null, null);
    }

    public AiProvider getProvider() {
        return provider;
    }

    /** HTTP status returned by the provider, or null when no response was received. */
    public Integer getStatusCode() {
        return statusCode;
    }
}
