package com.legal.consult.exception;

import com.legal.consult.conversation.AiProvider;

/**
 * No active API key is stored for a provider.
 */
public class CredentialException extends LegalConsultException {

    private final AiProvider provider;

    public CredentialException(AiProvider provider) {
        super("No active " + provider.key() + " API key found");
        this.provider = provider;
    }

    public AiProvider getProvider() {
        return provider;
    }
}
