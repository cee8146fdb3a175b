package com.agentic.core.exception;

/**
 * Failure of a language-model call.
 */
public class LlmException extends AgenticException {
    
    public static final String ERROR_CODE = "LLM_ERROR";
    
    private final String provider;
    private final String model;
    private final long tokensUsed;
    
    public LlmException(String provider, String model, long tokensUsed, String message) {
        super(ERROR_CODE, String.format("[%s/%s] %s", provider, model, message), true);
        this.provider = provider;
        this.model = model;
        this.tokensUsed = tokensUsed;
    }
    
    public LlmException(String provider, String model, long tokensUsed, String message, Throwable cause) {
        super(ERROR_CODE, String.format("[%s/%s] %s", provider, model, message), cause, true);
        this.provider = provider;
        this.model = model;
        this.tokensUsed = tokensUsed;
    }
    
    public String getProvider() {
        return provider;
    }
    
    public String getModel() {
        return model;
    }
    
    public long getTokensUsed() {
        return tokensUsed;
    }
}
