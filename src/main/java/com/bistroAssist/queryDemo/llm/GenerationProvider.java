package com.bistroAssist.queryDemo.llm;

import com.bistroAssist.queryDemo.llm.dto.ChatMessage;

import java.util.List;

/**
 * Text generation capability used for intent fallback classification and answer generation.
 * Failures surface as {@link com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException}.
 */
public interface GenerationProvider {

    GenerationResult complete(List<ChatMessage> messages, GenerationOptions options);

    /**
     * Opens a streamed completion. The caller owns the returned stream and must close it.
     */
    GenerationStream stream(List<ChatMessage> messages, GenerationOptions options);
}
