package com.bistroAssist.queryDemo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Answer text with its provenance and token usage.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedAnswer {

    public static final String FALLBACK_MODEL = "fallback";
    public static final String RULES_MODEL = "rules";

    String text;
    String model;
    int promptTokens;
    int completionTokens;

    /**
     * True when the text came from the fallback catalog instead of the provider.
     */
    boolean fallback;

    /**
     * True when a block_response rule replaced the answer.
     */
    boolean blocked;
}
