package com.bistroAssist.queryDemo.llm;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GenerationOptions {

    String model;

    @Builder.Default
    double temperature = 0.7;

    @Builder.Default
    int maxTokens = 1000;

    /**
     * Ask the provider for a JSON object response.
     */
    @Builder.Default
    boolean jsonResponse = false;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
}
