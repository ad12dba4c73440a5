package com.bistroAssist.queryDemo.llm;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GenerationResult {
    String text;
    String model;
    int promptTokens;
    int completionTokens;

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
