package com.bistroAssist.queryDemo.intent;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.intent.prompt.IntentClassificationPrompt;
import com.bistroAssist.queryDemo.llm.GenerationOptions;
import com.bistroAssist.queryDemo.llm.GenerationProvider;
import com.bistroAssist.queryDemo.llm.GenerationResult;
import com.bistroAssist.queryDemo.llm.dto.ChatMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language-model intent classification, used when rule-based scoring is not confident enough.
 * Provider failures propagate; malformed answers degrade to UNKNOWN with 0.1 confidence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmIntentClassifier {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final double PARSE_FAILURE_CONFIDENCE = 0.1;

    private final GenerationProvider generationProvider;
    private final ObjectMapper objectMapper;
    private final AssistantProperties properties;

    public IntentResult classify(String query) {
        GenerationOptions options = GenerationOptions.builder()
                .model(properties.getIntent().getModel())
                .temperature(0.1)
                .maxTokens(200)
                .jsonResponse(true)
                .build();

        GenerationResult result = generationProvider.complete(List.of(
                ChatMessage.system(IntentClassificationPrompt.SYSTEM_PROMPT),
                ChatMessage.user(IntentClassificationPrompt.buildUserPrompt(query))
        ), options);

        return parse(result.getText());
    }

    IntentResult parse(String content) {
        if (content == null) {
            return IntentResult.unknown(PARSE_FAILURE_CONFIDENCE, "Empty classifier response");
        }
        Matcher matcher = JSON_OBJECT.matcher(content);
        if (!matcher.find()) {
            log.warn("Classifier response carried no JSON object - length: {}", content.length());
            return IntentResult.unknown(PARSE_FAILURE_CONFIDENCE, "Failed to parse classifier response");
        }
        try {
            JsonNode node = objectMapper.readTree(matcher.group());
            JsonNode intentNode = node.get("intent");
            JsonNode confidenceNode = node.get("confidence");
            if (intentNode == null || !intentNode.isTextual() || confidenceNode == null || !confidenceNode.isNumber()) {
                log.warn("Classifier response missing intent or confidence");
                return IntentResult.unknown(PARSE_FAILURE_CONFIDENCE, "Invalid classifier response format");
            }
            double confidence = Math.min(1.0, Math.max(0.0, confidenceNode.asDouble()));
            JsonNode reasoningNode = node.get("reasoning");
            return IntentResult.builder()
                    .intent(QueryIntent.fromLabel(intentNode.asText()))
                    .confidence(confidence)
                    .reasoning(reasoningNode != null && reasoningNode.isTextual()
                            ? reasoningNode.asText()
                            : "Model-based detection")
                    .build();
        } catch (Exception e) {
            log.warn("Error parsing classifier response - error: {}", e.getMessage());
            return IntentResult.unknown(PARSE_FAILURE_CONFIDENCE, "Failed to parse classifier response");
        }
    }
}
