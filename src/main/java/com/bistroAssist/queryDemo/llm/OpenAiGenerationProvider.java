package com.bistroAssist.queryDemo.llm;

import com.bistroAssist.queryDemo.llm.dto.ChatCompletionRequest;
import com.bistroAssist.queryDemo.llm.dto.ChatCompletionResponse;
import com.bistroAssist.queryDemo.llm.dto.ChatMessage;
import com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generation provider backed by the chat completions endpoint.
 * Opening a call (single-shot or stream) is retried for retryable provider errors;
 * chunks already forwarded from a stream are never replayed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiGenerationProvider implements GenerationProvider {

    private final OpenAiApiClient apiClient;
    private final Retry providerRetry;

    @Value("${openai.api.model:gpt-4o-mini}")
    private String defaultModel = "gpt-4o-mini";

    @Override
    public GenerationResult complete(List<ChatMessage> messages, GenerationOptions options) {
        ChatCompletionRequest request = buildRequest(messages, options);
        ChatCompletionResponse response = providerRetry.executeSupplier(() -> apiClient.chatCompletion(request));

        String content = response.getContent();
        if (content == null) {
            throw new UpstreamProviderException("Chat completion carried no content", false);
        }
        ChatCompletionResponse.Usage usage = response.getUsage();
        return GenerationResult.builder()
                .text(content)
                .model(response.getModel() != null ? response.getModel() : request.getModel())
                .promptTokens(usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0)
                .completionTokens(usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0)
                .build();
    }

    @Override
    public GenerationStream stream(List<ChatMessage> messages, GenerationOptions options) {
        ChatCompletionRequest request = buildRequest(messages, options);
        log.debug("Opening generation stream - model: {}", request.getModel());
        return providerRetry.executeSupplier(() -> apiClient.openChatStream(request));
    }

    private ChatCompletionRequest buildRequest(List<ChatMessage> messages, GenerationOptions options) {
        String model = options.getModel() != null && !options.getModel().isBlank()
                ? options.getModel()
                : defaultModel;
        return ChatCompletionRequest.builder()
                .messages(messages)
                .model(model)
                .temperature(options.getTemperature())
                .maxTokens(options.getMaxTokens())
                .topP(1.0)
                .responseFormat(options.isJsonResponse()
                        ? new ChatCompletionRequest.ResponseFormat("json_object")
                        : null)
                .build();
    }
}
