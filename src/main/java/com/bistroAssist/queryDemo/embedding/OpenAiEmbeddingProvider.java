package com.bistroAssist.queryDemo.embedding;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.llm.OpenAiApiClient;
import com.bistroAssist.queryDemo.llm.dto.EmbeddingRequest;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final OpenAiApiClient apiClient;
    private final Retry providerRetry;
    private final AssistantProperties properties;

    @Override
    public float[] embed(String text) {
        AssistantProperties.Embedding settings = properties.getEmbedding();
        EmbeddingRequest request = EmbeddingRequest.builder()
                .model(settings.getModel())
                .input(text)
                .dimensions(settings.getDimension())
                .build();
        log.debug("Requesting embedding - model: {}, chars: {}", settings.getModel(), text.length());
        return providerRetry.executeSupplier(() -> apiClient.createEmbedding(request));
    }
}
