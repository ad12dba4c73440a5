package com.bistroAssist.queryDemo.llm;

import com.bistroAssist.queryDemo.llm.dto.ChatCompletionRequest;
import com.bistroAssist.queryDemo.llm.dto.ChatCompletionResponse;
import com.bistroAssist.queryDemo.llm.dto.EmbeddingRequest;
import com.bistroAssist.queryDemo.llm.dto.EmbeddingResponse;
import com.bistroAssist.queryDemo.llm.exception.InvalidApiKeyException;
import com.bistroAssist.queryDemo.llm.exception.ProviderQuotaExceededException;
import com.bistroAssist.queryDemo.llm.exception.ProviderRateLimitException;
import com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.NoSuchElementException;

/**
 * Client for OpenAI-compatible HTTP APIs.
 * Handles HTTP communication with the chat completions and embeddings endpoints
 * and translates transport and status failures into typed provider exceptions.
 */
@Slf4j
@Service
public class OpenAiApiClient {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public OpenAiApiClient(
            @Value("${openai.api.key:}") String apiKey,
            @Value("${openai.api.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
            @Value("${openai.api.connect-timeout:5s}") Duration connectTimeout,
            @Value("${openai.api.read-timeout:30s}") Duration readTimeout,
            ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    /**
     * Calls the chat completions endpoint and waits for the whole answer.
     *
     * @param request Completion request (stream flag is forced off)
     * @return Parsed response
     * @throws UpstreamProviderException if the call fails
     */
    public ChatCompletionResponse chatCompletion(ChatCompletionRequest request) {
        requireApiKey();
        request.setStream(false);
        request.setStreamOptions(null);
        try {
            log.debug("Calling chat completions - model: {}, messages: {}",
                    request.getModel(), request.getMessages() != null ? request.getMessages().size() : 0);

            ChatCompletionResponse response = restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);

            if (response == null) {
                throw new UpstreamProviderException("Chat completions returned an empty response", true);
            }

            log.debug("Chat completion received - model: {}, tokens used: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");
            return response;
        } catch (RestClientException e) {
            throw translate("chat completions", e);
        }
    }

    /**
     * Calls the embeddings endpoint for a single input.
     *
     * @throws UpstreamProviderException if the call fails or returns no vector
     */
    public float[] createEmbedding(EmbeddingRequest request) {
        requireApiKey();
        try {
            EmbeddingResponse response = restClient.post()
                    .uri("/embeddings")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(EmbeddingResponse.class);

            float[] vector = response != null ? response.firstVector() : null;
            if (vector == null) {
                throw new UpstreamProviderException("Embeddings endpoint returned no vector", true);
            }
            return vector;
        } catch (RestClientException e) {
            throw translate("embeddings", e);
        }
    }

    /**
     * Opens a streamed chat completion. The HTTP response stays open until the returned
     * stream is exhausted or closed.
     */
    public GenerationStream openChatStream(ChatCompletionRequest request) {
        requireApiKey();
        prepareForStreaming(request);
        try {
            return restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .body(request)
                    .exchange((clientRequest, clientResponse) -> {
                        if (clientResponse.getStatusCode().isError()) {
                            String body = readBodyQuietly(clientResponse);
                            int status = clientResponse.getStatusCode().value();
                            clientResponse.close();
                            throw translateStatus("chat stream", status, body, null);
                        }
                        return new SseChatStream(clientResponse, objectMapper, request.getModel());
                    }, false);
        } catch (RestClientException e) {
            throw translate("chat stream", e);
        }
    }

    static ChatCompletionRequest prepareForStreaming(ChatCompletionRequest request) {
        request.setStream(true);
        request.setStreamOptions(new ChatCompletionRequest.StreamOptions(true));
        return request;
    }

    private void requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new InvalidApiKeyException("OpenAI API key is not configured. Set openai.api.key in application.yaml");
        }
    }

    private UpstreamProviderException translate(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException) {
            RestClientResponseException responseException = (RestClientResponseException) e;
            return translateStatus(operation, responseException.getStatusCode().value(),
                    responseException.getResponseBodyAsString(), e);
        }
        if (e instanceof ResourceAccessException) {
            log.warn("I/O error calling {} - error: {}", operation, e.getMessage());
            return new UpstreamProviderException("Provider unreachable during " + operation + ": " + e.getMessage(), true, e);
        }
        log.error("Error calling {}", operation, e);
        return new UpstreamProviderException("Failed to call " + operation + ": " + e.getMessage(), false, e);
    }

    static UpstreamProviderException translateStatus(String operation, int status, String body, Throwable cause) {
        String detail = operation + " failed with status " + status;
        if (status == 401) {
            return new InvalidApiKeyException("Invalid API key: " + detail, cause);
        }
        if (status == 429) {
            if (body != null && body.contains("insufficient_quota")) {
                return new ProviderQuotaExceededException("Quota exceeded: " + detail, cause);
            }
            return new ProviderRateLimitException("Rate limited: " + detail, cause);
        }
        if (status >= 500) {
            return new UpstreamProviderException(detail, true, cause);
        }
        return new UpstreamProviderException(detail, false, cause);
    }

    private static String readBodyQuietly(ClientHttpResponse response) {
        try {
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read error body - error: {}", e.getMessage());
            return "";
        }
    }

    /**
     * Server-sent events reader over an open chat completions response.
     */
    static final class SseChatStream implements GenerationStream {

        private static final String DATA_PREFIX = "data:";
        private static final String DONE_MARKER = "[DONE]";

        private final ClientHttpResponse response;
        private final ObjectMapper objectMapper;
        private final BufferedReader reader;
        private volatile boolean closed;
        private String pending;
        private boolean finished;
        private String model;
        private int promptTokens;
        private int completionTokens;

        SseChatStream(ClientHttpResponse response, ObjectMapper objectMapper, String requestedModel) throws IOException {
            this.response = response;
            this.objectMapper = objectMapper;
            this.reader = new BufferedReader(new InputStreamReader(response.getBody(), StandardCharsets.UTF_8));
            this.model = requestedModel;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (finished || closed) {
                return false;
            }
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!line.startsWith(DATA_PREFIX)) {
                        continue;
                    }
                    String payload = line.substring(DATA_PREFIX.length()).trim();
                    if (DONE_MARKER.equals(payload)) {
                        break;
                    }
                    if (payload.isEmpty()) {
                        continue;
                    }
                    ChatCompletionResponse chunk = objectMapper.readValue(payload, ChatCompletionResponse.class);
                    if (chunk.getModel() != null) {
                        model = chunk.getModel();
                    }
                    if (chunk.getUsage() != null) {
                        promptTokens = valueOrZero(chunk.getUsage().getPromptTokens());
                        completionTokens = valueOrZero(chunk.getUsage().getCompletionTokens());
                    }
                    String delta = chunk.getDeltaContent();
                    if (delta != null && !delta.isEmpty()) {
                        pending = delta;
                        return true;
                    }
                }
                finished = true;
                close();
                return false;
            } catch (IOException e) {
                if (closed) {
                    return false;
                }
                close();
                throw new UpstreamProviderException("Chat stream interrupted: " + e.getMessage(), false, e);
            }
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String chunk = pending;
            pending = null;
            return chunk;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            response.close();
        }

        @Override
        public String model() {
            return model;
        }

        @Override
        public int promptTokens() {
            return promptTokens;
        }

        @Override
        public int completionTokens() {
            return completionTokens;
        }

        private static int valueOrZero(Integer value) {
            return value != null ? value : 0;
        }
    }
}
