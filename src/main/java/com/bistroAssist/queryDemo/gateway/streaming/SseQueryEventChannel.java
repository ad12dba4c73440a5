package com.bistroAssist.queryDemo.gateway.streaming;

import com.bistroAssist.queryDemo.orchestrator.streaming.QueryEventChannel;
import com.bistroAssist.queryDemo.orchestrator.streaming.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Delivers stream events as server-sent events. A client disconnect or emitter timeout
 * cancels the channel.
 */
@Slf4j
public class SseQueryEventChannel extends QueryEventChannel {

    private final SseEmitter emitter;
    private final String correlationId;

    public SseQueryEventChannel(SseEmitter emitter, String correlationId) {
        this.emitter = emitter;
        this.correlationId = correlationId;
        emitter.onCompletion(this::cancel);
        emitter.onTimeout(() -> {
            log.warn("SSE emitter timed out - correlationId: {}", correlationId);
            cancel();
        });
        emitter.onError(error -> {
            log.debug("SSE connection error - correlationId: {}, error: {}", correlationId, error.toString());
            cancel();
        });
    }

    @Override
    protected void deliver(StreamEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .id(correlationId)
                .name(event.type().getEventName())
                .data(event.data()));
    }

    @Override
    protected void closeConsumer() {
        emitter.complete();
    }
}
