package com.bistroAssist.queryDemo.orchestrator.streaming;

import java.util.concurrent.Future;

/**
 * Caller's handle on a streamed query.
 */
public class StreamHandle {

    private final String correlationId;
    private final QueryEventChannel channel;
    private volatile Future<?> producer;

    public StreamHandle(String correlationId, QueryEventChannel channel) {
        this.correlationId = correlationId;
        this.channel = channel;
    }

    public void attach(Future<?> producer) {
        this.producer = producer;
        if (channel.isCancelled()) {
            producer.cancel(true);
        }
    }

    /**
     * Stops forwarding, closes the provider stream and interrupts the producer.
     */
    public void cancel() {
        channel.cancel();
        Future<?> current = producer;
        if (current != null) {
            current.cancel(true);
        }
    }

    public boolean isCancelled() {
        return channel.isCancelled();
    }

    public boolean isDone() {
        Future<?> current = producer;
        return current != null && current.isDone();
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
