package com.bistroAssist.queryDemo.orchestrator.streaming;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QueryEventChannelTest {

    @Test
    void chunksThenSingleTerminalEvent() {
        RecordingChannel channel = new RecordingChannel();

        assertTrue(channel.send(StreamEvent.chunk("Hello")));
        assertTrue(channel.send(StreamEvent.done("summary")));
        assertFalse(channel.finish(StreamEvent.error("INTERNAL_ERROR", "late")));
        assertFalse(channel.send(StreamEvent.chunk("after")));

        assertEquals(List.of(StreamEvent.Type.CHUNK, StreamEvent.Type.DONE),
                channel.delivered.stream().map(StreamEvent::type).toList());
        assertEquals(1, channel.closed.get());
        assertFalse(channel.isOpen());
    }

    @Test
    void cancelRunsHooksAndStopsDelivery() {
        RecordingChannel channel = new RecordingChannel();
        AtomicInteger hookRuns = new AtomicInteger();
        channel.onCancel(hookRuns::incrementAndGet);

        channel.cancel();
        channel.cancel();

        assertEquals(1, hookRuns.get());
        assertFalse(channel.send(StreamEvent.chunk("ignored")));
        assertFalse(channel.finish(StreamEvent.done("ignored")));
        assertTrue(channel.delivered.isEmpty());
    }

    @Test
    void hookRegisteredAfterCancelRunsImmediately() {
        RecordingChannel channel = new RecordingChannel();
        channel.cancel();
        AtomicInteger hookRuns = new AtomicInteger();

        channel.onCancel(hookRuns::incrementAndGet);

        assertEquals(1, hookRuns.get());
    }

    @Test
    void failedDeliveryCancelsTheChannel() {
        RecordingChannel channel = new RecordingChannel();
        channel.failDelivery = true;
        AtomicInteger hookRuns = new AtomicInteger();
        channel.onCancel(hookRuns::incrementAndGet);

        assertFalse(channel.send(StreamEvent.chunk("Hello")));

        assertTrue(channel.isCancelled());
        assertEquals(1, hookRuns.get());
    }

    @Test
    void handleCancelInterruptsAttachedProducer() {
        RecordingChannel channel = new RecordingChannel();
        StreamHandle handle = new StreamHandle("corr-1", channel);
        FutureTask<Void> producer = new FutureTask<>(() -> null);
        handle.attach(producer);

        handle.cancel();

        assertTrue(handle.isCancelled());
        assertTrue(producer.isCancelled());
        assertTrue(handle.isDone());
    }

    @Test
    void attachingToCancelledChannelCancelsProducer() {
        RecordingChannel channel = new RecordingChannel();
        channel.cancel();
        StreamHandle handle = new StreamHandle("corr-2", channel);
        FutureTask<Void> producer = new FutureTask<>(() -> null);

        handle.attach(producer);

        assertTrue(producer.isCancelled());
    }

    private static final class RecordingChannel extends QueryEventChannel {
        private final List<StreamEvent> delivered = new ArrayList<>();
        private final AtomicInteger closed = new AtomicInteger();
        private boolean failDelivery;

        @Override
        protected void deliver(StreamEvent event) throws IOException {
            if (failDelivery) {
                throw new IOException("Broken pipe");
            }
            delivered.add(event);
        }

        @Override
        protected void closeConsumer() {
            closed.incrementAndGet();
        }
    }
}
