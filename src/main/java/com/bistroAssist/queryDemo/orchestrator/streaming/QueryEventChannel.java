package com.bistroAssist.queryDemo.orchestrator.streaming;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Producer side of a streamed answer.
 * 
 * Events are delivered in order. After a terminal event or a cancellation nothing more is
 * delivered. Cancel hooks run on the cancelling thread before {@link #cancel()} returns.
 */
@Slf4j
public abstract class QueryEventChannel {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    /**
     * Delivers a chunk.
     *
     * @return false when the consumer is gone and the producer should stop
     */
    public synchronized boolean send(StreamEvent event) {
        if (event.isTerminal()) {
            return finish(event);
        }
        if (cancelled.get() || terminated.get()) {
            return false;
        }
        try {
            deliver(event);
            return true;
        } catch (Exception e) {
            log.debug("Stream consumer went away while sending: {}", e.getMessage());
            cancel();
            return false;
        }
    }

    /**
     * Delivers the terminal event and closes the channel. Only the first call has any effect.
     *
     * @return true when this call delivered the terminal event
     */
    public synchronized boolean finish(StreamEvent terminal) {
        if (cancelled.get() || !terminated.compareAndSet(false, true)) {
            return false;
        }
        try {
            deliver(terminal);
            return true;
        } catch (Exception e) {
            log.debug("Stream consumer went away before the terminal event: {}", e.getMessage());
            return false;
        } finally {
            closeConsumer();
        }
    }

    /**
     * Registers work to run when the channel is cancelled; runs immediately when it already is.
     */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get() && cancelHooks.remove(hook)) {
            runHook(hook);
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable hook : cancelHooks) {
            if (cancelHooks.remove(hook)) {
                runHook(hook);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isOpen() {
        return !cancelled.get() && !terminated.get();
    }

    protected abstract void deliver(StreamEvent event) throws Exception;

    protected abstract void closeConsumer();

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Stream cancel hook failed", e);
        }
    }
}
