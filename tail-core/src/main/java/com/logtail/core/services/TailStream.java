package com.logtail.core.services;

import com.logtail.core.models.LineRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle on one running tail. The producer pushes {@link LineRecord}s through {@link #emit}; the consumer receives
 * them on its sink and detaches with {@link #cancel()}. A sink that throws is treated as a detached consumer.
 * <p>
 * {@link #completion()} completes once the producer has stopped and released everything it opened.
 */
@Slf4j
public final class TailStream implements Closeable {

    private final String sourceId;
    private final Consumer<LineRecord> sink;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    public TailStream(String sourceId, Consumer<LineRecord> sink) {
        this.sourceId = sourceId;
        this.sink = sink;
    }

    public String getSourceId() {
        return sourceId;
    }

    /**
     * Delivers a record to the consumer.
     *
     * @return false if the consumer is gone and the producer should stop
     */
    public boolean emit(LineRecord record) {
        if (cancelled.get()) {
            return false;
        }
        try {
            sink.accept(record);
            return true;
        } catch (RuntimeException e) {
            log.debug("CONSUMER_DETACHED | id={} | error={}", sourceId, e.toString());
            cancel();
            return false;
        }
    }

    /**
     * Registers an action run once on cancellation, used to unblock a producer waiting on I/O. Runs immediately if
     * the stream is already cancelled.
     */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get() && cancelHooks.remove(hook)) {
            runHook(hook);
        }
    }

    public void removeCancelHook(Runnable hook) {
        cancelHooks.remove(hook);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable hook : cancelHooks) {
                if (cancelHooks.remove(hook)) {
                    runHook(hook);
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }

    void complete() {
        cancelHooks.clear();
        completion.complete(null);
    }

    @Override
    public void close() {
        cancel();
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("CANCEL_HOOK_FAILED | id={} | error={}", sourceId, e.toString());
        }
    }
}
