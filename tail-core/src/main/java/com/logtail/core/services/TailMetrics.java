package com.logtail.core.services;

import com.logtail.core.models.LineRecord;
import com.logtail.core.models.Locality;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

public class TailMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter linesEmitted;
    private final AtomicLong activeStreams = new AtomicLong(0);

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

    public TailMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.linesEmitted = Counter.builder("tailer.lines.emitted")
                .description("Content lines delivered to stream consumers")
                .register(meterRegistry);

        Gauge.builder("tailer.streams.active", activeStreams, AtomicLong::get)
                .description("Tail streams currently producing")
                .register(meterRegistry);
    }

    /**
     * Metrics sink for callers that do not export metrics.
     */
    public static TailMetrics noop() {
        return new TailMetrics(new SimpleMeterRegistry());
    }

    public void bindPoolSize(Supplier<Number> poolSize) {
        Gauge.builder("tailer.pool.size", poolSize)
                .description("Remote sessions currently pooled")
                .register(meterRegistry);
    }

    // Stream metrics
    public void recordStreamOpened(Locality locality) {
        counter("tailer.streams.opened", "Tail streams started", "locality", locality.name().toLowerCase())
                .increment();
        activeStreams.incrementAndGet();
    }

    public void recordStreamClosed() {
        activeStreams.decrementAndGet();
    }

    public void recordRecord(LineRecord record) {
        if (record.isSentinel()) {
            counter("tailer.sentinels", "Sentinel records emitted", "kind", record.getKind().name().toLowerCase())
                    .increment();
        } else {
            linesEmitted.increment();
        }
    }

    // Pool metrics
    public void recordSessionCreated(String serverId) {
        counter("tailer.pool.sessions.created", "Remote sessions opened", "server", serverId).increment();
    }

    public void recordSessionReused(String serverId) {
        counter("tailer.pool.sessions.reused", "Pooled remote sessions handed out again", "server", serverId)
                .increment();
    }

    public void recordSessionEvicted(String reason) {
        counter("tailer.pool.sessions.evicted", "Remote sessions removed from the pool", "reason", reason)
                .increment();
    }

    public void recordConnectionFailure(String serverId) {
        counter("tailer.pool.connection.failures", "Failed remote session creations", "server", serverId)
                .increment();
    }

    public long getActiveStreams() {
        return activeStreams.get();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counters.computeIfAbsent(name + "|" + tagValue, key ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(meterRegistry));
    }
}
