package com.logtail.server.services;

import com.logtail.core.models.LineRecord;
import com.logtail.core.services.TailService;
import com.logtail.core.services.TailStream;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges tail streams to SSE clients. Each emitter owns one {@link TailStream}: records are sent as {@code data:}
 * events, the emitter completes when the stream ends, and a client that goes away (completion, timeout, send failure
 * or a failed heartbeat) cancels the stream.
 */
@Slf4j
@Service
public class SseStreamRegistry {
    static final String HEARTBEAT_COMMENT = "ping";

    private final TailService tailService;
    private final Map<SseEmitter, TailStream> streams = new ConcurrentHashMap<>();

    public SseStreamRegistry(TailService tailService) {
        this.tailService = tailService;
    }

    public SseEmitter open(String sourceId) {
        SseEmitter emitter = new SseEmitter(0L);
        TailStream stream = tailService.tail(sourceId, record -> send(emitter, record));

        if (stream.isDone()) {
            emitter.complete();
            return emitter;
        }

        streams.put(emitter, stream);
        emitter.onCompletion(() -> detach(emitter, "completed", false));
        emitter.onTimeout(() -> detach(emitter, "timeout", false));
        emitter.onError(e -> detach(emitter, "error", false));
        stream.completion().whenComplete((ignored, error) -> {
            if (streams.remove(emitter) != null) {
                emitter.complete();
            }
        });

        log.info("SSE_CLIENT_ATTACHED | id={} | clients={}", sourceId, streams.size());
        return emitter;
    }

    @Scheduled(fixedRateString = "${tailer.stream.heartbeat-ms:2000}")
    public void heartbeat() {
        for (Map.Entry<SseEmitter, TailStream> entry : streams.entrySet()) {
            try {
                entry.getKey().send(SseEmitter.event().comment(HEARTBEAT_COMMENT));
            } catch (IOException | IllegalStateException e) {
                if (log.isDebugEnabled()) {
                    log.debug("HEARTBEAT_FAILED | id={} | error={}", entry.getValue().getSourceId(), e.toString());
                }
                detach(entry.getKey(), "heartbeat_failed", true);
            }
        }
    }

    public int getClientCount() {
        return streams.size();
    }

    @PreDestroy
    public void shutdown() {
        streams.keySet().forEach(emitter -> detach(emitter, "shutdown", true));
    }

    private void send(SseEmitter emitter, LineRecord record) {
        try {
            emitter.send(SseEmitter.event().data(record.render()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void detach(SseEmitter emitter, String reason, boolean completeEmitter) {
        TailStream stream = streams.remove(emitter);
        if (stream == null) {
            return;
        }
        stream.cancel();
        if (completeEmitter) {
            emitter.complete();
        }
        log.info("SSE_CLIENT_DETACHED | id={} | reason={} | clients={}", stream.getSourceId(), reason, streams.size());
    }
}
