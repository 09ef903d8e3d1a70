package com.logtail.core.services;

import com.logtail.core.local.LocalTailSession;
import com.logtail.core.models.LineRecord;
import com.logtail.core.models.LogSource;
import com.logtail.core.models.RemoteFile;
import com.logtail.core.models.ServerProfile;
import com.logtail.core.models.TailSettings;
import com.logtail.core.remote.RemoteTailService;
import com.logtail.core.remote.SshConnectionPool;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Resolves ids against the {@link SourceCatalog} and runs one producer task per tail request on a bounded worker
 * pool. Local sources are handled by a {@link LocalTailSession}, remote ones by the {@link RemoteTailService}; both
 * report through the same {@link TailStream}.
 */
@Slf4j
public class TailServiceImpl implements TailService {

    private final SourceCatalog catalog;
    private final RemoteTailService remoteTailService;
    private final SshConnectionPool connectionPool;
    private final TailSettings settings;
    private final TailMetrics metrics;

    private final ThreadPoolExecutor executorService;
    private final Set<TailStream> activeStreams = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public TailServiceImpl(SourceCatalog catalog,
                           RemoteTailService remoteTailService,
                           SshConnectionPool connectionPool,
                           TailSettings settings,
                           TailMetrics metrics) {
        this.catalog = catalog;
        this.remoteTailService = remoteTailService;
        this.connectionPool = connectionPool;
        this.settings = settings;
        this.metrics = metrics;
        this.executorService = new ThreadPoolExecutor(
                0,
                settings.getMaxConcurrentStreams(),
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadFactory() {
                    private final AtomicInteger threadNumber = new AtomicInteger(1);
                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "tail-worker-" + threadNumber.getAndIncrement());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy()
        );

        log.info("TAIL_SERVICE_INITIALIZED | sources={} | servers={} | directories={} | local_directories={} "
                        + "| max_streams={}",
                catalog.sources().size(), catalog.servers().size(), catalog.directories().size(),
                catalog.localDirectories().size(), settings.getMaxConcurrentStreams());
    }

    @Override
    public Optional<LogSource> resolve(String id) {
        return catalog.resolve(id);
    }

    @Override
    public List<LogSource> listSources() {
        List<LogSource> listed = catalog.sources();
        listed.addAll(catalog.scanLocalDirectories());
        return listed;
    }

    @Override
    public Optional<ServerProfile> findServer(String serverId) {
        return catalog.server(serverId);
    }

    @Override
    public TailStream tail(String id, Consumer<LineRecord> sink) {
        TailStream stream = new TailStream(id, record -> {
            metrics.recordRecord(record);
            sink.accept(record);
        });

        Optional<LogSource> source = resolve(id);
        if (source.isEmpty()) {
            log.warn("SOURCE_NOT_FOUND | id={}", id);
            stream.emit(LineRecord.system(LineRecord.NOT_FOUND));
            stream.complete();
            return stream;
        }
        if (shutdown.get()) {
            stream.emit(LineRecord.error("Service is shutting down"));
            stream.complete();
            return stream;
        }

        activeStreams.add(stream);
        metrics.recordStreamOpened(source.get().getLocality());
        try {
            executorService.execute(() -> produce(source.get(), stream));
        } catch (RejectedExecutionException e) {
            activeStreams.remove(stream);
            metrics.recordStreamClosed();
            log.warn("STREAM_REJECTED | id={} | active={} | max={}",
                    id, activeStreams.size(), settings.getMaxConcurrentStreams());
            stream.emit(LineRecord.error("Too many active streams"));
            stream.complete();
        }
        return stream;
    }

    @Override
    public boolean clear(String id) {
        Optional<LogSource> resolved = resolve(id);
        if (resolved.isEmpty()) {
            log.warn("CLEAR_REJECTED | id={} | reason=not_found", id);
            return false;
        }
        LogSource source = resolved.get();

        if (source.isRemote()) {
            Optional<ServerProfile> profile = catalog.server(source.getServerRef());
            return profile.isPresent() && remoteTailService.clear(profile.get(), source.getPath());
        }

        Path path = Path.of(source.getPath());
        if (!Files.isRegularFile(path)) {
            log.warn("CLEAR_REJECTED | id={} | reason=missing_file | path={}", id, path);
            return false;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.truncate(0);
        } catch (IOException e) {
            log.error("CLEAR_FAILED | id={} | path={} | error={}", id, path, e.getMessage());
            return false;
        }
        log.info("LOG_CLEARED | id={} | path={}", id, path);
        return true;
    }

    @Override
    public List<RemoteFile> listRemoteDirectory(ServerProfile profile, String path, String pattern,
                                                boolean recursive) {
        return remoteTailService.listFiles(profile, path, pattern, recursive);
    }

    public int getActiveStreamCount() {
        return activeStreams.size();
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        int cancelled = activeStreams.size();
        activeStreams.forEach(TailStream::cancel);

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        connectionPool.releaseAll();
        log.info("TAIL_SERVICE_SHUTDOWN | streams_cancelled={}", cancelled);
    }

    private void produce(LogSource source, TailStream stream) {
        long startedAt = System.currentTimeMillis();
        log.info("STREAM_START | id={} | locality={} | path={}",
                source.getId(), source.getLocality(), source.getPath());
        try {
            if (source.isRemote()) {
                Optional<ServerProfile> profile = catalog.server(source.getServerRef());
                if (profile.isEmpty()) {
                    stream.emit(LineRecord.system("Remote file configuration error."));
                } else {
                    remoteTailService.tail(profile.get(), source.getPath(), source.getEncoding(), stream);
                }
            } else {
                new LocalTailSession(Path.of(source.getPath()), source.getEncoding(), settings, stream).run();
            }
        } catch (RuntimeException e) {
            log.error("STREAM_FAILED | id={} | error={}", source.getId(), e.toString(), e);
            stream.emit(LineRecord.error("Unexpected failure: " + e.getMessage()));
        } finally {
            activeStreams.remove(stream);
            metrics.recordStreamClosed();
            log.info("STREAM_END | id={} | cancelled={} | duration_ms={}",
                    source.getId(), stream.isCancelled(), System.currentTimeMillis() - startedAt);
            stream.complete();
        }
    }
}
