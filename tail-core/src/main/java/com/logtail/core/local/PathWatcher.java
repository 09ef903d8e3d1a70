package com.logtail.core.local;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;

/**
 * Watches a single file through a {@link WatchService} on its parent directory. Events for other entries of the
 * directory are ignored. Dispatch runs on a dedicated daemon thread that ends when the watcher is closed.
 */
@Slf4j
public final class PathWatcher implements Closeable {

    private static final long JOIN_TIMEOUT_MS = 1000;

    private final Path fileName;
    private final FileChangeListener listener;
    private final WatchService watchService;
    private final Thread dispatcher;

    public PathWatcher(Path file, FileChangeListener listener) throws IOException {
        Path absolute = file.toAbsolutePath();
        Path directory = absolute.getParent();
        if (directory == null) {
            throw new IOException("Cannot watch a path without parent directory: " + absolute);
        }
        this.fileName = absolute.getFileName();
        this.listener = listener;
        this.watchService = directory.getFileSystem().newWatchService();
        try {
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException | RuntimeException e) {
            watchService.close();
            throw e;
        }
        this.dispatcher = new Thread(this::dispatch, "tail-watch-" + fileName);
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    private void dispatch() {
        try {
            while (true) {
                WatchKey key = watchService.take();
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW || fileName.equals(event.context())) {
                        listener.onChanged();
                    }
                }
                if (!key.reset()) {
                    // directory itself is gone
                    listener.onChanged();
                    return;
                }
            }
        } catch (ClosedWatchServiceException e) {
            log.trace("WATCH_CLOSED | file={}", fileName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("WATCH_CLOSE_FAILED | file={} | error={}", fileName, e.toString());
        }
        try {
            dispatcher.join(JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
