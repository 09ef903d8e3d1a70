package com.logtail.core.local;

import com.logtail.core.models.LineRecord;
import com.logtail.core.models.TailSettings;
import com.logtail.core.services.LogLines;
import com.logtail.core.services.TailStream;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Tails one local file: replays the trailing window of existing content, then follows appended lines until the file
 * disappears or the consumer cancels.
 * <p>
 * Wake-ups come from a {@link PathWatcher}; when no notification arrives within the poll timeout the file is checked
 * anyway, so coalesced or missed events only delay output. A file that shrinks below the cursor is treated as
 * truncated and read again from the start.
 */
@Slf4j
public class LocalTailSession {

    private static final int READ_CHUNK = 8192;

    public enum State {
        IDLE,
        BACKLOG_REPLAY,
        FOLLOWING,
        TERMINATED
    }

    private final Path path;
    private final Charset charset;
    private final TailSettings settings;
    private final TailStream stream;

    private volatile State state = State.IDLE;
    private long cursor;

    public LocalTailSession(Path path, Charset charset, TailSettings settings, TailStream stream) {
        this.path = path;
        this.charset = charset;
        this.settings = settings;
        this.stream = stream;
    }

    /**
     * Runs the session on the calling thread until it terminates. Every resource opened here is released before
     * returning.
     */
    public void run() {
        try {
            if (!Files.isRegularFile(path)) {
                stream.emit(LineRecord.system(LineRecord.NOT_FOUND));
                return;
            }

            state = State.BACKLOG_REPLAY;
            try {
                cursor = replayBacklog();
            } catch (IOException e) {
                log.warn("BACKLOG_READ_FAILED | path={} | error={}", path, e.toString());
                stream.emit(LineRecord.error("Error reading file: " + e.getMessage()));
                return;
            }

            if (!stream.isCancelled()) {
                state = State.FOLLOWING;
                follow();
            }
        } finally {
            state = State.TERMINATED;
        }
    }

    public State getState() {
        return state;
    }

    public long getCursor() {
        return cursor;
    }

    private long replayBacklog() throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return 0;
            }
            int window = (int) Math.min(size, settings.getBacklogWindowBytes());
            long start = size - window;
            ByteBuffer buffer = ByteBuffer.allocate(window);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, start + buffer.position()) < 0) {
                    break;
                }
            }
            byte[] bytes = buffer.array();
            int length = buffer.position();

            int from = 0;
            if (start > 0) {
                // the window most likely starts mid-line
                from = length;
                for (int i = 0; i < length; i++) {
                    if (bytes[i] == '\n') {
                        from = i + 1;
                        break;
                    }
                }
            }

            // a trailing partial line is left for the follow loop
            int end = from;
            for (int i = length - 1; i >= from; i--) {
                if (bytes[i] == '\n') {
                    end = i + 1;
                    break;
                }
            }

            String text = new String(bytes, from, end - from, charset);
            for (String line : text.split("\n")) {
                if (!LogLines.emitLine(stream, line)) {
                    break;
                }
            }
            return start + end;
        }
    }

    private void follow() {
        ChangeSignal signal = new ChangeSignal();
        Runnable wake = signal::onChanged;
        stream.onCancel(wake);

        try (PathWatcher ignored = new PathWatcher(path, signal)) {
            while (!stream.isCancelled()) {
                boolean notified = signal.await(settings.getPollTimeout());
                if (stream.isCancelled()) {
                    break;
                }

                if (!Files.exists(path)) {
                    if (notified) {
                        // possibly mid-rotation, confirm on the next quiet poll
                        Thread.sleep(settings.getRetryBackoff().toMillis());
                        continue;
                    }
                    log.info("FILE_DISAPPEARED | path={}", path);
                    stream.emit(LineRecord.system(LineRecord.DISAPPEARED));
                    break;
                }

                try {
                    long size = Files.size(path);
                    if (size < cursor) {
                        log.info("FILE_TRUNCATED | path={} | size={} | cursor={}", path, size, cursor);
                        if (!stream.emit(LineRecord.truncated())) {
                            break;
                        }
                        cursor = 0;
                    }
                    if (size > cursor) {
                        cursor = readAppended(size);
                    }
                } catch (IOException e) {
                    if (log.isDebugEnabled()) {
                        log.debug("TRANSIENT_READ_ERROR | path={} | error={}", path, e.toString());
                    }
                    Thread.sleep(settings.getRetryBackoff().toMillis());
                }
            }
        } catch (IOException e) {
            log.warn("WATCH_FAILED | path={} | error={}", path, e.toString());
            stream.emit(LineRecord.error("Error watching file: " + e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stream.removeCancelHook(wake);
        }
    }

    /**
     * Emits every line completed between the cursor and {@code size}.
     *
     * @return offset just past the last newline read; a trailing partial line is left for the next cycle
     */
    private long readAppended(long size) throws IOException {
        long consumed = cursor;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteArrayOutputStream pending = new ByteArrayOutputStream();
            ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
            long position = cursor;

            while (position < size && !stream.isCancelled()) {
                buffer.clear();
                buffer.limit((int) Math.min(READ_CHUNK, size - position));
                int read = channel.read(buffer, position);
                if (read <= 0) {
                    break;
                }
                byte[] bytes = buffer.array();
                int lineStart = 0;
                for (int i = 0; i < read; i++) {
                    if (bytes[i] == '\n') {
                        pending.write(bytes, lineStart, i - lineStart);
                        consumed = position + i + 1;
                        if (!LogLines.emitLine(stream, pending.toString(charset))) {
                            return consumed;
                        }
                        pending.reset();
                        lineStart = i + 1;
                    }
                }
                pending.write(bytes, lineStart, read - lineStart);
                position += read;
            }
        }
        return consumed;
    }
}
