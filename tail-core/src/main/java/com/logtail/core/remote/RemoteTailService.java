package com.logtail.core.remote;

import com.logtail.core.models.LineRecord;
import com.logtail.core.models.RemoteFile;
import com.logtail.core.models.ServerProfile;
import com.logtail.core.models.TailSettings;
import com.logtail.core.security.SecurityValidator;
import com.logtail.core.services.LogLines;
import com.logtail.core.services.TailStream;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads remote files through pooled SSH sessions using nothing but allow-listed, metacharacter-free invocations of
 * {@code find}, {@code tail} and {@code truncate}. Every path is checked against the server's allowed prefixes before
 * a session is even acquired. The pool lease on that session is held until the call returns, for a follow that means
 * until the stream ends.
 */
@Slf4j
public class RemoteTailService {

    private final SecurityValidator validator;
    private final SshConnectionPool pool;
    private final TailSettings settings;

    public RemoteTailService(SecurityValidator validator, SshConnectionPool pool, TailSettings settings) {
        this.validator = validator;
        this.pool = pool;
        this.settings = settings;
    }

    /**
     * Replays the trailing window of {@code path} and then follows it, pushing records into {@code stream} until a
     * terminal condition or cancellation. Runs on the calling thread.
     */
    public void tail(ServerProfile profile, String path, Charset charset, TailStream stream) {
        String serverId = profile.getId();
        if (!validator.validatePath(path, profile.getAllowedPaths())) {
            log.warn("SECURITY_DENIED | server={} | path={}", serverId, path);
            stream.emit(LineRecord.security("Access denied: " + path));
            return;
        }

        RemoteSession session;
        try {
            session = pool.acquire(profile);
        } catch (RemoteConnectionException e) {
            log.error("REMOTE_CONNECT_FAILED | server={} | error={}", serverId, e.getMessage());
            stream.emit(LineRecord.error("Failed to connect to remote server"));
            return;
        }

        try {
            long size = querySize(session, serverId, path);
            if (!validator.checkFileSize(size, profile.getMaxFileSizeBytes())) {
                log.warn("FILE_TOO_LARGE | server={} | path={} | size={} | max={}",
                        serverId, path, size, profile.getMaxFileSizeBytes());
                stream.emit(LineRecord.error(String.format("File too large: %d bytes (max: %d)",
                        size, profile.getMaxFileSizeBytes())));
                return;
            }

            if (size > 0 && !replayBacklog(session, path, size, charset, stream)) {
                return;
            }

            String followCommand = "tail -n 0 -F " + quote(path);
            if (!validator.validateCommand(followCommand)) {
                stream.emit(LineRecord.security("Command rejected: " + followCommand));
                return;
            }
            follow(session, serverId, followCommand, charset, stream);
        } catch (IOException e) {
            if (!stream.isCancelled()) {
                log.error("REMOTE_READ_FAILED | server={} | path={} | error={}", serverId, path, e.getMessage());
                stream.emit(LineRecord.error("Failed to read remote file: " + e.getMessage()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            pool.release(profile, session);
        }
    }

    /**
     * Lists regular files matching {@code pattern} under {@code directory}, one level deep unless {@code recursive}.
     * At most {@link TailSettings#getMaxListResults()} entries are returned; any failure yields an empty list.
     */
    public List<RemoteFile> listFiles(ServerProfile profile, String directory, String pattern, boolean recursive) {
        String serverId = profile.getId();
        if (!validator.validatePath(directory, profile.getAllowedPaths())) {
            log.warn("SECURITY_DENIED | server={} | path={} | op=list", serverId, directory);
            return Collections.emptyList();
        }

        String command = "find " + quote(directory) + (recursive ? "" : " -maxdepth 1")
                + " -type f -name " + quote(pattern);
        if (!validator.validateCommand(command)) {
            log.warn("SECURITY_DENIED | server={} | command={} | op=list", serverId, command);
            return Collections.emptyList();
        }

        RemoteSession session;
        try {
            session = pool.acquire(profile);
        } catch (RemoteConnectionException e) {
            log.error("REMOTE_CONNECT_FAILED | server={} | error={}", serverId, e.getMessage());
            return Collections.emptyList();
        }

        List<RemoteFile> files = new ArrayList<>();
        try (RemoteCommand find = session.exec(command);
             BufferedReader reader = new BufferedReader(
                     new InputStreamReader(find.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (files.size() < settings.getMaxListResults() && (line = reader.readLine()) != null) {
                String filePath = line.strip();
                if (!filePath.isEmpty()) {
                    files.add(RemoteFile.of(filePath));
                }
            }
        } catch (IOException e) {
            log.error("REMOTE_LIST_FAILED | server={} | path={} | error={}", serverId, directory, e.getMessage());
            return Collections.emptyList();
        } finally {
            pool.release(profile, session);
        }
        return files;
    }

    /**
     * Truncates a remote file to zero length.
     *
     * @return true if the remote command reported no error output
     */
    public boolean clear(ServerProfile profile, String path) {
        String serverId = profile.getId();
        if (!validator.validatePath(path, profile.getAllowedPaths())) {
            log.warn("SECURITY_DENIED | server={} | path={} | op=clear", serverId, path);
            return false;
        }

        String command = "truncate -s 0 " + quote(path);
        if (!validator.validateWriteCommand(command)) {
            log.warn("SECURITY_DENIED | server={} | command={} | op=clear", serverId, command);
            return false;
        }

        RemoteSession session;
        try {
            session = pool.acquire(profile);
        } catch (RemoteConnectionException e) {
            log.error("REMOTE_CONNECT_FAILED | server={} | error={}", serverId, e.getMessage());
            return false;
        }

        try (RemoteCommand truncate = session.exec(command)) {
            String errorOutput = readAll(truncate.getErrorStream(), Integer.MAX_VALUE, StandardCharsets.UTF_8).strip();
            if (!errorOutput.isEmpty()) {
                log.error("REMOTE_CLEAR_FAILED | server={} | path={} | error={}", serverId, path, errorOutput);
                return false;
            }
            log.info("REMOTE_CLEARED | server={} | path={}", serverId, path);
            return true;
        } catch (IOException e) {
            log.error("REMOTE_CLEAR_FAILED | server={} | path={} | error={}", serverId, path, e.getMessage());
            return false;
        } finally {
            pool.release(profile, session);
        }
    }

    private long querySize(RemoteSession session, String serverId, String path) {
        String command = "find " + quote(path) + " -maxdepth 0 -type f -printf %s";
        if (!validator.validateCommand(command)) {
            return 0;
        }
        try (RemoteCommand stat = session.exec(command)) {
            String output = readAll(stat.getInputStream(), 64, StandardCharsets.UTF_8).strip();
            return output.isEmpty() ? 0 : Long.parseLong(output);
        } catch (IOException | NumberFormatException e) {
            log.warn("REMOTE_SIZE_UNKNOWN | server={} | path={} | error={}", serverId, path, e.toString());
            return 0;
        }
    }

    private boolean replayBacklog(RemoteSession session, String path, long size, Charset charset, TailStream stream)
            throws IOException {
        int window = (int) Math.min(size, settings.getBacklogWindowBytes());
        String command = "tail -c " + window + " " + quote(path);
        if (!validator.validateCommand(command)) {
            stream.emit(LineRecord.security("Command rejected: " + command));
            return false;
        }
        String backlog;
        try (RemoteCommand tail = session.exec(command)) {
            backlog = readAll(tail.getInputStream(), window, charset);
        }
        for (String line : backlog.split("\n")) {
            if (!LogLines.emitLine(stream, line)) {
                return false;
            }
        }
        return true;
    }

    private void follow(RemoteSession session, String serverId, String command, Charset charset, TailStream stream)
            throws IOException, InterruptedException {
        RemoteCommand tail = session.exec(command);
        Runnable closeOnCancel = tail::close;
        stream.onCancel(closeOnCancel);
        log.info("REMOTE_FOLLOW_STARTED | server={} | command={}", serverId, command);
        try (tail; BufferedReader reader = new BufferedReader(new InputStreamReader(tail.getInputStream(), charset))) {
            while (!stream.isCancelled()) {
                String line = reader.readLine();
                if (line == null) {
                    if (stream.isCancelled()) {
                        break;
                    }
                    if (tail.isClosed()) {
                        log.warn("REMOTE_FOLLOW_EXITED | server={} | command={}", serverId, command);
                        stream.emit(LineRecord.error("Remote tail exited"));
                        break;
                    }
                    Thread.sleep(settings.getRetryBackoff().toMillis());
                    continue;
                }
                if (!LogLines.emitLine(stream, line)) {
                    break;
                }
            }
        } finally {
            stream.removeCancelHook(closeOnCancel);
        }
    }

    private static String readAll(InputStream in, int maxBytes, Charset charset) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int total = 0;
        int read;
        while (total < maxBytes && (read = in.read(buffer, 0, Math.min(buffer.length, maxBytes - total))) != -1) {
            out.write(buffer, 0, read);
            total += read;
        }
        return out.toString(charset);
    }

    /**
     * POSIX single-quoting; an embedded quote becomes {@code '\''}.
     */
    static String quote(String argument) {
        return "'" + argument.replace("'", "'\\''") + "'";
    }
}
