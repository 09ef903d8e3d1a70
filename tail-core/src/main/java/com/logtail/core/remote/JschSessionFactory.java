package com.logtail.core.remote;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.Slf4jLogger;
import com.logtail.core.models.AuthMethod;
import com.logtail.core.models.ServerProfile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * {@link RemoteSessionFactory} backed by JSch. Sessions authenticate with either a private key file or a password,
 * as the profile says.
 */
@Slf4j
public class JschSessionFactory implements RemoteSessionFactory {

    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final int CHANNEL_TIMEOUT_MS = 10_000;
    private static final Set<PosixFilePermission> GROUP_OR_OTHER = EnumSet.of(
            PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE);

    static {
        JSch.setLogger(new Slf4jLogger());
    }

    @Override
    public RemoteSession open(ServerProfile profile) throws RemoteConnectionException {
        String serverId = profile.getId();
        JSch jsch = new JSch();
        try {
            if (profile.getAuthMethod() == AuthMethod.KEY) {
                Path keyPath = requireKeyFile(profile);
                jsch.addIdentity(keyPath.toString());
            } else if (profile.getPassword() == null || profile.getPassword().isEmpty()) {
                throw new RemoteConnectionException(serverId, "Password not provided");
            }

            boolean strict = profile.getKnownHostsPath() != null;
            if (strict) {
                jsch.setKnownHosts(profile.getKnownHostsPath());
            } else {
                log.warn("HOST_KEY_UNCHECKED | server={} | reason=no_known_hosts_configured", serverId);
            }

            Session session = jsch.getSession(profile.getUsername(), profile.getHost(), profile.getPort());
            session.setConfig("StrictHostKeyChecking", strict ? "yes" : "no");
            if (profile.getAuthMethod() == AuthMethod.PASSWORD) {
                session.setPassword(profile.getPassword());
            }
            session.connect(CONNECT_TIMEOUT_MS);
            return new JschRemoteSession(session);
        } catch (JSchException e) {
            throw new RemoteConnectionException(serverId, "SSH connection failed: " + e.getMessage(), e);
        }
    }

    private Path requireKeyFile(ServerProfile profile) throws RemoteConnectionException {
        if (profile.getKeyPath() == null || profile.getKeyPath().isBlank()) {
            throw new RemoteConnectionException(profile.getId(), "SSH key not configured");
        }
        Path keyPath = Path.of(profile.getKeyPath());
        if (!Files.isRegularFile(keyPath)) {
            throw new RemoteConnectionException(profile.getId(), "SSH key not found: " + keyPath);
        }
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(keyPath);
            permissions.retainAll(GROUP_OR_OTHER);
            if (!permissions.isEmpty()) {
                log.warn("KEY_PERMISSIONS_INSECURE | server={} | key={} | extra={}",
                        profile.getId(), keyPath, permissions);
            }
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("KEY_PERMISSIONS_UNCHECKED | key={} | reason={}", keyPath, e.toString());
        }
        return keyPath;
    }

    static final class JschRemoteSession implements RemoteSession {
        private final Session session;

        JschRemoteSession(Session session) {
            this.session = session;
        }

        @Override
        public boolean isAlive() {
            if (!session.isConnected()) {
                return false;
            }
            try {
                session.sendKeepAliveMsg();
                return true;
            } catch (Exception e) {
                log.debug("KEEPALIVE_FAILED | host={} | error={}", session.getHost(), e.toString());
                return false;
            }
        }

        @Override
        public RemoteCommand exec(String command) throws IOException {
            ChannelExec channel = null;
            try {
                channel = (ChannelExec) session.openChannel("exec");
                channel.setCommand(command);
                channel.setInputStream(null);
                InputStream stdout = channel.getInputStream();
                InputStream stderr = channel.getErrStream();
                channel.connect(CHANNEL_TIMEOUT_MS);
                return new JschRemoteCommand(channel, stdout, stderr);
            } catch (JSchException e) {
                if (channel != null) {
                    channel.disconnect();
                }
                throw new IOException("Remote exec failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            session.disconnect();
        }
    }

    static final class JschRemoteCommand implements RemoteCommand {
        private final ChannelExec channel;
        private final InputStream stdout;
        private final InputStream stderr;

        JschRemoteCommand(ChannelExec channel, InputStream stdout, InputStream stderr) {
            this.channel = channel;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public boolean isClosed() {
            return channel.isClosed();
        }

        @Override
        public void close() {
            channel.disconnect();
        }
    }
}
