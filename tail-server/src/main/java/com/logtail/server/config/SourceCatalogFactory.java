package com.logtail.server.config;

import com.logtail.core.models.AuthMethod;
import com.logtail.core.models.LocalDirectory;
import com.logtail.core.models.LogSource;
import com.logtail.core.models.RemoteDirectory;
import com.logtail.core.models.ServerProfile;
import com.logtail.core.services.SourceCatalog;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns bound {@link TailerProperties} into the immutable records the engine runs on. Local files and directories
 * keep their configured name as id; remote files and directories are addressed as {@code <server name>/<log name>}.
 * <p>
 * Any invalid entry fails startup with an {@link IllegalStateException} naming the offending entry.
 */
@Slf4j
public final class SourceCatalogFactory {

    private SourceCatalogFactory() {
    }

    public static SourceCatalog create(TailerProperties properties) {
        List<LogSource> sources = new ArrayList<>();
        List<ServerProfile> servers = new ArrayList<>();
        List<RemoteDirectory> directories = new ArrayList<>();
        List<LocalDirectory> localDirectories = new ArrayList<>();

        for (TailerProperties.LogFile file : properties.getLogFiles()) {
            String name = required(file.getName(), "log-files[].name", "<unnamed>");
            String path = required(file.getPath(), "path", name);
            sources.add(LogSource.local(name, path, charset(file.getEncoding(), name)));
        }

        for (TailerProperties.LocalDirectory directory : properties.getLocalDirectories()) {
            String name = required(directory.getName(), "local-directories[].name", "<unnamed>");
            localDirectories.add(LocalDirectory.builder()
                    .id(name)
                    .path(required(directory.getScanDir(), "scan-dir", name))
                    .pattern(isBlank(directory.getPattern()) ? "*.log" : directory.getPattern())
                    .recursive(directory.isRecursive())
                    .encoding(charset(directory.getEncoding(), name))
                    .build());
        }

        for (TailerProperties.RemoteServer server : properties.getRemoteServers()) {
            ServerProfile profile = toProfile(server);
            servers.add(profile);

            for (TailerProperties.RemoteLog remoteLog : server.getLogs()) {
                String logName = required(remoteLog.getName(), "logs[].name", profile.getName());
                String id = profile.getName() + "/" + logName;
                String path = required(remoteLog.getPath(), "path", id);
                String type = remoteLog.getType() == null ? "file" : remoteLog.getType().toLowerCase(Locale.ROOT);

                switch (type) {
                    case "file":
                        sources.add(LogSource.remote(id, path, charset(remoteLog.getEncoding(), id), profile.getId()));
                        break;
                    case "directory":
                        directories.add(RemoteDirectory.builder()
                                .id(id)
                                .path(path)
                                .pattern(remoteLog.getPattern() == null ? "*.log" : remoteLog.getPattern())
                                .recursive(remoteLog.isRecursive())
                                .serverRef(profile.getId())
                                .build());
                        break;
                    default:
                        throw new IllegalStateException("Unknown log type '" + remoteLog.getType() + "' for " + id);
                }
            }
        }

        try {
            SourceCatalog catalog = new SourceCatalog(sources, servers, directories, localDirectories);
            log.info("CATALOG_LOADED | local={} | remote={} | servers={} | directories={} | local_directories={}",
                    sources.stream().filter(s -> !s.isRemote()).count(),
                    sources.stream().filter(LogSource::isRemote).count(),
                    servers.size(), directories.size(), localDirectories.size());
            return catalog;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid tailer configuration: " + e.getMessage(), e);
        }
    }

    private static ServerProfile toProfile(TailerProperties.RemoteServer server) {
        String name = required(server.getName(), "remote-servers[].name", "<unnamed>");
        AuthMethod authMethod = authMethod(server.getAuthMethod(), name);
        if (authMethod == AuthMethod.KEY && isBlank(server.getKeyPath())) {
            throw new IllegalStateException("Server " + name + " uses key auth but has no key-path");
        }
        if (server.getAllowedPaths().isEmpty()) {
            log.warn("SERVER_WITHOUT_ALLOWED_PATHS | server={} | effect=all_paths_denied", name);
        }

        return ServerProfile.builder()
                .name(name)
                .host(required(server.getHost(), "host", name))
                .port(server.getPort())
                .username(required(server.getUser(), "user", name))
                .authMethod(authMethod)
                .keyPath(server.getKeyPath())
                .password(server.getPassword())
                .knownHostsPath(server.getKnownHostsPath())
                .allowedPaths(server.getAllowedPaths())
                .maxFileSizeBytes(server.getMaxFileSize())
                .idleTimeoutSeconds(server.getIdleTimeoutSeconds())
                .build();
    }

    private static AuthMethod authMethod(String value, String owner) {
        if (value == null) {
            return AuthMethod.KEY;
        }
        try {
            return AuthMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown auth-method '" + value + "' for server " + owner, e);
        }
    }

    private static Charset charset(String value, String owner) {
        if (isBlank(value)) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(value.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalStateException("Unknown encoding '" + value + "' for " + owner, e);
        }
    }

    private static String required(String value, String field, String owner) {
        if (isBlank(value)) {
            throw new IllegalStateException("Missing " + field + " for " + owner);
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
