package com.logtail.core.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Set;

/**
 * {@code ServerProfile} holds everything needed to open and police an SSH session to one remote host: the
 * credential, the path prefixes that may be read there and the per-server limits. The profile id is
 * {@code host:port} and keys the connection pool.
 */
@Value
@Builder(toBuilder = true)
public class ServerProfile {
    public static final long DEFAULT_MAX_FILE_SIZE = 104_857_600L;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 300;

    @NonNull
    String name;

    @NonNull
    String host;

    @Builder.Default
    int port = 22;

    @NonNull
    String username;

    @NonNull
    @Builder.Default
    AuthMethod authMethod = AuthMethod.KEY;

    String keyPath;

    @ToString.Exclude
    String password;

    String knownHostsPath;

    @Singular
    Set<String> allowedPaths;

    @Builder.Default
    long maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE;

    @Builder.Default
    int idleTimeoutSeconds = DEFAULT_IDLE_TIMEOUT_SECONDS;

    public String getId() {
        return host + ":" + port;
    }
}
