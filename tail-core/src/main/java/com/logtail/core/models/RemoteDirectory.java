package com.logtail.core.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A directory on a remote server whose files are addressable as {@code <id>/<relative path>} without being listed
 * individually in configuration.
 */
@Value
@Builder
public class RemoteDirectory {
    @NonNull
    String id;

    @NonNull
    String path;

    @NonNull
    @Builder.Default
    String pattern = "*.log";

    boolean recursive;

    @NonNull
    String serverRef;
}
