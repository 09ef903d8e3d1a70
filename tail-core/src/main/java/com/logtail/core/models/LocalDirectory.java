package com.logtail.core.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * A directory on this host whose files are addressable as {@code <id>/<relative path>}. Only regular files under
 * {@link #path} whose name matches {@link #pattern} are reachable; subdirectories only when {@link #recursive}.
 */
@Value
@Builder
public class LocalDirectory {
    @NonNull
    String id;

    @NonNull
    String path;

    @NonNull
    @Builder.Default
    String pattern = "*.log";

    @Builder.Default
    boolean recursive = true;

    @NonNull
    @Builder.Default
    Charset encoding = StandardCharsets.UTF_8;
}
