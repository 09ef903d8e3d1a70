package com.logtail.core.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * {@code LogSource} describes one tailable file. Instances are built once from configuration and never change; in
 * particular the {@link Locality} of a source is fixed at creation. Remote sources carry the id of the
 * {@link ServerProfile} they are reached through.
 */
@Value
@Builder
public class LogSource {
    @NonNull
    String id;

    @NonNull
    String path;

    @NonNull
    @Builder.Default
    Charset encoding = StandardCharsets.UTF_8;

    @NonNull
    Locality locality;

    String serverRef;

    public boolean isRemote() {
        return locality == Locality.REMOTE;
    }

    public static LogSource local(String id, String path, Charset encoding) {
        return LogSource.builder().id(id).path(path).encoding(encoding).locality(Locality.LOCAL).build();
    }

    public static LogSource remote(String id, String path, Charset encoding, String serverRef) {
        return LogSource.builder()
                .id(id)
                .path(path)
                .encoding(encoding)
                .locality(Locality.REMOTE)
                .serverRef(serverRef)
                .build();
    }
}
