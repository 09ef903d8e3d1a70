package com.logtail.core.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A file found by a remote directory listing.
 */
@Value
public class RemoteFile {
    @JsonProperty("path")
    String path;

    @JsonProperty("name")
    String name;

    public static RemoteFile of(String path) {
        int slash = path.lastIndexOf('/');
        return new RemoteFile(path, slash >= 0 ? path.substring(slash + 1) : path);
    }
}
