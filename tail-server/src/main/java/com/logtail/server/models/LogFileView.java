package com.logtail.server.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.logtail.core.models.LogSource;
import lombok.Builder;
import lombok.Data;

/**
 * {@code LogFileView} is the client-facing description of one configured source. Remote sources name the server they
 * are read from; local ones leave it out.
 */
@Builder
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogFileView {
    @JsonProperty("id")
    private String id;

    @JsonProperty("path")
    private String path;

    @JsonProperty("locality")
    private String locality;

    @JsonProperty("server")
    private String server;

    public static LogFileView of(LogSource source) {
        return LogFileView.builder()
                .id(source.getId())
                .path(source.getPath())
                .locality(source.getLocality().name().toLowerCase())
                .server(source.getServerRef())
                .build();
    }
}
