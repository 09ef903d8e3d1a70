package com.logtail.core.models;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables shared by local and remote tailing.
 */
@Value
@Builder
public class TailSettings {
    /** Bytes of existing content replayed before following. */
    @Builder.Default
    int backlogWindowBytes = 10 * 1024;

    /** Upper bound on how long a local session sleeps without a change notification. */
    @Builder.Default
    Duration pollTimeout = Duration.ofSeconds(2);

    @Builder.Default
    Duration retryBackoff = Duration.ofMillis(100);

    @Builder.Default
    int maxListResults = 1000;

    @Builder.Default
    int maxConcurrentStreams = 64;

    public static TailSettings defaults() {
        return TailSettings.builder().build();
    }
}
