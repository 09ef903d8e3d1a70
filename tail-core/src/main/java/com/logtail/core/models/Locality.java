package com.logtail.core.models;

/**
 * Where the bytes of a {@link LogSource} live.
 */
public enum Locality {
    LOCAL,
    REMOTE
}
