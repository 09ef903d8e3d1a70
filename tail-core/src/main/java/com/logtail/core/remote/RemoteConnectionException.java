package com.logtail.core.remote;

/**
 * Raised when no usable session to a remote server could be obtained. Never retried by the pool; the caller decides
 * whether to try again.
 */
public class RemoteConnectionException extends Exception {
    private final String serverId;

    public RemoteConnectionException(String serverId, String message) {
        super(message);
        this.serverId = serverId;
    }

    public RemoteConnectionException(String serverId, String message, Throwable cause) {
        super(message, cause);
        this.serverId = serverId;
    }

    public String getServerId() {
        return serverId;
    }
}
