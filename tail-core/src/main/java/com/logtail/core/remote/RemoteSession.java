package com.logtail.core.remote;

import java.io.Closeable;
import java.io.IOException;

/**
 * An authenticated session to one remote server, able to run commands. Sessions are owned by
 * {@link SshConnectionPool}; callers must not close a session they acquired from the pool.
 */
public interface RemoteSession extends Closeable {

    /**
     * Cheap liveness check. Must not throw.
     */
    boolean isAlive();

    RemoteCommand exec(String command) throws IOException;

    @Override
    void close();
}
