package com.logtail.core.remote;

import java.io.Closeable;
import java.io.InputStream;

/**
 * A running remote command. Closing it tears down the underlying channel, which unblocks any pending read on its
 * streams.
 */
public interface RemoteCommand extends Closeable {

    InputStream getInputStream();

    InputStream getErrorStream();

    /**
     * Whether the remote side has finished the command.
     */
    boolean isClosed();

    @Override
    void close();
}
