package com.logtail.core.remote;

import com.logtail.core.models.ServerProfile;

@FunctionalInterface
public interface RemoteSessionFactory {

    /**
     * Opens and authenticates a new session. Blocks for the duration of the handshake.
     */
    RemoteSession open(ServerProfile profile) throws RemoteConnectionException;
}
