package com.logtail.core.services;

import com.logtail.core.models.LineRecord;
import com.logtail.core.models.LogSource;
import com.logtail.core.models.RemoteFile;
import com.logtail.core.models.ServerProfile;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public interface TailService {

    Optional<LogSource> resolve(String id);

    /**
     * Configured sources in configuration order, followed by the files currently found in local directories.
     */
    List<LogSource> listSources();

    Optional<ServerProfile> findServer(String serverId);

    /**
     * Starts tailing the source with the given id. Records are delivered to {@code sink} in file order on a worker
     * thread; the stream ends after the first terminal sentinel or when the returned handle is cancelled.
     */
    TailStream tail(String id, Consumer<LineRecord> sink);

    boolean clear(String id);

    List<RemoteFile> listRemoteDirectory(ServerProfile profile, String path, String pattern, boolean recursive);

    void shutdown();
}
