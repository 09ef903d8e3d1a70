package com.logtail.core.remote;

import com.logtail.core.models.ServerProfile;
import com.logtail.core.services.TailMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Keeps at most one reusable {@link RemoteSession} per server identity ({@code host:port}).
 * <p>
 * The map of pooled entries and the map of in-flight creations are only touched while holding {@code lock}. Probing,
 * opening and closing sessions always happen outside it, so a slow handshake to one host never blocks acquirers of
 * another. Concurrent acquirers for a host that has no session yet share a single creation.
 * <p>
 * Every successful {@link #acquire} takes a lease on the entry that must be handed back with {@link #release}. Leased
 * entries are never reaped as idle and never evicted for capacity; when every entry is leased the pool grows past its
 * bound and shrinks back as leases are returned. Otherwise inserting into a full pool evicts the least recently used
 * entry.
 */
@Slf4j
public class SshConnectionPool {

    public static final int DEFAULT_MAX_CONNECTIONS = 10;

    private final RemoteSessionFactory sessionFactory;
    private final TailMetrics metrics;
    private final int maxConnections;

    private final Object lock = new Object();
    // access order, eldest = least recently used
    private final LinkedHashMap<String, PooledConnection> connections = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<String, CompletableFuture<RemoteSession>> pending = new HashMap<>();
    private boolean released;

    public SshConnectionPool(RemoteSessionFactory sessionFactory, TailMetrics metrics, int maxConnections) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        this.sessionFactory = sessionFactory;
        this.metrics = metrics;
        this.maxConnections = maxConnections;
        metrics.bindPoolSize(this::size);
    }

    /**
     * Returns a live session for the profile's server, reusing the pooled one when it still answers.
     *
     * @throws RemoteConnectionException if a new session had to be opened and that failed
     */
    public RemoteSession acquire(ServerProfile profile) throws RemoteConnectionException {
        String serverId = profile.getId();
        while (true) {
            PooledConnection cached;
            CompletableFuture<RemoteSession> creation;
            boolean creator = false;

            synchronized (lock) {
                if (released) {
                    throw new RemoteConnectionException(serverId, "Connection pool has been shut down");
                }
                cached = connections.get(serverId);
                creation = pending.get(serverId);
                if (cached == null && creation == null) {
                    creation = new CompletableFuture<>();
                    pending.put(serverId, creation);
                    creator = true;
                }
            }

            if (cached != null) {
                if (cached.session.isAlive()) {
                    synchronized (lock) {
                        if (connections.get(serverId) != cached) {
                            continue;
                        }
                        cached.leases++;
                        cached.lastUsedAt = System.currentTimeMillis();
                    }
                    metrics.recordSessionReused(serverId);
                    return cached.session;
                }
                discard(serverId, cached);
                continue;
            }

            if (creator) {
                return create(profile, creation);
            }
            RemoteSession shared = await(serverId, creation);
            synchronized (lock) {
                PooledConnection entry = connections.get(serverId);
                if (entry != null && entry.session == shared) {
                    entry.leases++;
                    entry.lastUsedAt = System.currentTimeMillis();
                }
            }
            return shared;
        }
    }

    /**
     * Hands back a lease taken by {@link #acquire}. The session stays pooled; it only becomes eligible for idle reaping
     * and capacity eviction once no lease on it is open.
     */
    public void release(ServerProfile profile, RemoteSession session) {
        String serverId = profile.getId();
        List<PooledConnection> evicted;
        synchronized (lock) {
            PooledConnection entry = connections.get(serverId);
            if (entry == null || entry.session != session) {
                return;
            }
            entry.leases = Math.max(0, entry.leases - 1);
            entry.lastUsedAt = System.currentTimeMillis();
            evicted = trimToCapacity(maxConnections);
        }
        closeEvicted(evicted);
    }

    /**
     * Closes sessions whose idle time exceeds their profile's idle timeout.
     *
     * @return number of sessions closed
     */
    public int reapIdle() {
        long now = System.currentTimeMillis();
        List<PooledConnection> idle = new ArrayList<>();
        synchronized (lock) {
            Iterator<PooledConnection> it = connections.values().iterator();
            while (it.hasNext()) {
                PooledConnection connection = it.next();
                if (connection.leases == 0
                        && now - connection.lastUsedAt > connection.profile.getIdleTimeoutSeconds() * 1000L) {
                    it.remove();
                    idle.add(connection);
                }
            }
        }
        for (PooledConnection connection : idle) {
            log.info("SESSION_IDLE_CLOSED | server={} | idle_s={}",
                    connection.serverId, (now - connection.lastUsedAt) / 1000);
            metrics.recordSessionEvicted("idle");
            closeQuietly(connection);
        }
        return idle.size();
    }

    /**
     * Closes every pooled session. Safe to call more than once; later {@link #acquire} calls fail.
     */
    public void releaseAll() {
        List<PooledConnection> all;
        synchronized (lock) {
            released = true;
            all = new ArrayList<>(connections.values());
            connections.clear();
        }
        for (PooledConnection connection : all) {
            metrics.recordSessionEvicted("shutdown");
            closeQuietly(connection);
        }
        if (!all.isEmpty()) {
            log.info("POOL_RELEASED | sessions_closed={}", all.size());
        }
    }

    public int size() {
        synchronized (lock) {
            return connections.size();
        }
    }

    private RemoteSession create(ServerProfile profile, CompletableFuture<RemoteSession> creation)
            throws RemoteConnectionException {
        String serverId = profile.getId();
        RemoteSession session;
        try {
            session = sessionFactory.open(profile);
        } catch (RemoteConnectionException | RuntimeException e) {
            synchronized (lock) {
                pending.remove(serverId);
            }
            metrics.recordConnectionFailure(serverId);
            log.error("SESSION_CREATE_FAILED | server={} | error={}", serverId, e.getMessage());
            creation.completeExceptionally(e);
            if (e instanceof RemoteConnectionException) {
                throw (RemoteConnectionException) e;
            }
            throw new RemoteConnectionException(serverId, "SSH connection failed: " + e.getMessage(), e);
        }

        List<PooledConnection> evicted = List.of();
        boolean rejected;
        synchronized (lock) {
            pending.remove(serverId);
            rejected = released;
            if (!rejected) {
                evicted = trimToCapacity(maxConnections - 1);
                PooledConnection entry = new PooledConnection(serverId, profile, session);
                entry.leases = 1;
                connections.put(serverId, entry);
                if (connections.size() > maxConnections) {
                    log.warn("POOL_OVER_CAPACITY | size={} | max={} | reason=all_sessions_leased",
                            connections.size(), maxConnections);
                }
            }
        }

        closeEvicted(evicted);
        if (rejected) {
            session.close();
            RemoteConnectionException e =
                    new RemoteConnectionException(serverId, "Connection pool has been shut down");
            creation.completeExceptionally(e);
            throw e;
        }

        metrics.recordSessionCreated(serverId);
        log.info("SESSION_CREATED | server={} | pooled={}", serverId, size());
        creation.complete(session);
        return session;
    }

    private RemoteSession await(String serverId, CompletableFuture<RemoteSession> creation)
            throws RemoteConnectionException {
        try {
            return creation.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RemoteConnectionException) {
                throw (RemoteConnectionException) cause;
            }
            throw new RemoteConnectionException(serverId, "SSH connection failed: " + cause, cause);
        }
    }

    /**
     * Removes unleased entries, least recently used first, until at most {@code limit} remain. Caller holds the lock.
     */
    private List<PooledConnection> trimToCapacity(int limit) {
        List<PooledConnection> evicted = new ArrayList<>();
        Iterator<PooledConnection> it = connections.values().iterator();
        while (connections.size() > limit && it.hasNext()) {
            PooledConnection candidate = it.next();
            if (candidate.leases == 0) {
                it.remove();
                evicted.add(candidate);
            }
        }
        return evicted;
    }

    private void closeEvicted(List<PooledConnection> evicted) {
        for (PooledConnection connection : evicted) {
            log.info("SESSION_EVICTED | server={} | reason=capacity | max={}", connection.serverId, maxConnections);
            metrics.recordSessionEvicted("capacity");
            closeQuietly(connection);
        }
    }

    private void discard(String serverId, PooledConnection dead) {
        boolean removed;
        synchronized (lock) {
            removed = connections.get(serverId) == dead;
            if (removed) {
                connections.remove(serverId);
            }
        }
        if (removed) {
            log.warn("SESSION_DEAD | server={} | action=replace", serverId);
            metrics.recordSessionEvicted("dead");
            closeQuietly(dead);
        }
    }

    private void closeQuietly(PooledConnection connection) {
        try {
            connection.session.close();
        } catch (RuntimeException e) {
            log.warn("SESSION_CLOSE_FAILED | server={} | error={}", connection.serverId, e.toString());
        }
    }

    private static final class PooledConnection {
        private final String serverId;
        private final ServerProfile profile;
        private final RemoteSession session;
        private long lastUsedAt;
        private int leases;

        private PooledConnection(String serverId, ServerProfile profile, RemoteSession session) {
            this.serverId = serverId;
            this.profile = profile;
            this.session = session;
            this.lastUsedAt = System.currentTimeMillis();
        }
    }
}
