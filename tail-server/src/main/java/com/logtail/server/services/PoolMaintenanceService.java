package com.logtail.server.services;

import com.logtail.core.remote.SshConnectionPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class PoolMaintenanceService {
    private final SshConnectionPool connectionPool;

    public PoolMaintenanceService(SshConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    @Scheduled(fixedRateString = "${tailer.pool.reap-interval-ms:60000}",
            initialDelayString = "${tailer.pool.reap-interval-ms:60000}")
    public void reapIdleSessions() {
        int reaped = connectionPool.reapIdle();
        if (reaped > 0) {
            log.info("POOL_MAINTENANCE_COMPLETE | reaped={} | remaining={}", reaped, connectionPool.size());
        }
    }
}
