package com.logtail.server.config;

import com.logtail.core.models.TailSettings;
import com.logtail.core.remote.JschSessionFactory;
import com.logtail.core.remote.RemoteSessionFactory;
import com.logtail.core.remote.RemoteTailService;
import com.logtail.core.remote.SshConnectionPool;
import com.logtail.core.security.SecurityValidator;
import com.logtail.core.services.SourceCatalog;
import com.logtail.core.services.TailMetrics;
import com.logtail.core.services.TailService;
import com.logtail.core.services.TailServiceImpl;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires exactly one tailing engine per application context. The engine's {@code shutdown()} runs on context close.
 */
@Configuration
public class TailerConfiguration {

    @Bean
    public SourceCatalog sourceCatalog(TailerProperties properties) {
        return SourceCatalogFactory.create(properties);
    }

    @Bean
    public TailSettings tailSettings(TailerProperties properties) {
        TailerProperties.Tail tail = properties.getTail();
        return TailSettings.builder()
                .backlogWindowBytes(tail.getBacklogBytes())
                .pollTimeout(Duration.ofMillis(tail.getPollTimeoutMs()))
                .retryBackoff(Duration.ofMillis(tail.getRetryBackoffMs()))
                .maxConcurrentStreams(tail.getMaxStreams())
                .maxListResults(tail.getMaxListResults())
                .build();
    }

    @Bean
    public TailMetrics tailMetrics(MeterRegistry meterRegistry) {
        return new TailMetrics(meterRegistry);
    }

    @Bean
    public SecurityValidator securityValidator() {
        return new SecurityValidator();
    }

    @Bean
    public RemoteSessionFactory remoteSessionFactory() {
        return new JschSessionFactory();
    }

    @Bean
    public SshConnectionPool sshConnectionPool(RemoteSessionFactory remoteSessionFactory, TailMetrics tailMetrics,
                                               TailerProperties properties) {
        return new SshConnectionPool(remoteSessionFactory, tailMetrics, properties.getPool().getMaxConnections());
    }

    @Bean
    public RemoteTailService remoteTailService(SecurityValidator securityValidator, SshConnectionPool pool,
                                               TailSettings tailSettings) {
        return new RemoteTailService(securityValidator, pool, tailSettings);
    }

    @Bean(destroyMethod = "shutdown")
    public TailService tailService(SourceCatalog sourceCatalog, RemoteTailService remoteTailService,
                                   SshConnectionPool pool, TailSettings tailSettings, TailMetrics tailMetrics) {
        return new TailServiceImpl(sourceCatalog, remoteTailService, pool, tailSettings, tailMetrics);
    }
}
