package com.logtail.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw {@code tailer.*} configuration. Only {@link SourceCatalogFactory} and {@link TailerConfiguration} read it; the
 * engine works on the validated records built from it.
 */
@Data
@ConfigurationProperties(prefix = "tailer")
public class TailerProperties {

    private List<LogFile> logFiles = new ArrayList<>();
    private List<LocalDirectory> localDirectories = new ArrayList<>();
    private List<RemoteServer> remoteServers = new ArrayList<>();
    private Pool pool = new Pool();
    private Tail tail = new Tail();
    private Stream stream = new Stream();

    @Data
    public static class LogFile {
        private String name;
        private String path;
        private String encoding = "utf-8";
    }

    @Data
    public static class LocalDirectory {
        private String name;
        private String scanDir;
        private String pattern = "*.log";
        private boolean recursive = true;
        private String encoding = "utf-8";
    }

    @Data
    public static class RemoteServer {
        private String name;
        private String host;
        private int port = 22;
        private String user;
        private String authMethod = "key";
        private String keyPath;
        private String password;
        private String knownHostsPath;
        private List<String> allowedPaths = new ArrayList<>();
        private long maxFileSize = 100L * 1024 * 1024;
        private int idleTimeoutSeconds = 300;
        private List<RemoteLog> logs = new ArrayList<>();
    }

    @Data
    public static class RemoteLog {
        private String name;
        private String path;
        private String type = "file";
        private String pattern = "*.log";
        private boolean recursive = false;
        private String encoding = "utf-8";
    }

    @Data
    public static class Pool {
        private int maxConnections = 10;
        private long reapIntervalMs = 60000;
    }

    @Data
    public static class Tail {
        private int backlogBytes = 10 * 1024;
        private long pollTimeoutMs = 2000;
        private long retryBackoffMs = 100;
        private int maxStreams = 64;
        private int maxListResults = 1000;
    }

    @Data
    public static class Stream {
        private long heartbeatMs = 2000;
    }
}
