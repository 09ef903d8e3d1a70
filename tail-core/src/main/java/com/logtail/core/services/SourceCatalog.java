package com.logtail.core.services;

import com.logtail.core.models.LocalDirectory;
import com.logtail.core.models.LogSource;
import com.logtail.core.models.RemoteDirectory;
import com.logtail.core.models.ServerProfile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable lookup of everything that can be tailed, built once from validated configuration records.
 * <p>
 * Besides the explicitly configured sources, an id of the form {@code <directory id>/<relative path>} resolves to a
 * file inside a configured directory. For a local directory the relative path is normalized here and must stay under
 * the directory and match its pattern. Remote paths are not trusted here; the remote gate validates them on access.
 */
@Slf4j
public final class SourceCatalog {

    private final Map<String, LogSource> sources;
    private final Map<String, ServerProfile> servers;
    private final List<RemoteDirectory> directories;
    private final List<LocalDirectory> localDirectories;

    public SourceCatalog(List<LogSource> sources, List<ServerProfile> servers, List<RemoteDirectory> directories) {
        this(sources, servers, directories, List.of());
    }

    public SourceCatalog(List<LogSource> sources, List<ServerProfile> servers, List<RemoteDirectory> directories,
                         List<LocalDirectory> localDirectories) {
        Map<String, ServerProfile> serverMap = new LinkedHashMap<>();
        for (ServerProfile server : servers) {
            if (serverMap.putIfAbsent(server.getId(), server) != null) {
                throw new IllegalArgumentException("Duplicate server id: " + server.getId());
            }
        }
        Map<String, LogSource> sourceMap = new LinkedHashMap<>();
        for (LogSource source : sources) {
            if (source.isRemote() && !serverMap.containsKey(source.getServerRef())) {
                throw new IllegalArgumentException(
                        "Source " + source.getId() + " references unknown server " + source.getServerRef());
            }
            if (sourceMap.putIfAbsent(source.getId(), source) != null) {
                throw new IllegalArgumentException("Duplicate source id: " + source.getId());
            }
        }
        Set<String> directoryIds = new HashSet<>();
        for (RemoteDirectory directory : directories) {
            if (!serverMap.containsKey(directory.getServerRef())) {
                throw new IllegalArgumentException(
                        "Directory " + directory.getId() + " references unknown server " + directory.getServerRef());
            }
            claimDirectoryId(directoryIds, sourceMap, directory.getId());
        }
        for (LocalDirectory directory : localDirectories) {
            claimDirectoryId(directoryIds, sourceMap, directory.getId());
        }
        this.sources = Collections.unmodifiableMap(sourceMap);
        this.servers = Collections.unmodifiableMap(serverMap);
        this.directories = List.copyOf(directories);
        this.localDirectories = List.copyOf(localDirectories);
    }

    public static SourceCatalog empty() {
        return new SourceCatalog(List.of(), List.of(), List.of());
    }

    public Optional<LogSource> resolve(String id) {
        if (id == null) {
            return Optional.empty();
        }
        LogSource configured = sources.get(id);
        if (configured != null) {
            return Optional.of(configured);
        }
        for (LocalDirectory directory : localDirectories) {
            String relative = relativePart(id, directory.getId());
            if (relative != null) {
                return resolveLocal(id, directory, relative);
            }
        }
        for (RemoteDirectory directory : directories) {
            String relative = relativePart(id, directory.getId());
            if (relative != null) {
                String base = directory.getPath().endsWith("/") ? directory.getPath() : directory.getPath() + "/";
                return Optional.of(LogSource.remote(id, base + relative, StandardCharsets.UTF_8,
                        directory.getServerRef()));
            }
        }
        return Optional.empty();
    }

    /**
     * Lists the files currently present in every local directory, as sources with {@code <directory id>/<relative>}
     * ids. A directory that is missing or unreadable contributes nothing.
     */
    public List<LogSource> scanLocalDirectories() {
        List<LogSource> found = new ArrayList<>();
        for (LocalDirectory directory : localDirectories) {
            found.addAll(scan(directory));
        }
        return found;
    }

    public Optional<ServerProfile> server(String serverId) {
        return Optional.ofNullable(servers.get(serverId));
    }

    public List<LogSource> sources() {
        return new ArrayList<>(sources.values());
    }

    public List<ServerProfile> servers() {
        return new ArrayList<>(servers.values());
    }

    public List<RemoteDirectory> directories() {
        return directories;
    }

    public List<LocalDirectory> localDirectories() {
        return localDirectories;
    }

    private Optional<LogSource> resolveLocal(String id, LocalDirectory directory, String relative) {
        Path base = basePath(directory);
        Path target;
        try {
            target = base.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            log.warn("LOCAL_PATH_REJECTED | id={} | reason=invalid_path", id);
            return Optional.empty();
        }

        if (!target.startsWith(base) || target.equals(base)) {
            log.warn("LOCAL_PATH_REJECTED | id={} | reason=outside_directory | directory={}", id, base);
            return Optional.empty();
        }
        if (!directory.isRecursive() && !base.equals(target.getParent())) {
            log.warn("LOCAL_PATH_REJECTED | id={} | reason=not_recursive", id);
            return Optional.empty();
        }
        if (!matcher(directory).matches(target.getFileName())) {
            log.warn("LOCAL_PATH_REJECTED | id={} | reason=pattern_mismatch | pattern={}", id, directory.getPattern());
            return Optional.empty();
        }
        if (Files.exists(target) && !staysInsideAfterLinks(base, target)) {
            log.warn("LOCAL_PATH_REJECTED | id={} | reason=link_outside_directory", id);
            return Optional.empty();
        }
        return Optional.of(LogSource.local(id, target.toString(), directory.getEncoding()));
    }

    private boolean staysInsideAfterLinks(Path base, Path target) {
        try {
            return target.toRealPath().startsWith(base.toRealPath());
        } catch (IOException e) {
            log.debug("LOCAL_PATH_UNRESOLVED | path={} | error={}", target, e.toString());
            return false;
        }
    }

    private List<LogSource> scan(LocalDirectory directory) {
        Path base = basePath(directory);
        if (!Files.isDirectory(base)) {
            log.warn("LOCAL_DIRECTORY_MISSING | id={} | path={}", directory.getId(), base);
            return List.of();
        }
        PathMatcher matcher = matcher(directory);
        int depth = directory.isRecursive() ? Integer.MAX_VALUE : 1;
        try (Stream<Path> walk = Files.walk(base, depth)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> matcher.matches(path.getFileName()))
                    .map(path -> LogSource.local(directory.getId() + "/" + relativeId(base, path),
                            path.toString(), directory.getEncoding()))
                    .sorted(Comparator.comparing(LogSource::getId))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("LOCAL_DIRECTORY_SCAN_FAILED | id={} | path={} | error={}", directory.getId(), base, e.toString());
            return List.of();
        }
    }

    private static String relativeId(Path base, Path file) {
        Path relative = base.relativize(file);
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private static Path basePath(LocalDirectory directory) {
        return Path.of(directory.getPath()).toAbsolutePath().normalize();
    }

    private static PathMatcher matcher(LocalDirectory directory) {
        return FileSystems.getDefault().getPathMatcher("glob:" + directory.getPattern());
    }

    private static String relativePart(String id, String directoryId) {
        String prefix = directoryId + "/";
        if (id.startsWith(prefix) && id.length() > prefix.length()) {
            return id.substring(prefix.length());
        }
        return null;
    }

    private static void claimDirectoryId(Set<String> directoryIds, Map<String, LogSource> sourceMap, String id) {
        if (!directoryIds.add(id) || sourceMap.containsKey(id)) {
            throw new IllegalArgumentException("Duplicate directory id: " + id);
        }
    }
}
