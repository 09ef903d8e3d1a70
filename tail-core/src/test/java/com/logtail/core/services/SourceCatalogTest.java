package com.logtail.core.services;

import com.logtail.core.models.AuthMethod;
import com.logtail.core.models.LocalDirectory;
import com.logtail.core.models.Locality;
import com.logtail.core.models.LogSource;
import com.logtail.core.models.RemoteDirectory;
import com.logtail.core.models.ServerProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SourceCatalogTest {

    @TempDir
    Path tempDir;

    private ServerProfile server;
    private SourceCatalog catalog;

    @BeforeEach
    void setUp() {
        server = ServerProfile.builder()
                .name("web")
                .host("web-1")
                .username("tail")
                .authMethod(AuthMethod.PASSWORD)
                .password("secret")
                .allowedPath("/var/log")
                .build();
        catalog = new SourceCatalog(
                List.of(LogSource.local("app", "/tmp/app.log", StandardCharsets.UTF_8),
                        LogSource.remote("web/nginx", "/var/log/nginx/access.log", StandardCharsets.UTF_8,
                                server.getId())),
                List.of(server),
                List.of(RemoteDirectory.builder().id("web/logs").path("/var/log/").serverRef(server.getId()).build()));
    }

    @Test
    void testConfiguredSourceResolvesToSameRecord() {
        Optional<LogSource> first = catalog.resolve("app");
        Optional<LogSource> second = catalog.resolve("app");

        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
        assertEquals(Locality.LOCAL, first.get().getLocality());
    }

    @Test
    void testDirectoryPrefixResolvesRemoteFile() {
        // When
        Optional<LogSource> resolved = catalog.resolve("web/logs/syslog");

        // Then
        assertTrue(resolved.isPresent());
        assertEquals("/var/log/syslog", resolved.get().getPath());
        assertEquals(Locality.REMOTE, resolved.get().getLocality());
        assertEquals(server.getId(), resolved.get().getServerRef());
    }

    @Test
    void testUnknownIdsDoNotResolve() {
        assertTrue(catalog.resolve("missing").isEmpty());
        assertTrue(catalog.resolve("web/logs/").isEmpty());
        assertTrue(catalog.resolve(null).isEmpty());
    }

    @Test
    void testListingsPreserveConfigurationOrder() {
        assertEquals(List.of("app", "web/nginx"),
                catalog.sources().stream().map(LogSource::getId).toList());
        assertEquals(Optional.of(server), catalog.server("web-1:22"));
    }

    @Test
    void testDuplicateSourceIdIsRejected() {
        List<LogSource> sources = List.of(
                LogSource.local("app", "/tmp/a.log", StandardCharsets.UTF_8),
                LogSource.local("app", "/tmp/b.log", StandardCharsets.UTF_8));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new SourceCatalog(sources, List.of(), List.of()));
        assertTrue(error.getMessage().contains("Duplicate source id"));
    }

    @Test
    void testRemoteSourceWithUnknownServerIsRejected() {
        List<LogSource> sources = List.of(
                LogSource.remote("db", "/var/log/db.log", StandardCharsets.UTF_8, "db-1:22"));

        assertThrows(IllegalArgumentException.class, () -> new SourceCatalog(sources, List.of(), List.of()));
    }

    @Test
    void testLocalDirectoryIdResolvesToLocalFileInsideDirectory() throws IOException {
        // Given
        Path base = Files.createDirectories(tempDir.resolve("services"));
        Files.createDirectories(base.resolve("api"));
        SourceCatalog local = localCatalog(LocalDirectory.builder().id("svc").path(base.toString()).build());

        // When
        Optional<LogSource> resolved = local.resolve("svc/api/../api/server.log");

        // Then
        assertTrue(resolved.isPresent());
        assertEquals(Locality.LOCAL, resolved.get().getLocality());
        assertEquals(base.resolve("api/server.log").toAbsolutePath().normalize().toString(),
                resolved.get().getPath());
        assertEquals("svc/api/../api/server.log", resolved.get().getId());
    }

    @Test
    void testLocalDirectoryRejectsIdsThatEscapeIt() throws IOException {
        // Given
        Path base = Files.createDirectories(tempDir.resolve("services"));
        Files.writeString(tempDir.resolve("secret.log"), "x\n");
        SourceCatalog local = localCatalog(LocalDirectory.builder().id("svc").path(base.toString()).build());

        // Then
        assertTrue(local.resolve("svc/../secret.log").isEmpty());
        assertTrue(local.resolve("svc/api/../../secret.log").isEmpty());
        assertTrue(local.resolve("svc/" + tempDir.resolve("secret.log")).isEmpty());
        assertTrue(local.resolve("svc/.").isEmpty());
    }

    @Test
    void testLocalDirectoryHonoursPatternAndRecursion() throws IOException {
        // Given
        Path base = Files.createDirectories(tempDir.resolve("services"));
        SourceCatalog local = localCatalog(LocalDirectory.builder()
                .id("svc")
                .path(base.toString())
                .pattern("*.txt")
                .recursive(false)
                .build());

        // Then
        assertTrue(local.resolve("svc/notes.txt").isPresent());
        assertTrue(local.resolve("svc/notes.log").isEmpty());
        assertTrue(local.resolve("svc/nested/notes.txt").isEmpty());
    }

    @Test
    void testLocalDirectoryRejectsLinkPointingOutside() throws IOException {
        // Given
        Path base = Files.createDirectories(tempDir.resolve("services"));
        Path outside = Files.writeString(tempDir.resolve("outside.log"), "x\n");
        Files.createSymbolicLink(base.resolve("linked.log"), outside);
        SourceCatalog local = localCatalog(LocalDirectory.builder().id("svc").path(base.toString()).build());

        // Then
        assertTrue(local.resolve("svc/linked.log").isEmpty());
    }

    @Test
    void testScanListsMatchingFilesWithRelativeIds() throws IOException {
        // Given
        Path base = Files.createDirectories(tempDir.resolve("services"));
        Files.createDirectories(base.resolve("api"));
        Files.writeString(base.resolve("b.log"), "");
        Files.writeString(base.resolve("api/a.log"), "");
        Files.writeString(base.resolve("readme.md"), "");
        SourceCatalog local = localCatalog(LocalDirectory.builder().id("svc").path(base.toString()).build());

        // When
        List<LogSource> scanned = local.scanLocalDirectories();

        // Then
        assertEquals(List.of("svc/api/a.log", "svc/b.log"), scanned.stream().map(LogSource::getId).toList());
        for (LogSource source : scanned) {
            assertEquals(local.resolve(source.getId()).orElseThrow().getPath(), source.getPath());
        }
    }

    @Test
    void testScanOfMissingDirectoryIsEmpty() {
        SourceCatalog local = localCatalog(LocalDirectory.builder()
                .id("svc")
                .path(tempDir.resolve("absent").toString())
                .build());

        assertTrue(local.scanLocalDirectories().isEmpty());
    }

    @Test
    void testDirectoryIdClashingWithSourceIsRejected() {
        List<LogSource> sources = List.of(LogSource.local("svc", "/tmp/svc.log", StandardCharsets.UTF_8));
        List<LocalDirectory> directories = List.of(LocalDirectory.builder().id("svc").path("/tmp").build());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new SourceCatalog(sources, List.of(), List.of(), directories));
        assertTrue(error.getMessage().contains("Duplicate directory id"));
    }

    private static SourceCatalog localCatalog(LocalDirectory directory) {
        return new SourceCatalog(List.of(), List.of(), List.of(), List.of(directory));
    }
}
