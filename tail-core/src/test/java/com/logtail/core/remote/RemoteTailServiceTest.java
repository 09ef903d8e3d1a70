package com.logtail.core.remote;

import com.logtail.core.models.AuthMethod;
import com.logtail.core.models.LineRecord;
import com.logtail.core.models.RemoteFile;
import com.logtail.core.models.ServerProfile;
import com.logtail.core.models.TailSettings;
import com.logtail.core.security.SecurityValidator;
import com.logtail.core.services.TailMetrics;
import com.logtail.core.services.TailStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RemoteTailServiceTest {

    private static final String SIZE_CMD = "find '/var/log/app.log' -maxdepth 0 -type f -printf %s";
    private static final String FOLLOW_CMD = "tail -n 0 -F '/var/log/app.log'";

    @Mock
    private SshConnectionPool pool;

    @Mock
    private RemoteSession session;

    @Mock
    private RemoteSessionFactory sessionFactory;

    private RemoteTailService remoteTailService;
    private ServerProfile profile;
    private List<LineRecord> records;
    private TailStream stream;

    @BeforeEach
    void setUp() throws Exception {
        remoteTailService = new RemoteTailService(new SecurityValidator(), pool, TailSettings.builder()
                .retryBackoff(java.time.Duration.ofMillis(10))
                .build());
        profile = ServerProfile.builder()
                .name("web")
                .host("web-1")
                .username("tail")
                .authMethod(AuthMethod.PASSWORD)
                .password("secret")
                .allowedPath("/var/log")
                .build();
        records = new CopyOnWriteArrayList<>();
        stream = new TailStream("web/app", records::add);
        when(pool.acquire(any())).thenReturn(session);
    }

    @Test
    void testPathOutsideAllowListIsDeniedWithoutRemoteCommands() throws Exception {
        // When
        remoteTailService.tail(profile, "/etc/passwd", StandardCharsets.UTF_8, stream);

        // Then
        assertEquals(1, records.size());
        LineRecord denial = records.get(0);
        assertEquals(LineRecord.Kind.SECURITY, denial.getKind());
        assertTrue(denial.isTerminal());
        assertEquals("[SECURITY] Access denied: /etc/passwd", denial.render());
        verify(pool, never()).acquire(any());
        verifyNoInteractions(session);
    }

    @Test
    void testConnectionFailureEndsStreamWithError() throws Exception {
        // Given
        when(pool.acquire(any())).thenThrow(new RemoteConnectionException("web-1:22", "refused"));

        // When
        remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream);

        // Then
        assertEquals(List.of("[ERROR] Failed to connect to remote server"), rendered());
        verify(pool, never()).release(any(), any());
    }

    @Test
    void testOversizedFileIsRejectedBeforeAnyTail() throws Exception {
        // Given
        when(session.exec(SIZE_CMD)).thenReturn(FakeRemoteCommand.output("524288000\n"));

        // When
        remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream);

        // Then
        assertEquals(List.of("[ERROR] File too large: 524288000 bytes (max: 104857600)"), rendered());
        verify(session, times(1)).exec(anyString());
    }

    @Test
    void testBacklogThenFollowedLinesAreCleaned() throws Exception {
        // Given
        when(session.exec(SIZE_CMD)).thenReturn(FakeRemoteCommand.output("24"));
        when(session.exec("tail -c 24 '/var/log/app.log'"))
                .thenReturn(FakeRemoteCommand.output("\u001B[31mred\u001B[0m\n\nplain  \n"));
        when(session.exec(FOLLOW_CMD)).thenReturn(FakeRemoteCommand.output("next\n   \n[32mgreen[0m\n"));

        // When
        remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream);

        // Then
        assertEquals(List.of("red", "plain", "next", "green", "[ERROR] Remote tail exited"), rendered());
        verify(pool).release(profile, session);
    }

    @Test
    void testBacklogWindowIsBoundedByConfiguredBytes() throws Exception {
        // Given
        when(session.exec(SIZE_CMD)).thenReturn(FakeRemoteCommand.output("99999"));
        when(session.exec("tail -c 10240 '/var/log/app.log'")).thenReturn(FakeRemoteCommand.output("tail end\n"));
        when(session.exec(FOLLOW_CMD)).thenReturn(FakeRemoteCommand.output(""));

        // When
        remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream);

        // Then
        assertEquals("tail end", records.get(0).getText());
        verify(session).exec("tail -c 10240 '/var/log/app.log'");
    }

    @Test
    void testSizeQueryFailureFallsBackToZero() throws Exception {
        // Given
        when(session.exec(SIZE_CMD)).thenThrow(new IOException("channel refused"));
        when(session.exec(FOLLOW_CMD)).thenReturn(FakeRemoteCommand.output("fresh\n"));

        // When
        remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream);

        // Then
        assertEquals(List.of("fresh", "[ERROR] Remote tail exited"), rendered());
        verify(session, never()).exec(startsWith("tail -c"));
    }

    @Test
    void testReadFailureIsTerminal() throws Exception {
        // Given
        when(session.exec(SIZE_CMD)).thenReturn(FakeRemoteCommand.output("0"));
        when(session.exec(FOLLOW_CMD)).thenReturn(FakeRemoteCommand.failing("connection reset"));

        // When
        remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream);

        // Then
        assertEquals(List.of("[ERROR] Failed to read remote file: connection reset"), rendered());
    }

    @Test
    void testCancellationClosesFollowCommandQuietly() throws Exception {
        // Given
        FakeRemoteCommand follow = FakeRemoteCommand.blockingUntilClosed();
        when(session.exec(SIZE_CMD)).thenReturn(FakeRemoteCommand.output("0"));
        when(session.exec(FOLLOW_CMD)).thenReturn(follow);
        Thread producer = new Thread(() ->
                remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream));
        producer.start();
        verify(session, timeout(2000)).exec(FOLLOW_CMD);

        // When
        stream.cancel();
        producer.join(TimeUnit.SECONDS.toMillis(5));

        // Then
        assertFalse(producer.isAlive());
        assertTrue(follow.wasClosed());
        assertTrue(records.isEmpty());
    }

    @Test
    void testRunningFollowKeepsSessionThroughIdleReap() throws Exception {
        // Given
        SshConnectionPool realPool = new SshConnectionPool(sessionFactory, TailMetrics.noop(), 10);
        remoteTailService = new RemoteTailService(new SecurityValidator(), realPool, TailSettings.defaults());
        ServerProfile shortIdle = profile.toBuilder().idleTimeoutSeconds(0).build();
        FakeRemoteCommand follow = FakeRemoteCommand.blockingUntilClosed();
        when(sessionFactory.open(any())).thenReturn(session);
        when(session.exec(SIZE_CMD)).thenReturn(FakeRemoteCommand.output("0"));
        when(session.exec(FOLLOW_CMD)).thenReturn(follow);
        Thread producer = new Thread(() ->
                remoteTailService.tail(shortIdle, "/var/log/app.log", StandardCharsets.UTF_8, stream));
        producer.start();
        verify(session, timeout(2000)).exec(FOLLOW_CMD);
        Thread.sleep(20);

        // When
        int reapedWhileFollowing = realPool.reapIdle();

        // Then
        assertEquals(0, reapedWhileFollowing);
        verify(session, never()).close();
        assertFalse(follow.wasClosed());
        assertTrue(records.isEmpty());

        stream.cancel();
        producer.join(TimeUnit.SECONDS.toMillis(5));
        Thread.sleep(20);
        assertEquals(1, realPool.reapIdle());
        verify(session).close();
    }

    @Test
    void testRunningFollowKeepsSessionWhenPoolIsFull() throws Exception {
        // Given
        SshConnectionPool realPool = new SshConnectionPool(sessionFactory, TailMetrics.noop(), 1);
        remoteTailService = new RemoteTailService(new SecurityValidator(), realPool, TailSettings.defaults());
        RemoteSession otherSession = mock(RemoteSession.class);
        ServerProfile otherServer = profile.toBuilder().host("web-2").build();
        FakeRemoteCommand follow = FakeRemoteCommand.blockingUntilClosed();
        when(sessionFactory.open(any())).thenReturn(session, otherSession);
        when(session.exec(SIZE_CMD)).thenReturn(FakeRemoteCommand.output("0"));
        when(session.exec(FOLLOW_CMD)).thenReturn(follow);
        Thread producer = new Thread(() ->
                remoteTailService.tail(profile, "/var/log/app.log", StandardCharsets.UTF_8, stream));
        producer.start();
        verify(session, timeout(2000)).exec(FOLLOW_CMD);

        // When
        RemoteSession acquired = realPool.acquire(otherServer);

        // Then
        assertSame(otherSession, acquired);
        verify(session, never()).close();
        assertFalse(follow.wasClosed());
        assertTrue(records.isEmpty());

        stream.cancel();
        producer.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(producer.isAlive());
    }

    @Test
    void testListAndClearReturnTheirLease() throws Exception {
        // Given
        when(session.exec("find '/var/log' -maxdepth 1 -type f -name '*.log'"))
                .thenReturn(FakeRemoteCommand.output("/var/log/app.log\n"));
        when(session.exec("truncate -s 0 '/var/log/app.log'")).thenReturn(FakeRemoteCommand.output(""));

        // When
        remoteTailService.listFiles(profile, "/var/log", "*.log", false);
        remoteTailService.clear(profile, "/var/log/app.log");

        // Then
        verify(pool, times(2)).acquire(profile);
        verify(pool, times(2)).release(profile, session);
    }

    @Test
    void testPathsAreSingleQuoted() {
        assertEquals("'/var/log/it'\\''s.log'", RemoteTailService.quote("/var/log/it's.log"));
    }

    @Test
    void testListFilesIsCappedAtMaximum() throws Exception {
        // Given
        String output = IntStream.range(0, 1500)
                .mapToObj(i -> "/var/log/app-" + i + ".log")
                .collect(Collectors.joining("\n"));
        when(session.exec("find '/var/log' -maxdepth 1 -type f -name '*.log'"))
                .thenReturn(FakeRemoteCommand.output(output));

        // When
        List<RemoteFile> files = remoteTailService.listFiles(profile, "/var/log", "*.log", false);

        // Then
        assertEquals(1000, files.size());
        assertEquals(new RemoteFile("/var/log/app-0.log", "app-0.log"), files.get(0));
    }

    @Test
    void testRecursiveListingDropsDepthLimit() throws Exception {
        // Given
        when(session.exec("find '/var/log' -type f -name '*.log'"))
                .thenReturn(FakeRemoteCommand.output("/var/log/nginx/access.log\n"));

        // When
        List<RemoteFile> files = remoteTailService.listFiles(profile, "/var/log", "*.log", true);

        // Then
        assertEquals(List.of(new RemoteFile("/var/log/nginx/access.log", "access.log")), files);
    }

    @Test
    void testListOutsideAllowListReturnsNothing() throws Exception {
        // When
        List<RemoteFile> files = remoteTailService.listFiles(profile, "/etc", "*", false);

        // Then
        assertTrue(files.isEmpty());
        verify(pool, never()).acquire(any());
    }

    @Test
    void testClearTruncatesRemoteFile() throws Exception {
        // Given
        when(session.exec("truncate -s 0 '/var/log/app.log'")).thenReturn(FakeRemoteCommand.output(""));

        // When
        boolean cleared = remoteTailService.clear(profile, "/var/log/app.log");

        // Then
        assertTrue(cleared);
        verify(session).exec("truncate -s 0 '/var/log/app.log'");
    }

    @Test
    void testClearFailsOnErrorOutput() throws Exception {
        // Given
        when(session.exec("truncate -s 0 '/var/log/app.log'"))
                .thenReturn(FakeRemoteCommand.errorOutput("truncate: cannot open: Permission denied\n"));

        // When
        boolean cleared = remoteTailService.clear(profile, "/var/log/app.log");

        // Then
        assertFalse(cleared);
    }

    @Test
    void testClearOutsideAllowListIsRejected() throws Exception {
        // When
        boolean cleared = remoteTailService.clear(profile, "/var/log/../../etc/hosts");

        // Then
        assertFalse(cleared);
        verify(pool, never()).acquire(any());
    }

    private List<String> rendered() {
        return records.stream().map(LineRecord::render).collect(Collectors.toList());
    }
}
