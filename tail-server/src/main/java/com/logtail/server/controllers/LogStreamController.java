package com.logtail.server.controllers;

import com.logtail.core.models.RemoteFile;
import com.logtail.core.models.ServerProfile;
import com.logtail.core.services.TailService;
import com.logtail.server.models.ClearRequest;
import com.logtail.server.models.LogFileView;
import com.logtail.server.services.SseStreamRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/v1")
public class LogStreamController {
    private final TailService tailService;
    private final SseStreamRegistry streamRegistry;

    public LogStreamController(TailService tailService, SseStreamRegistry streamRegistry) {
        this.tailService = tailService;
        this.streamRegistry = streamRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok("Log tailer is online.\n");
    }

    @GetMapping("/files")
    public ResponseEntity<List<LogFileView>> listFiles() {
        return ResponseEntity.ok(tailService.listSources().stream()
                .map(LogFileView::of)
                .collect(Collectors.toList()));
    }

    @GetMapping(value = "/logs/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamLog(@RequestParam("file") String file) {
        log.info("Stream requested: {}", file);
        return streamRegistry.open(file);
    }

    @PostMapping("/logs/clear")
    public ResponseEntity<Map<String, String>> clearLog(@RequestBody ClearRequest request) {
        String file = request.getFile();
        if (file != null && tailService.clear(file)) {
            return ResponseEntity.ok(Map.of("status", "success", "message", "Log " + file + " cleared"));
        }
        return ResponseEntity.badRequest().body(Map.of("status", "error", "message", "Failed to clear log"));
    }

    @GetMapping("/servers/{serverId}/files")
    public ResponseEntity<List<RemoteFile>> listRemoteFiles(@PathVariable String serverId,
                                                            @RequestParam("path") String path,
                                                            @RequestParam(defaultValue = "*.log") String pattern,
                                                            @RequestParam(defaultValue = "false") boolean recursive) {
        Optional<ServerProfile> profile = tailService.findServer(serverId);
        if (profile.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(tailService.listRemoteDirectory(profile.get(), path, pattern, recursive));
    }
}
