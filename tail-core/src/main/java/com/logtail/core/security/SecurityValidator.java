package com.logtail.core.security;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Gate in front of every remote file access. All checks are pure functions of their arguments, so one instance can
 * be shared freely between threads.
 */
@Slf4j
public class SecurityValidator {

    private static final List<Pattern> DENIED_PATHS = List.of(
            Pattern.compile("\\.\\."),
            Pattern.compile("/etc/shadow", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/etc/passwd", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/\\.ssh(/|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/id_(rsa|dsa|ecdsa|ed25519)[^/]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.pem$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.key$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^/proc(/|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^/sys(/|$)", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> READ_COMMANDS = Set.of("tail", "cat", "head", "ls", "find");
    private static final Set<String> WRITE_COMMANDS = Set.of("truncate");
    private static final String SHELL_METACHARACTERS = ";|&$`><\n\r";

    /**
     * Accepts {@code path} only if, once made absolute and normalized, it matches no denied pattern and lies under one
     * of {@code allowedPrefixes}. An empty allow-list accepts nothing.
     */
    public boolean validatePath(String path, Collection<String> allowedPrefixes) {
        if (path == null || path.isBlank()) {
            return false;
        }
        Path canonical;
        try {
            canonical = canonicalize(path);
        } catch (InvalidPathException e) {
            log.warn("PATH_REJECTED | reason=unparseable | path={}", path);
            return false;
        }

        String unixForm = canonical.toString().replace('\\', '/');
        for (Pattern denied : DENIED_PATHS) {
            if (denied.matcher(unixForm).find()) {
                log.warn("PATH_REJECTED | reason=denylist | pattern={} | path={}", denied.pattern(), path);
                return false;
            }
        }

        if (allowedPrefixes == null || allowedPrefixes.isEmpty()) {
            log.warn("PATH_REJECTED | reason=no_allowed_paths | path={}", path);
            return false;
        }

        for (String allowed : allowedPrefixes) {
            try {
                if (canonical.startsWith(canonicalize(allowed))) {
                    return true;
                }
            } catch (InvalidPathException e) {
                log.warn("ALLOWED_PATH_INVALID | prefix={}", allowed);
            }
        }
        log.warn("PATH_REJECTED | reason=not_allowed | path={}", path);
        return false;
    }

    /**
     * Accepts read-only invocations of the allow-listed tools that contain no shell metacharacters, so nothing can be
     * chained, substituted or redirected.
     */
    public boolean validateCommand(String command) {
        return validate(command, READ_COMMANDS);
    }

    /**
     * Same rules as {@link #validateCommand(String)} for the single mutating invocation the service issues.
     */
    public boolean validateWriteCommand(String command) {
        return validate(command, WRITE_COMMANDS);
    }

    public boolean checkFileSize(long size, long maxSize) {
        return size >= 0 && size <= maxSize;
    }

    private boolean validate(String command, Set<String> allowedCommands) {
        if (command == null || command.isBlank()) {
            return false;
        }
        String name = command.strip().split("\\s+", 2)[0];
        if (!allowedCommands.contains(name)) {
            log.warn("COMMAND_REJECTED | reason=not_allowed | command={}", name);
            return false;
        }
        for (int i = 0; i < command.length(); i++) {
            if (SHELL_METACHARACTERS.indexOf(command.charAt(i)) >= 0) {
                log.warn("COMMAND_REJECTED | reason=metacharacter | command={}", command);
                return false;
            }
        }
        return true;
    }

    private static Path canonicalize(String path) {
        return Paths.get(path).toAbsolutePath().normalize();
    }
}
