package com.logtail.core.services;

import com.logtail.core.models.LineRecord;

import java.util.regex.Pattern;

/**
 * Line clean-up shared by local and remote tailing.
 */
public final class LogLines {

    // CSI sequences, plus bare "[31m" style codes whose ESC was lost upstream
    private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[0-?]*[ -/]*[@-~]|\\[[0-9;]+m");

    private LogLines() {
    }

    public static String stripAnsi(String text) {
        return ANSI_ESCAPE.matcher(text).replaceAll("");
    }

    /**
     * Strips colour codes and trailing whitespace from a raw line and emits it unless nothing is left.
     *
     * @return false if the consumer has detached
     */
    public static boolean emitLine(TailStream stream, String rawLine) {
        String clean = stripAnsi(rawLine).stripTrailing();
        if (clean.isBlank()) {
            return !stream.isCancelled();
        }
        return stream.emit(LineRecord.line(clean));
    }
}
