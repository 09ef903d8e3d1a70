package com.logtail.core.models;

import lombok.Value;

/**
 * One element of a tail stream: either literal file content or a sentinel describing a condition of the stream
 * itself. Sentinels render as {@code [KIND] text}. Every sentinel except the truncation notice ends the stream.
 */
@Value
public class LineRecord {
    public static final String NOT_FOUND = "File not found or configured incorrectly.";
    public static final String TRUNCATED = "File truncated. Reloading...";
    public static final String DISAPPEARED = "File disappeared.";

    Kind kind;
    String text;
    boolean terminal;

    public static LineRecord line(String text) {
        return new LineRecord(Kind.LINE, text, false);
    }

    public static LineRecord truncated() {
        return new LineRecord(Kind.SYSTEM, TRUNCATED, false);
    }

    public static LineRecord system(String text) {
        return new LineRecord(Kind.SYSTEM, text, true);
    }

    public static LineRecord error(String text) {
        return new LineRecord(Kind.ERROR, text, true);
    }

    public static LineRecord security(String text) {
        return new LineRecord(Kind.SECURITY, text, true);
    }

    public boolean isSentinel() {
        return kind != Kind.LINE;
    }

    public String render() {
        return kind == Kind.LINE ? text : kind.prefix() + " " + text;
    }

    public enum Kind {
        LINE,
        SYSTEM,
        ERROR,
        SECURITY;

        public String prefix() {
            return "[" + name() + "]";
        }
    }
}
