package com.dubbi.statetrace.trace.parser;

import java.nio.file.Path;

/**
 * 존재하는 트레이스 파일을 읽는 중 I/O 오류
 */
public class TraceReadException extends RuntimeException {
    private final Path path;

    public TraceReadException(Path path, Throwable cause) {
        super("Failed to read trace file " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
