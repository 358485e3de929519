package com.dubbi.statetrace.trace.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 트레이스 파일 로더
 */
public class TraceDocumentReader {
    private static final Logger log = LoggerFactory.getLogger(TraceDocumentReader.class);

    /**
     * @return 파일이 없으면 empty (경고 로그만 남김)
     * @throws TraceReadException 파일은 있지만 읽을 수 없을 때
     */
    public static Optional<TraceDocument> read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("[Trace] Trace file not found at {}", path);
            return Optional.empty();
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.debug("[Trace] Loaded {} ({} chars)", path, content.length());
            return Optional.of(TraceDocument.of(content));
        } catch (IOException e) {
            throw new TraceReadException(path, e);
        }
    }
}
