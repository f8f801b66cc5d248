package com.matey.anomaly.core.io;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Line log opened in append mode for the life of a run. Each line is written verbatim,
 * newline-terminated and flushed before {@link #append(String)} returns. Never read back.
 */
@Slf4j
public class AppendOnlyLog implements Closeable {

    private final Path path;
    private final BufferedWriter writer;
    private final AtomicLong lines = new AtomicLong();
    private boolean closed;

    private AppendOnlyLog(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    public static AppendOnlyLog open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        log.info("Appending to {}", path.toAbsolutePath());
        return new AppendOnlyLog(path, writer);
    }

    public synchronized void append(String line) throws IOException {
        if (closed) {
            throw new IOException("Log " + path + " is closed");
        }
        writer.write(line);
        writer.write('\n');
        writer.flush();
        lines.incrementAndGet();
    }

    public long getLinesWritten() {
        return lines.get();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.close();
        log.info("Closed {} after {} lines", path, lines.get());
    }
}
