package com.deployguard.storage.impl;

import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.StorageFailureException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;

/**
 * One NDJSON file per stream under a root directory ({@code audit/chain-1} maps to
 * {@code <root>/audit/chain-1.ndjson}). Each append is forced to disk before returning.
 */
@Slf4j
public class FileSystemAppendOnlyStore implements AppendOnlyStore {

    private static final String SUFFIX = ".ndjson";

    private final Path root;
    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();
    // line count per stream, known since the last successful append or first count
    private final ConcurrentMap<String, Long> counts = new ConcurrentHashMap<>();

    public FileSystemAppendOnlyStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("File system append-only store at {}", this.root);
    }

    /** File backing {@code streamId}. */
    public Path fileOf(String streamId) {
        Path p = root.resolve(streamId + SUFFIX).normalize();
        if (!p.startsWith(root)) {
            throw new IllegalArgumentException("stream id escapes store root: " + streamId);
        }
        return p;
    }

    @Override
    public long append(String streamId, String payload) {
        if (payload.indexOf('\n') >= 0 || payload.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("payload must be a single line");
        }
        Path file = fileOf(streamId);
        synchronized (lockFor(streamId)) {
            try {
                Files.createDirectories(file.getParent());
                Long known = counts.get(streamId);
                long ordinal = known != null ? known : (Files.exists(file) ? countLines(file) : 0L);
                byte[] line = (payload + "\n").getBytes(StandardCharsets.UTF_8);
                try (FileChannel ch = FileChannel.open(file,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    ByteBuffer buf = ByteBuffer.wrap(line);
                    while (buf.hasRemaining()) ch.write(buf);
                    ch.force(true);
                }
                counts.put(streamId, ordinal + 1);
                return ordinal;
            } catch (IOException e) {
                counts.remove(streamId);
                throw new StorageFailureException(streamId, "append failed", e);
            }
        }
    }

    @Override
    public List<String> readAll(String streamId) {
        Path file = fileOf(streamId);
        synchronized (lockFor(streamId)) {
            if (!Files.exists(file)) return List.of();
            try {
                return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                        .filter(l -> !l.isEmpty())
                        .toList();
            } catch (IOException e) {
                throw new StorageFailureException(streamId, "read failed", e);
            }
        }
    }

    @Override
    public List<String> streams(String prefix) {
        if (!Files.isDirectory(root)) return List.of();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .filter(s -> s.endsWith(SUFFIX))
                    .map(s -> s.substring(0, s.length() - SUFFIX.length()))
                    .filter(s -> prefix == null || s.startsWith(prefix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageFailureException(prefix, "listing failed", e);
        }
    }

    private Object lockFor(String streamId) {
        return locks.computeIfAbsent(streamId, k -> new Object());
    }

    private static long countLines(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.filter(l -> !l.isEmpty()).count();
        }
    }
}
