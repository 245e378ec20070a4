package com.rxguard.app.snapshot;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot imutável: id derivado do horário UTC, rótulo opcional e arquivos em ordem.
 */
public record Snapshot(String id, Instant createdAt, int version, String label, List<FileEntry> files) {

    public static final int CURRENT_VERSION = 1;

    public Snapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        files = (files == null) ? List.of() : List.copyOf(files);
    }

    public long totalBytes() {
        return files.stream().mapToLong(FileEntry::size).sum();
    }

    public long chunkReferences() {
        return files.stream().mapToLong(f -> f.chunks().size()).sum();
    }
}
