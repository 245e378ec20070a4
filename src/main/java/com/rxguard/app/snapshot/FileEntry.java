package com.rxguard.app.snapshot;

import java.util.List;
import java.util.Objects;

/**
 * Arquivo dentro de um snapshot. A concatenação dos chunks, na ordem, reconstrói o arquivo.
 */
public record FileEntry(String path, long size, long mtimeNs, List<String> chunks) {

    public FileEntry {
        Objects.requireNonNull(path, "path");
        chunks = (chunks == null) ? List.of() : List.copyOf(chunks);
    }
}
