package com.rxguard.app.snapshot;

import java.util.List;

/**
 * Resultado de {@link SnapshotRepo#verify}. Só confere presença dos chunks, não decifra.
 *
 * @param unreadable ids cujo manifesto não pôde ser lido (contados como zero arquivos)
 */
public record VerifyResult(long fileCount, long missingChunkCount, List<String> unreadable) {

    public VerifyResult {
        unreadable = (unreadable == null) ? List.of() : List.copyOf(unreadable);
    }

    public boolean isIntact() {
        return missingChunkCount == 0 && unreadable.isEmpty();
    }
}
