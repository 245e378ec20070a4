package com.rxguard.app.snapshot;

import java.util.List;

/**
 * Resultado agregado de um restore; cada arquivo falha de forma independente.
 */
public record RestoreResult(String snapshotId, long filesRestored, long bytesRestored, List<Failure> failures) {

    public record Failure(String path, String reason) {}

    public RestoreResult {
        failures = (failures == null) ? List.of() : List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public RestoreResult throwIfFailed() throws PartialRestoreException {
        if (!failures.isEmpty()) {
            throw new PartialRestoreException(snapshotId, failures);
        }
        return this;
    }
}
