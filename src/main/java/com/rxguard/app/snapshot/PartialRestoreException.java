package com.rxguard.app.snapshot;

import java.io.IOException;
import java.util.List;

/**
 * Restore terminou com falhas em parte dos arquivos.
 */
public class PartialRestoreException extends IOException {

    private final transient List<RestoreResult.Failure> failures;

    public PartialRestoreException(String snapshotId, List<RestoreResult.Failure> failures) {
        super("Restore parcial do snapshot " + snapshotId + ": " + failures.size() + " arquivo(s) com erro");
        this.failures = List.copyOf(failures);
    }

    public List<RestoreResult.Failure> failures() {
        return failures;
    }
}
