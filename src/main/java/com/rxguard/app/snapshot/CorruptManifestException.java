package com.rxguard.app.snapshot;

import java.io.IOException;

/**
 * Manifesto ilegível ou com estrutura inválida.
 */
public class CorruptManifestException extends IOException {

    public CorruptManifestException(String message) {
        super(message);
    }

    public CorruptManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
