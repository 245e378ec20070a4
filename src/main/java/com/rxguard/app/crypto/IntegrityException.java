package com.rxguard.app.crypto;

import java.io.IOException;

/**
 * Tag AEAD não confere: chunk adulterado, chave errada ou hash trocado.
 */
public class IntegrityException extends IOException {

    private final String chunkHash;

    public IntegrityException(String chunkHash, Throwable cause) {
        super("Falha de integridade no chunk " + chunkHash, cause);
        this.chunkHash = chunkHash;
    }

    public String chunkHash() {
        return chunkHash;
    }
}
