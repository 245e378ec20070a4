package com.rxguard.app.blob;

import java.nio.file.NoSuchFileException;

/**
 * Chunk ou snapshot inexistente no cofre.
 */
public class NotFoundException extends NoSuchFileException {

    public NotFoundException(String file, String reason) {
        super(file, null, reason);
    }
}
