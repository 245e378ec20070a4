package com.rxguard.app.crypto;

/**
 * Resultado de {@link ChunkCodec#encryptChunk}: hash do texto claro e o
 * ciphertext ChaCha20-Poly1305 (com a tag de 16 bytes no final).
 */
public record EncryptedChunk(String hash, byte[] ciphertext) {
}
