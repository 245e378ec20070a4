package com.rxguard.app.blob;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Armazena chunks criptografados endereçados pelo hash do conteúdo.
 * <p>
 * Layout: {@code <root>/<hash[0:2]>/<hash>.bin}. Escrita única: gravar um hash
 * já existente não faz nada. Não há test-and-set entre {@link #hasChunk} e
 * {@link #storeChunk}; gravações concorrentes do mesmo hash produzem bytes
 * idênticos e o move atômico mantém o arquivo final sempre inteiro.
 */
public final class ChunkStore {

    private static final Logger logger = LoggerFactory.getLogger(ChunkStore.class);
    private static final String CHUNK_EXT = ".bin";
    private static final Pattern HASH = Pattern.compile("[0-9a-f]{2,128}");

    private final Path rootDir;

    public ChunkStore(Path rootDir) throws IOException {
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir").toAbsolutePath().normalize();
        Files.createDirectories(this.rootDir);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path chunkPath(String hash) {
        requireValidHash(hash);
        return rootDir.resolve(hash.substring(0, 2)).resolve(hash + CHUNK_EXT);
    }

    public boolean hasChunk(String hash) {
        return Files.isRegularFile(chunkPath(hash));
    }

    /**
     * Grava o chunk se ainda não existir.
     *
     * @return {@code true} se um arquivo novo foi escrito, {@code false} se já existia
     */
    public boolean storeChunk(String hash, byte[] ciphertext) throws IOException {
        Objects.requireNonNull(ciphertext, "ciphertext");
        Path target = chunkPath(hash);
        if (Files.exists(target)) {
            return false;
        }

        Files.createDirectories(target.getParent());
        Path tempFile = rootDir.resolve(hash + CHUNK_EXT + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tempFile, ciphertext);
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
        logger.debug("Chunk gravado: {} ({} bytes)", hash, ciphertext.length);
        return true;
    }

    /**
     * @throws NotFoundException se o chunk não existir no cofre
     */
    public byte[] loadChunk(String hash) throws IOException {
        Path path = chunkPath(hash);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new NotFoundException(path.toString(), "chunk ausente no cofre: " + hash);
        }
    }

    /**
     * Quantidade de chunks fisicamente presentes (diagnóstico).
     */
    public long chunkCount() throws IOException {
        try (Stream<Path> s = Files.walk(rootDir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(CHUNK_EXT))
                    .count();
        }
    }

    private static void requireValidHash(String hash) {
        if (hash == null || !HASH.matcher(hash).matches()) {
            throw new IllegalArgumentException("Hash de chunk inválido: " + hash);
        }
    }
}
