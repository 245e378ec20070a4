package com.rxguard.app.crypto;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chave mestra de 32 bytes. Gerada uma única vez, persistida com permissão
 * somente do dono e mantida imutável enquanto a instância viver.
 */
public final class MasterKey {

    public static final int LENGTH = 32;

    private static final Logger logger = LoggerFactory.getLogger(MasterKey.class);
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final byte[] bytes;

    private MasterKey(byte[] bytes) {
        this.bytes = bytes;
    }

    public static MasterKey of(byte[] raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.length != LENGTH) {
            throw new KeyException("Tamanho de chave mestra inválido: " + raw.length + " (esperado " + LENGTH + ")");
        }
        return new MasterKey(raw.clone());
    }

    public static MasterKey generate() {
        byte[] raw = new byte[LENGTH];
        new SecureRandom().nextBytes(raw);
        return new MasterKey(raw);
    }

    /**
     * Lê a chave de {@code keyFile}; se não existir, gera e grava uma nova.
     *
     * @throws KeyException se o arquivo existir com tamanho diferente de 32 bytes ou não puder ser lido/gravado
     */
    public static MasterKey loadOrCreate(Path keyFile) {
        Objects.requireNonNull(keyFile, "keyFile");
        if (Files.exists(keyFile)) {
            byte[] raw;
            try {
                raw = Files.readAllBytes(keyFile);
            } catch (IOException e) {
                throw new KeyException("Não foi possível ler a chave mestra: " + keyFile, e);
            }
            if (raw.length != LENGTH) {
                throw new KeyException("Chave mestra corrompida em " + keyFile + ": " + raw.length + " bytes");
            }
            return new MasterKey(raw);
        }

        MasterKey key = generate();
        try {
            writeOwnerOnly(keyFile, key.bytes);
        } catch (IOException e) {
            throw new KeyException("Não foi possível gravar a chave mestra: " + keyFile, e);
        }
        logger.info("Nova chave mestra gerada em {}", keyFile.toAbsolutePath());
        return key;
    }

    // Grava em arquivo temporário e move: uma queda no meio nunca deixa chave truncada no lugar.
    private static void writeOwnerOnly(Path keyFile, byte[] data) throws IOException {
        Path target = keyFile.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);

        Path temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        boolean posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        try {
            if (posix) {
                Files.createFile(temp, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            } else {
                Files.createFile(temp);
                java.io.File f = temp.toFile();
                boolean ok = f.setReadable(false, false) && f.setReadable(true, true)
                        && f.setWritable(false, false) && f.setWritable(true, true);
                if (!ok) logger.warn("Não foi possível restringir permissões da chave mestra: {}", keyFile);
            }
            try (OutputStream out = Files.newOutputStream(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                out.write(data);
            }
            if (posix) {
                // umask pode ter cortado bits na criação
                Files.setPosixFilePermissions(temp, OWNER_ONLY);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Cópia dos bytes da chave.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    @Override
    public String toString() {
        return "MasterKey[****]";
    }
}
