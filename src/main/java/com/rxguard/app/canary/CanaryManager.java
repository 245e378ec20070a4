package com.rxguard.app.canary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rxguard.app.config.AppConfig;
import com.rxguard.app.crypto.ChunkCodec;

/**
 * Implanta e confere arquivos isca (canários) nos diretórios vigiados.
 * Cada {@link #deploy} substitui por inteiro o conjunto anterior.
 */
public final class CanaryManager {

    private static final Logger logger = LoggerFactory.getLogger(CanaryManager.class);

    static final String META_FILE = "canaries.json";
    private static final String NAME_PREFIX = "canary-";
    private static final String NAME_CHARS = "abcdefghijklmnopqrstuvwxyz";
    private static final TypeReference<List<Canary>> CANARY_LIST = new TypeReference<>() {};

    private final AppConfig config;
    private final Path metaPath;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final SecureRandom rng = new SecureRandom();

    public CanaryManager(AppConfig config) throws IOException {
        this.config = Objects.requireNonNull(config, "config");
        Files.createDirectories(config.canaryDir());
        this.metaPath = config.canaryDir().resolve(META_FILE);
    }

    public Path metaPath() {
        return metaPath;
    }

    public List<Canary> deploy() throws IOException {
        return deploy(config.canary().perDirectory());
    }

    public List<Canary> deploy(int perDirectory) throws IOException {
        if (perDirectory < 0) throw new IllegalArgumentException("perDirectory negativo: " + perDirectory);
        List<String> extensions = config.canary().extensions();

        List<Canary> canaries = new ArrayList<>();
        for (Path dir : config.dataDirs()) {
            Files.createDirectories(dir);
            for (int i = 0; i < perDirectory; i++) {
                String ext = extensions.get(rng.nextInt(extensions.size()));
                Path path = freshName(dir, ext);
                byte[] content = new byte[config.canary().sizeBytes()];
                rng.nextBytes(content);
                Files.write(path, content);
                canaries.add(new Canary(path.toString(), ChunkCodec.computeHash(content)));
            }
        }
        saveMeta(canaries);
        logger.info("{} canário(s) implantado(s) em {} diretório(s)", canaries.size(), config.dataDirs().size());
        return canaries;
    }

    /**
     * Quantidade de canários ausentes, ilegíveis ou com conteúdo alterado.
     * Metadados existentes mas ilegíveis contam como uma adulteração: sem eles
     * não há como conferir os canários.
     */
    public int check() {
        List<Canary> list;
        try {
            list = canaries();
        } catch (IOException e) {
            logger.warn("Metadados de canários ilegíveis, tratado como adulteração: {} ({})", metaPath, e.toString());
            return 1;
        }
        int tampered = 0;
        for (Canary c : list) {
            if (isTampered(c)) tampered++;
        }
        if (tampered > 0) {
            logger.warn("{} canário(s) adulterado(s)", tampered);
        }
        return tampered;
    }

    /**
     * Canários implantados; lista vazia se nunca houve {@link #deploy}.
     *
     * @throws IOException se o arquivo de metadados existir mas não puder ser lido ou interpretado
     */
    public List<Canary> canaries() throws IOException {
        if (!Files.exists(metaPath)) return List.of();
        List<Canary> list = mapper.readValue(metaPath.toFile(), CANARY_LIST);
        if (list == null || list.contains(null)) {
            throw new IOException("Metadados de canários inválidos: " + metaPath);
        }
        return List.copyOf(list);
    }

    private static boolean isTampered(Canary c) {
        try {
            Path p = Path.of(c.path());
            if (!Files.isRegularFile(p)) return true;
            String current = ChunkCodec.computeHash(Files.readAllBytes(p));
            return !MessageDigest.isEqual(
                    current.getBytes(StandardCharsets.US_ASCII),
                    String.valueOf(c.hash()).getBytes(StandardCharsets.US_ASCII));
        } catch (IOException | RuntimeException e) {
            logger.debug("Canário ilegível conta como adulterado: {}", c.path(), e);
            return true;
        }
    }

    private Path freshName(Path dir, String ext) {
        while (true) {
            Path candidate = dir.resolve(NAME_PREFIX + RandomStringUtils.random(8, 0, 0, false, false, NAME_CHARS.toCharArray(), rng) + ext);
            if (!Files.exists(candidate)) return candidate;
        }
    }

    private void saveMeta(List<Canary> canaries) throws IOException {
        Path temp = metaPath.resolveSibling(META_FILE + ".tmp");
        mapper.writeValue(temp.toFile(), canaries);
        try {
            Files.move(temp, metaPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, metaPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
