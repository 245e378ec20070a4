package com.rxguard.app.snapshot;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rxguard.app.blob.ChunkStore;
import com.rxguard.app.config.AppConfig;
import com.rxguard.app.crypto.ChunkCodec;
import com.rxguard.app.crypto.EncryptedChunk;
import com.rxguard.app.crypto.MasterKey;

/**
 * Varre os diretórios vigiados, grava os arquivos em chunks criptografados e
 * mantém os manifestos de snapshot (criação, listagem, restore e verificação).
 */
public final class SnapshotRepo {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotRepo.class);

    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final int PROGRESS_EVERY = 100;

    private final AppConfig config;
    private final ChunkCodec codec;
    private final ChunkStore store;
    private final ManifestStore manifests;
    private final Clock clock;

    public SnapshotRepo(AppConfig config, ChunkCodec codec, ChunkStore store, ManifestStore manifests) {
        this(config, codec, store, manifests, Clock.systemUTC());
    }

    public SnapshotRepo(AppConfig config, ChunkCodec codec, ChunkStore store, ManifestStore manifests, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.store = Objects.requireNonNull(store, "store");
        this.manifests = Objects.requireNonNull(manifests, "manifests");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Cria a estrutura do repositório (chaves, chunks, manifestos, canários) e
     * carrega ou gera a chave mestra.
     *
     * @throws com.rxguard.app.crypto.KeyException se a chave existente for inválida
     */
    public static SnapshotRepo init(AppConfig config) throws IOException {
        Files.createDirectories(config.repoDir());
        Files.createDirectories(config.chunksDir());
        Files.createDirectories(config.manifestDir());
        Files.createDirectories(config.canaryDir());
        MasterKey key = MasterKey.loadOrCreate(config.keyFile());
        logger.info("Repositório inicializado em {}", config.repoDir());
        return new SnapshotRepo(config, new ChunkCodec(key), new ChunkStore(config.chunksDir()),
                new ManifestStore(config.manifestDir()));
    }

    public ChunkStore store() {
        return store;
    }

    public ManifestStore manifests() {
        return manifests;
    }

    /**
     * Todos os arquivos regulares dos diretórios vigiados, exceto os que ficam
     * dentro do próprio repositório.
     */
    public List<Path> scan() {
        Path repoDir = config.repoDir();
        List<Path> files = new ArrayList<>();
        for (Path root : config.dataDirs()) {
            if (!Files.isDirectory(root)) {
                logger.warn("Diretório vigiado inexistente, ignorado: {}", root);
                continue;
            }
            try {
                Files.walkFileTree(root, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        return dir.startsWith(repoDir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && !file.startsWith(repoDir)) {
                            files.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        logger.warn("Falha ao ler durante a varredura: {} ({})", file, exc.toString());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                logger.warn("Falha ao varrer {}", root, e);
            }
        }
        return files;
    }

    public Snapshot createSnapshot(String label) throws IOException {
        return createSnapshot(label, s -> { });
    }

    /**
     * Grava todos os arquivos encontrados por {@link #scan()} e persiste o manifesto.
     * Erros de I/O em um arquivo descartam só aquele arquivo.
     */
    public Snapshot createSnapshot(String label, Consumer<String> progress) throws IOException {
        Objects.requireNonNull(progress, "progress");
        Files.createDirectories(config.manifestDir());

        List<Path> files = scan();
        progress.accept(">> Snapshot: " + files.size() + " arquivo(s) encontrados");

        List<FileEntry> entries = new ArrayList<>(files.size());
        byte[] window = new byte[config.chunkSizeBytes()];
        long skipped = 0;
        long newChunks = 0;
        int done = 0;

        for (Path file : files) {
            try {
                ChunkedFile cf = storeFile(file, window);
                entries.add(cf.entry());
                newChunks += cf.newChunks();
            } catch (IOException e) {
                skipped++;
                logger.warn("Arquivo ignorado no snapshot: {} ({})", file, e.toString());
            }
            done++;
            if (done % PROGRESS_EVERY == 0) {
                progress.accept(">> Snapshot: " + done + "/" + files.size());
            }
        }

        Instant now = clock.instant();
        String id = manifests.nextFreeId(ID_FORMAT.format(now));
        Snapshot snapshot = new Snapshot(id, now.truncatedTo(ChronoUnit.MICROS), Snapshot.CURRENT_VERSION, label, entries);
        manifests.save(snapshot);

        logger.info("Snapshot {} criado: arquivos={}, ignorados={}, chunks novos={}, label={}",
                id, entries.size(), skipped, newChunks, label);
        progress.accept(">> Snapshot: finalizado " + id + " (arquivos=" + entries.size() + ", ignorados=" + skipped + ")");
        return snapshot;
    }

    private record ChunkedFile(FileEntry entry, long newChunks) {}

    private ChunkedFile storeFile(Path file, byte[] window) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        long mtimeNs = attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS);

        List<String> chunks = new ArrayList<>();
        long size = 0;
        long written = 0;
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.readNBytes(window, 0, window.length)) > 0) {
                EncryptedChunk chunk = codec.encryptChunk(window, 0, n);
                if (!store.hasChunk(chunk.hash()) && store.storeChunk(chunk.hash(), chunk.ciphertext())) {
                    written++;
                }
                chunks.add(chunk.hash());
                size += n;
            }
        }
        return new ChunkedFile(new FileEntry(file.toString(), size, mtimeNs, chunks), written);
    }

    public List<String> listSnapshots() throws IOException {
        return manifests.list();
    }

    /**
     * @throws com.rxguard.app.blob.NotFoundException se o id não existir
     * @throws CorruptManifestException se o manifesto for inválido
     */
    public Snapshot loadSnapshot(String id) throws IOException {
        return manifests.load(id);
    }

    public RestoreResult restore(String id, Path destDir) throws IOException {
        return restore(id, destDir, null, s -> { });
    }

    public RestoreResult restore(String id, Path destDir, List<String> prefixFilter) throws IOException {
        return restore(id, destDir, prefixFilter, s -> { });
    }

    /**
     * Restaura os arquivos do snapshot sob {@code destDir}, mantendo o caminho
     * relativo à raiz comum dos diretórios vigiados. Cada arquivo falha de
     * forma independente; as falhas voltam agregadas no resultado.
     *
     * @param prefixFilter prefixos de caminho original; nulo ou vazio restaura tudo
     */
    public RestoreResult restore(String id, Path destDir, List<String> prefixFilter, Consumer<String> progress)
            throws IOException {
        Objects.requireNonNull(destDir, "destDir");
        Snapshot snapshot = manifests.load(id);
        Path dest = destDir.toAbsolutePath().normalize();
        Files.createDirectories(dest);
        Path commonRoot = config.commonRoot();

        List<String> prefixes = (prefixFilter == null) ? List.of() : prefixFilter.stream()
                .filter(p -> p != null && !p.isBlank())
                .toList();

        progress.accept(">> Restore: snapshot=" + id + ", destino=" + dest);

        long restored = 0;
        long bytes = 0;
        List<RestoreResult.Failure> failures = new ArrayList<>();

        for (FileEntry fe : snapshot.files()) {
            if (!prefixes.isEmpty() && prefixes.stream().noneMatch(fe.path()::startsWith)) continue;

            Path out;
            try {
                out = resolveOutputPath(fe, commonRoot, dest);
            } catch (IOException e) {
                failures.add(new RestoreResult.Failure(fe.path(), e.getMessage()));
                logger.warn("Restore: caminho rejeitado {} ({})", fe.path(), e.getMessage());
                continue;
            }

            try {
                bytes += restoreFile(fe, out);
                restored++;
            } catch (IOException | RuntimeException e) {
                failures.add(new RestoreResult.Failure(fe.path(), e.getClass().getSimpleName() + ": " + e.getMessage()));
                logger.warn("Restore: erro em {} ({})", fe.path(), e.toString());
                try {
                    Files.deleteIfExists(out);
                } catch (IOException cleanup) {
                    logger.debug("Restore: não foi possível remover arquivo parcial {}", out, cleanup);
                }
            }
        }

        progress.accept(">> Restore: finalizado. arquivos=" + restored + ", erros=" + failures.size());
        logger.info("Restore {} -> {}: arquivos={}, erros={}", id, dest, restored, failures.size());
        return new RestoreResult(id, restored, bytes, failures);
    }

    private long restoreFile(FileEntry fe, Path out) throws IOException {
        Path parent = out.getParent();
        if (parent != null) Files.createDirectories(parent);

        long written = 0;
        try (OutputStream os = Files.newOutputStream(out)) {
            for (String hash : fe.chunks()) {
                byte[] plain = codec.decryptChunk(hash, store.loadChunk(hash));
                os.write(plain);
                written += plain.length;
            }
        }
        try {
            Files.setLastModifiedTime(out, FileTime.from(fe.mtimeNs(), TimeUnit.NANOSECONDS));
        } catch (IOException e) {
            logger.debug("Restore: mtime não aplicado em {}", out, e);
        }
        return written;
    }

    private static Path resolveOutputPath(FileEntry fe, Path commonRoot, Path dest) throws IOException {
        Path original = Path.of(fe.path()).toAbsolutePath().normalize();
        if (!original.startsWith(commonRoot)) {
            throw new IOException("fora da raiz comum " + commonRoot);
        }
        Path rel = commonRoot.relativize(original);
        Path out = dest.resolve(rel).normalize();
        if (!out.startsWith(dest) || out.equals(dest)) {
            throw new IOException("destino fora de " + dest);
        }
        return out;
    }

    /**
     * Conta arquivos e referências a chunks ausentes em um snapshot, ou em todos
     * quando {@code id} é nulo. Nunca lança exceção.
     */
    public VerifyResult verify(String id) {
        List<String> ids;
        if (id != null) {
            ids = List.of(id);
        } else {
            try {
                ids = manifests.list();
            } catch (IOException e) {
                logger.warn("Verify: não foi possível listar manifestos", e);
                return new VerifyResult(0, 0, List.of());
            }
        }

        long files = 0;
        long missing = 0;
        List<String> unreadable = new ArrayList<>();
        for (String sid : ids) {
            Snapshot snap;
            try {
                snap = manifests.load(sid);
            } catch (IOException | RuntimeException e) {
                unreadable.add(sid);
                logger.warn("Verify: manifesto ilegível {} ({})", sid, e.toString());
                continue;
            }
            files += snap.files().size();
            for (FileEntry fe : snap.files()) {
                for (String hash : fe.chunks()) {
                    if (!isPresent(hash)) missing++;
                }
            }
        }

        if (missing > 0) {
            logger.warn("Verify: {} chunk(s) ausente(s) em {} arquivo(s)", missing, files);
        }
        return new VerifyResult(files, missing, unreadable);
    }

    public VerifyResult verify() {
        return verify(null);
    }

    private boolean isPresent(String hash) {
        try {
            return store.hasChunk(hash);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
