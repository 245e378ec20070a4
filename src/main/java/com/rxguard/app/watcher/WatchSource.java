package com.rxguard.app.watcher;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produtor de eventos via {@link WatchService}, recursivo sobre os diretórios vigiados.
 * Diretórios criados depois também são registrados. Exclusões são ignoradas e
 * não geram eventos; DELETE não é repassado.
 */
final class WatchSource implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(WatchSource.class);

    private final List<Path> roots;
    private final Path excluded;
    private final Consumer<FsChange> sink;

    private final WatchService watcher;
    private final Map<WatchKey, Path> keyToDir = new ConcurrentHashMap<>();
    private final AtomicBoolean alive = new AtomicBoolean(true);

    WatchSource(List<Path> roots, Path excluded, Consumer<FsChange> sink) throws IOException {
        this.roots = List.copyOf(roots);
        this.excluded = (excluded == null) ? null : excluded.toAbsolutePath().normalize();
        this.sink = Objects.requireNonNull(sink, "sink");
        this.watcher = FileSystems.getDefault().newWatchService();
    }

    void start() throws IOException {
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                logger.warn("Diretório vigiado inexistente, ignorado: {}", root);
                continue;
            }
            registerTree(root);
        }
        logger.debug("WatchService registrado em {} diretório(s)", keyToDir.size());
    }

    void loop() {
        while (alive.get()) {
            WatchKey key;
            try {
                key = watcher.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path dir = keyToDir.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }

            for (WatchEvent<?> ev : key.pollEvents()) {
                WatchEvent.Kind<?> k = ev.kind();

                if (k == OVERFLOW) {
                    sink.accept(new FsChange(FsChange.Kind.OVERFLOW, dir));
                    continue;
                }
                if (k == ENTRY_DELETE) continue;

                @SuppressWarnings("unchecked")
                WatchEvent<Path> pev = (WatchEvent<Path>) ev;
                Path full = dir.resolve(pev.context());
                if (isExcluded(full)) continue;

                if (Files.isDirectory(full, LinkOption.NOFOLLOW_LINKS)) {
                    if (k == ENTRY_CREATE) {
                        try {
                            registerTree(full);
                        } catch (IOException e) {
                            logger.warn("Falha ao registrar novo diretório {}: {}", full, e.toString());
                        }
                    }
                    continue;
                }

                FsChange.Kind outKind = (k == ENTRY_CREATE) ? FsChange.Kind.CREATE : FsChange.Kind.MODIFY;
                sink.accept(new FsChange(outKind, full));
            }

            boolean valid = key.reset();
            if (!valid) keyToDir.remove(key);
        }
    }

    private boolean isExcluded(Path p) {
        return excluded != null && p.toAbsolutePath().normalize().startsWith(excluded);
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (isExcluded(dir)) return FileVisitResult.SKIP_SUBTREE;
                registerDir(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("Não foi possível vigiar {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void registerDir(Path dir) throws IOException {
        WatchKey key = dir.register(watcher, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
        keyToDir.put(key, dir);
    }

    int registeredDirs() {
        return keyToDir.size();
    }

    @Override
    public void close() throws IOException {
        alive.set(false);
        watcher.close();
        keyToDir.clear();
    }
}
