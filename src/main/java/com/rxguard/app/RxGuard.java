package com.rxguard.app;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.rxguard.app.canary.CanaryManager;
import com.rxguard.app.config.AppConfig;
import com.rxguard.app.snapshot.RestoreResult;
import com.rxguard.app.snapshot.Snapshot;
import com.rxguard.app.snapshot.SnapshotRepo;
import com.rxguard.app.snapshot.VerifyResult;
import com.rxguard.app.watcher.ActivityWatcher;

/**
 * Ponto de entrada para CLI/serviços: uma instância por repositório, sem estado global.
 */
public final class RxGuard implements Closeable {

    private final AppConfig config;
    private final SnapshotRepo repo;
    private final CanaryManager canary;
    private final ActivityWatcher watcher;

    private RxGuard(AppConfig config, SnapshotRepo repo, CanaryManager canary, ActivityWatcher watcher) {
        this.config = config;
        this.repo = repo;
        this.canary = canary;
        this.watcher = watcher;
    }

    /**
     * Abre (ou cria) o repositório descrito em {@code config}.
     *
     * @throws com.rxguard.app.crypto.KeyException se a chave mestra existente for inválida
     */
    public static RxGuard open(AppConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        SnapshotRepo repo = SnapshotRepo.init(config);
        CanaryManager canary = new CanaryManager(config);
        ActivityWatcher watcher = new ActivityWatcher(config, repo, canary);
        return new RxGuard(config, repo, canary, watcher);
    }

    public static RxGuard open() throws IOException {
        return open(AppConfig.load());
    }

    public AppConfig config() {
        return config;
    }

    public SnapshotRepo snapshots() {
        return repo;
    }

    public CanaryManager canary() {
        return canary;
    }

    public ActivityWatcher watcher() {
        return watcher;
    }

    public Snapshot createSnapshot(String label) throws IOException {
        return repo.createSnapshot(label);
    }

    public List<String> listSnapshots() throws IOException {
        return repo.listSnapshots();
    }

    public Snapshot loadSnapshot(String id) throws IOException {
        return repo.loadSnapshot(id);
    }

    public RestoreResult restore(String id, Path destDir, List<String> prefixFilter) throws IOException {
        return repo.restore(id, destDir, prefixFilter);
    }

    public VerifyResult verify(String id) {
        return repo.verify(id);
    }

    @Override
    public void close() {
        watcher.stop();
    }
}
