package com.rxguard.app.watcher;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rxguard.app.canary.CanaryManager;
import com.rxguard.app.config.AppConfig;
import com.rxguard.app.snapshot.Snapshot;
import com.rxguard.app.snapshot.SnapshotRepo;

/**
 * Laço de detecção e resposta.
 * <p>
 * Um único consumidor drena a fila limitada alimentada pelo {@link WatchSource}.
 * Fila cheia descarta o evento mais antigo (o produtor nunca bloqueia). Em
 * alerta, tira um snapshot "auto-alert" de forma síncrona e espera o cooldown;
 * os eventos continuam acumulando na fila nesse meio tempo.
 * <p>
 * Instância de uso único: depois de {@link #stop()} não reinicia.
 */
public final class ActivityWatcher implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ActivityWatcher.class);

    public static final String ALERT_LABEL = "auto-alert";

    private final AppConfig config;
    private final AppConfig.WatcherSettings settings;
    private final SnapshotRepo repo;
    private final Detector detector;
    private final Clock clock;

    private final ArrayBlockingQueue<FsChange> queue;
    private final Object lifecycle = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong alerts = new AtomicLong();

    private volatile WatchSource source;
    private volatile ExecutorService ioLoop;

    public ActivityWatcher(AppConfig config, SnapshotRepo repo, CanaryManager canary) {
        this(config, repo, canary, Clock.systemUTC());
    }

    public ActivityWatcher(AppConfig config, SnapshotRepo repo, CanaryManager canary, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.settings = config.watcher();
        this.repo = Objects.requireNonNull(repo, "repo");
        this.detector = new Detector(settings, Objects.requireNonNull(canary, "canary"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    }

    /**
     * Registra os diretórios vigiados e inicia a thread produtora.
     *
     * @throws IllegalStateException se o watcher já foi parado
     */
    public void start() throws IOException {
        if (!launch()) {
            throw new IllegalStateException("Watcher já foi parado");
        }
    }

    /**
     * @return {@code false} se {@link #stop()} veio antes ou durante o registro dos diretórios
     */
    private boolean launch() throws IOException {
        synchronized (lifecycle) {
            if (isStopped()) return false;
            if (!started.compareAndSet(false, true)) return true;
        }

        // Registro recursivo fora do lock.
        WatchSource ws = new WatchSource(config.dataDirs(), config.repoDir(), this::enqueue);
        try {
            ws.start();
        } catch (IOException e) {
            try {
                ws.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            synchronized (lifecycle) {
                started.set(false);
            }
            throw e;
        }

        synchronized (lifecycle) {
            if (isStopped()) {
                ws.close();
                logger.info("Watcher parado durante a inicialização");
                return false;
            }
            this.source = ws;
            this.ioLoop = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "rxguard-watch-io");
                t.setDaemon(true);
                return t;
            });
            ioLoop.submit(ws::loop);
            running.set(true);
        }
        logger.info("Watcher iniciado para {} diretório(s)", config.dataDirs().size());
        return true;
    }

    /**
     * Bloqueia até {@link #stop()}. Exceções de um ciclo são registradas e o laço segue.
     */
    public void run() {
        try {
            if (!launch()) return;
        } catch (IOException e) {
            throw new UncheckedIOException("Falha ao iniciar o watcher", e);
        }
        try {
            while (running.get() && !isStopped()) {
                try {
                    runCycle();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.info("Watcher interrompido");
                    break;
                } catch (RuntimeException e) {
                    logger.error("Falha no ciclo de detecção", e);
                }
            }
        } finally {
            stop();
        }
    }

    /**
     * Um ciclo: drena até {@code batchSize} eventos, detecta e responde.
     *
     * @return resultado da detecção, ou {@code null} se nenhum evento chegou
     */
    public DetectionResult runCycle() throws InterruptedException {
        List<FsChange> batch = drain();
        if (batch.isEmpty()) return null;

        DetectionResult result = detector.detect(batch, clock.instant());
        if (result.isAlert()) {
            respond(result);
        }
        return result;
    }

    private List<FsChange> drain() throws InterruptedException {
        FsChange first = queue.poll(settings.pollTimeout().toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) return List.of();
        List<FsChange> batch = new ArrayList<>(settings.batchSize());
        batch.add(first);
        queue.drainTo(batch, settings.batchSize() - 1);

        long overflows = batch.stream().filter(e -> e.kind() == FsChange.Kind.OVERFLOW).count();
        if (overflows > 0) {
            logger.warn("WatchService perdeu eventos (overflow x{})", overflows);
        }
        return batch;
    }

    private void respond(DetectionResult result) throws InterruptedException {
        alerts.incrementAndGet();
        logger.warn("Atividade suspeita detectada: {}", result.firedSignals());
        try {
            Snapshot snap = repo.createSnapshot(ALERT_LABEL);
            logger.warn("Snapshot de contenção {} criado ({} arquivos)", snap.id(), snap.files().size());
        } catch (IOException | RuntimeException e) {
            logger.error("Snapshot de contenção falhou", e);
        }
        // Cooldown; stop() encerra a espera antes do prazo.
        if (stopSignal.await(settings.cooldown().toMillis(), TimeUnit.MILLISECONDS)) {
            logger.debug("Cooldown interrompido por stop()");
        }
    }

    /**
     * Enfileira um evento. Fila cheia: descarta o mais antigo.
     */
    void enqueue(FsChange ev) {
        if (ev == null) return;
        while (!queue.offer(ev)) {
            if (queue.poll() != null) dropped.incrementAndGet();
        }
    }

    /**
     * Para o laço e o produtor. A thread produtora tem {@code stopTimeout} para terminar.
     * Pode ser chamado de qualquer thread, inclusive durante {@link #start()}.
     */
    public void stop() {
        WatchSource ws;
        ExecutorService loop;
        synchronized (lifecycle) {
            running.set(false);
            stopSignal.countDown();
            ws = source;
            source = null;
            loop = ioLoop;
            ioLoop = null;
        }

        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                logger.warn("Falha ao fechar WatchService: {}", e.toString());
            }
        }

        if (loop != null) {
            loop.shutdownNow();
            try {
                if (!loop.awaitTermination(settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Thread do WatchService não terminou em {}", settings.stopTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            logger.info("Watcher parado (alertas={}, eventos descartados={})", alerts.get(), dropped.get());
        }
    }

    private boolean isStopped() {
        return stopSignal.getCount() == 0;
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public long droppedEvents() {
        return dropped.get();
    }

    public long alerts() {
        return alerts.get();
    }

    public int pendingEvents() {
        return queue.size();
    }

    Detector detector() {
        return detector;
    }
}
