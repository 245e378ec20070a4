package com.rxguard.app.config;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração do RxGuard.
 * Resolve o repositório, os diretórios vigiados e os parâmetros de detecção.
 * <p>
 * Ordem de prioridade: system property, variável de ambiente, arquivo .env,
 * application.conf e por fim reference.conf.
 */
public record AppConfig(
        Path repoDir,
        List<Path> dataDirs,
        int chunkSizeBytes,
        WatcherSettings watcher,
        CanarySettings canary
) {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final int DEFAULT_CHUNK_SIZE = 4 * 1024 * 1024;

    private static final String ROOT_PATH = "rxguard";

    // Variáveis de ambiente (ou .env)
    private static final String ENV_REPO_DIR = "RXGUARD_REPO_DIR";
    private static final String ENV_DATA_DIRS = "RXGUARD_DATA_DIRS";

    // System property overrides (useful for tests/CI)
    private static final String PROP_REPO_DIR = "rxguard.repo-dir";

    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    public AppConfig {
        Objects.requireNonNull(repoDir, "repoDir");
        Objects.requireNonNull(watcher, "watcher");
        Objects.requireNonNull(canary, "canary");
        repoDir = repoDir.toAbsolutePath().normalize();
        dataDirs = (dataDirs == null) ? List.of() : dataDirs.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .toList();
        if (chunkSizeBytes <= 0) {
            throw new IllegalArgumentException("chunkSizeBytes deve ser positivo: " + chunkSizeBytes);
        }
    }

    public record WatcherSettings(
            int surgeThresholdPerMinute,
            double entropyThreshold,
            List<String> suspiciousExtensions,
            int batchSize,
            Duration pollTimeout,
            Duration cooldown,
            int entropySampleBytes,
            int entropyMaxSamples,
            int queueCapacity,
            Duration stopTimeout
    ) {
        public WatcherSettings {
            suspiciousExtensions = (suspiciousExtensions == null) ? List.of() : suspiciousExtensions.stream()
                    .map(AppConfig::normalizeExtension)
                    .toList();
            if (batchSize <= 0) throw new IllegalArgumentException("batchSize deve ser positivo");
            if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity deve ser positivo");
            Objects.requireNonNull(pollTimeout, "pollTimeout");
            Objects.requireNonNull(cooldown, "cooldown");
            Objects.requireNonNull(stopTimeout, "stopTimeout");
        }

        public static WatcherSettings defaults() {
            return new WatcherSettings(
                    200,
                    6.5,
                    List.of(".locked", ".crypt", ".crypto", ".encrypted", ".enc"),
                    100,
                    Duration.ofSeconds(1),
                    Duration.ofSeconds(5),
                    4096,
                    20,
                    10_000,
                    Duration.ofSeconds(5)
            );
        }

        public WatcherSettings withCooldown(Duration value) {
            return new WatcherSettings(surgeThresholdPerMinute, entropyThreshold, suspiciousExtensions, batchSize,
                    pollTimeout, value, entropySampleBytes, entropyMaxSamples, queueCapacity, stopTimeout);
        }

        public WatcherSettings withPollTimeout(Duration value) {
            return new WatcherSettings(surgeThresholdPerMinute, entropyThreshold, suspiciousExtensions, batchSize,
                    value, cooldown, entropySampleBytes, entropyMaxSamples, queueCapacity, stopTimeout);
        }

        public WatcherSettings withQueueCapacity(int value) {
            return new WatcherSettings(surgeThresholdPerMinute, entropyThreshold, suspiciousExtensions, batchSize,
                    pollTimeout, cooldown, entropySampleBytes, entropyMaxSamples, value, stopTimeout);
        }
    }

    public record CanarySettings(int perDirectory, int sizeBytes, List<String> extensions) {
        public CanarySettings {
            extensions = (extensions == null || extensions.isEmpty())
                    ? List.of(".txt")
                    : extensions.stream().map(AppConfig::normalizeExtension).toList();
            if (sizeBytes <= 0) throw new IllegalArgumentException("sizeBytes deve ser positivo");
        }

        public static CanarySettings defaults() {
            return new CanarySettings(3, 2048, List.of(".xlsx", ".pdf", ".dcm", ".docx", ".txt"));
        }
    }

    /**
     * Configuração padrão sem arquivo nenhum (testes, uso embarcado).
     */
    public static AppConfig defaults(Path repoDir, List<Path> dataDirs) {
        return new AppConfig(repoDir, dataDirs, DEFAULT_CHUNK_SIZE, WatcherSettings.defaults(), CanarySettings.defaults());
    }

    /**
     * Carrega application.conf / reference.conf do classpath e aplica os overrides.
     */
    public static AppConfig load() {
        return load(ConfigFactory.load());
    }

    public static AppConfig load(Config root) {
        Config c = root.getConfig(ROOT_PATH);

        String repoDir = resolve(ENV_REPO_DIR, PROP_REPO_DIR);
        if (repoDir == null) repoDir = c.getString("repo-dir");

        List<Path> dataDirs = new ArrayList<>();
        String dataDirsOverride = resolve(ENV_DATA_DIRS, null);
        if (dataDirsOverride != null) {
            for (String part : StringUtils.split(dataDirsOverride, File.pathSeparator)) {
                if (StringUtils.isNotBlank(part)) dataDirs.add(Paths.get(part.trim()));
            }
        } else {
            for (String d : c.getStringList("data-dirs")) {
                dataDirs.add(Paths.get(d));
            }
        }

        Config w = c.getConfig("watcher");
        WatcherSettings watcher = new WatcherSettings(
                w.getInt("surge-threshold-per-minute"),
                w.getDouble("entropy-threshold"),
                w.getStringList("suspicious-extensions"),
                w.getInt("batch-size"),
                w.getDuration("poll-timeout"),
                w.getDuration("cooldown"),
                w.getInt("entropy-sample-bytes"),
                w.getInt("entropy-max-samples"),
                w.getInt("queue-capacity"),
                w.getDuration("stop-timeout")
        );

        Config k = c.getConfig("canary");
        CanarySettings canary = new CanarySettings(
                k.getInt("per-directory"),
                k.getInt("size-bytes"),
                k.getStringList("extensions")
        );

        AppConfig cfg = new AppConfig(Paths.get(repoDir), dataDirs, c.getInt("chunk-size-bytes"), watcher, canary);
        logger.info("Repositório RxGuard em: {} ({} diretório(s) vigiado(s))", cfg.repoDir(), cfg.dataDirs().size());
        return cfg;
    }

    public AppConfig withDataDirs(List<Path> dirs) {
        return new AppConfig(repoDir, dirs, chunkSizeBytes, watcher, canary);
    }

    public AppConfig withChunkSize(int bytes) {
        return new AppConfig(repoDir, dataDirs, bytes, watcher, canary);
    }

    public AppConfig withWatcher(WatcherSettings settings) {
        return new AppConfig(repoDir, dataDirs, chunkSizeBytes, settings, canary);
    }

    // --- Layout do repositório ---

    public Path keyFile() {
        return repoDir.resolve("keys").resolve("master.key");
    }

    public Path manifestDir() {
        return repoDir.resolve("manifests");
    }

    public Path chunksDir() {
        return repoDir.resolve("chunks");
    }

    public Path canaryDir() {
        return repoDir.resolve("canaries");
    }

    /**
     * Raiz comum dos diretórios vigiados; base dos caminhos relativos no restore.
     */
    public Path commonRoot() {
        if (dataDirs.isEmpty()) {
            throw new IllegalStateException("Nenhum diretório vigiado configurado");
        }
        Path common = dataDirs.get(0);
        for (Path p : dataDirs.subList(1, dataDirs.size())) {
            while (common != null && !p.startsWith(common)) {
                common = common.getParent();
            }
        }
        if (common == null) {
            throw new IllegalStateException("Diretórios vigiados sem raiz comum: " + dataDirs);
        }
        return common;
    }

    // --- Lógica de Resolução ---

    private static String resolve(String envKey, String propKey) {
        // 0. System property (tests/CI)
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (StringUtils.isNotBlank(propVal)) return propVal.trim();
        }

        // 1. Variável de ambiente do SO
        String envVal = System.getenv(envKey);
        if (StringUtils.isNotBlank(envVal)) return envVal.trim();

        // 2. Arquivo .env
        String fileVal = dotenv.get(envKey);
        return StringUtils.isBlank(fileVal) ? null : fileVal.trim();
    }

    static String normalizeExtension(String ext) {
        String e = StringUtils.trimToEmpty(ext).toLowerCase(Locale.ROOT);
        if (e.isEmpty()) return e;
        return e.startsWith(".") ? e : "." + e;
    }
}
