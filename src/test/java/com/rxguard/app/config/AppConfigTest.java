package com.rxguard.app.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import com.typesafe.config.ConfigFactory;

import static org.junit.jupiter.api.Assertions.*;

public class AppConfigTest {

    @Test
    void load_usesSystemPropertyForRepoDir() {
        AppConfig cfg = AppConfig.load();

        String prop = System.getProperty("rxguard.repo-dir");
        if (prop != null) {
            assertEquals(Path.of(prop).toAbsolutePath().normalize(), cfg.repoDir());
        }
        assertTrue(cfg.repoDir().isAbsolute());
        assertEquals(AppConfig.DEFAULT_CHUNK_SIZE, cfg.chunkSizeBytes());
    }

    @Test
    void referenceDefaults_matchBuiltInDefaults() {
        AppConfig cfg = AppConfig.load(ConfigFactory.defaultReference());

        assertEquals(AppConfig.WatcherSettings.defaults(), cfg.watcher());
        assertEquals(AppConfig.CanarySettings.defaults(), cfg.canary());
    }

    @Test
    void load_appliesConfigOverrides() {
        AppConfig cfg = AppConfig.load(ConfigFactory.parseString("""
                rxguard {
                  chunk-size-bytes = 1024
                  watcher.surge-threshold-per-minute = 50
                  watcher.cooldown = 250ms
                  watcher.suspicious-extensions = ["LOCKED", "wnry"]
                  canary.per-directory = 1
                }
                """).withFallback(ConfigFactory.defaultReference()));

        assertEquals(1024, cfg.chunkSizeBytes());
        assertEquals(50, cfg.watcher().surgeThresholdPerMinute());
        assertEquals(Duration.ofMillis(250), cfg.watcher().cooldown());
        assertEquals(List.of(".locked", ".wnry"), cfg.watcher().suspiciousExtensions());
        assertEquals(1, cfg.canary().perDirectory());
    }

    @Test
    void repositoryLayout_isUnderRepoDir() {
        AppConfig cfg = AppConfig.defaults(Path.of("/srv/rx"), List.of(Path.of("/dados")));

        assertEquals(Path.of("/srv/rx/keys/master.key"), cfg.keyFile());
        assertEquals(Path.of("/srv/rx/manifests"), cfg.manifestDir());
        assertEquals(Path.of("/srv/rx/chunks"), cfg.chunksDir());
        assertEquals(Path.of("/srv/rx/canaries"), cfg.canaryDir());
    }

    @Test
    void commonRoot_isDeepestSharedAncestor() {
        AppConfig cfg = AppConfig.defaults(Path.of("/srv/rx"),
                List.of(Path.of("/shares/clinica/a"), Path.of("/shares/clinica/b/c"), Path.of("/shares/clinica")));

        assertEquals(Path.of("/shares/clinica"), cfg.commonRoot());
        assertEquals(Path.of("/shares/x"),
                cfg.withDataDirs(List.of(Path.of("/shares/x"))).commonRoot());
        assertThrows(IllegalStateException.class, () -> cfg.withDataDirs(List.of()).commonRoot());
    }

    @Test
    void invalidValues_areRejected() {
        AppConfig cfg = AppConfig.defaults(Path.of("/srv/rx"), List.of());

        assertThrows(IllegalArgumentException.class, () -> cfg.withChunkSize(0));
        assertThrows(IllegalArgumentException.class, () -> cfg.watcher().withQueueCapacity(0));
    }

    @Test
    void normalizeExtension_addsDotAndLowercases() {
        assertEquals(".enc", AppConfig.normalizeExtension("ENC"));
        assertEquals(".enc", AppConfig.normalizeExtension(" .enc "));
        assertEquals("", AppConfig.normalizeExtension(null));
    }
}
