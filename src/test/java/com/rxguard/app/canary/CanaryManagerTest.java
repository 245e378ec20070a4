package com.rxguard.app.canary;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.rxguard.app.config.AppConfig;

import static org.junit.jupiter.api.Assertions.*;

public class CanaryManagerTest {

    private static AppConfig config(Path base, Path... dataDirs) {
        return AppConfig.defaults(base.resolve("repo"), List.of(dataDirs));
    }

    @Test
    void deploy_thenCheck_reportsNoTamper() throws Exception {
        Path base = Files.createTempDirectory("rxguard-canary-");
        Path a = Files.createDirectories(base.resolve("a"));
        Path b = Files.createDirectories(base.resolve("b"));
        CanaryManager mgr = new CanaryManager(config(base, a, b));

        List<Canary> deployed = mgr.deploy(2);

        assertEquals(4, deployed.size());
        for (Canary c : deployed) {
            Path p = Path.of(c.path());
            assertTrue(Files.isRegularFile(p));
            assertTrue(p.getFileName().toString().matches("canary-[a-z]{8}\\.[a-z]+"), p.toString());
            assertEquals(2048L, Files.size(p));
        }
        assertEquals(0, mgr.check());
        assertEquals(deployed, mgr.canaries());
    }

    @Test
    void check_countsModifiedAndDeletedCanaries() throws Exception {
        Path base = Files.createTempDirectory("rxguard-canary-");
        Path data = Files.createDirectories(base.resolve("data"));
        CanaryManager mgr = new CanaryManager(config(base, data));
        List<Canary> deployed = mgr.deploy(3);

        Files.writeString(Path.of(deployed.get(0).path()), "encrypted by someone", StandardCharsets.UTF_8);
        assertEquals(1, mgr.check());

        Files.delete(Path.of(deployed.get(1).path()));
        assertEquals(2, mgr.check());
    }

    @Test
    void redeploy_replacesPreviousSet() throws Exception {
        Path base = Files.createTempDirectory("rxguard-canary-");
        Path data = Files.createDirectories(base.resolve("data"));
        CanaryManager mgr = new CanaryManager(config(base, data));

        List<Canary> first = mgr.deploy(2);
        Files.delete(Path.of(first.get(0).path()));
        List<Canary> second = mgr.deploy(1);

        assertEquals(second, mgr.canaries());
        assertEquals(0, mgr.check(), "old canaries are no longer tracked");
    }

    @Test
    void check_withoutMetadata_isZero() throws Exception {
        Path base = Files.createTempDirectory("rxguard-canary-");
        CanaryManager mgr = new CanaryManager(config(base, Files.createDirectories(base.resolve("data"))));

        assertEquals(0, mgr.check());
        assertTrue(mgr.canaries().isEmpty());
    }

    @Test
    void check_scrambledMetadata_countsAsTamper() throws Exception {
        Path base = Files.createTempDirectory("rxguard-canary-");
        Path data = Files.createDirectories(base.resolve("data"));
        CanaryManager mgr = new CanaryManager(config(base, data));
        for (Canary c : mgr.deploy(3)) {
            Files.writeString(Path.of(c.path()), "cifrado", StandardCharsets.UTF_8);
        }
        byte[] meta = Files.readAllBytes(mgr.metaPath());
        for (int i = 0; i < meta.length; i++) meta[i] ^= 0x5A;
        Files.write(mgr.metaPath(), meta);

        assertTrue(mgr.check() >= 1);
        assertThrows(IOException.class, mgr::canaries);
    }

    @Test
    void check_metadataWithNullEntry_countsAsTamper() throws Exception {
        Path base = Files.createTempDirectory("rxguard-canary-");
        CanaryManager mgr = new CanaryManager(config(base, Files.createDirectories(base.resolve("data"))));
        Files.writeString(mgr.metaPath(), "[null]", StandardCharsets.UTF_8);

        assertEquals(1, mgr.check());
    }
}
