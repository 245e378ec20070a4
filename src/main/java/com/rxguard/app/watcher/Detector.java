package com.rxguard.app.watcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rxguard.app.canary.CanaryManager;
import com.rxguard.app.config.AppConfig;

/**
 * Heurísticas de detecção: pico de eventos, entropia alta, extensão suspeita e canário adulterado.
 */
public final class Detector {

    private static final Logger logger = LoggerFactory.getLogger(Detector.class);

    private final AppConfig.WatcherSettings settings;
    private final CanaryManager canary;
    private final SurgeWindow window;
    private final Set<String> suspicious;

    public Detector(AppConfig.WatcherSettings settings, CanaryManager canary) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.canary = Objects.requireNonNull(canary, "canary");
        this.window = new SurgeWindow(settings.surgeThresholdPerMinute());
        this.suspicious = Set.copyOf(settings.suspiciousExtensions());
    }

    public DetectionResult detect(List<FsChange> events, Instant now) {
        window.record(now, events.size());
        boolean surge = window.isSurge(now);

        Set<Path> paths = new LinkedHashSet<>();
        for (FsChange ev : events) {
            if (ev.kind() != FsChange.Kind.OVERFLOW && ev.path() != null) paths.add(ev.path());
        }

        boolean suspiciousExt = false;
        for (Path p : paths) {
            if (isSuspicious(p)) {
                suspiciousExt = true;
                break;
            }
        }

        boolean highEntropy = false;
        int sampled = 0;
        for (Path p : paths) {
            if (sampled >= settings.entropyMaxSamples()) break;
            sampled++;
            if (!Files.isRegularFile(p)) continue;
            try {
                double e = Entropy.sample(p, settings.entropySampleBytes());
                if (e >= settings.entropyThreshold()) {
                    highEntropy = true;
                    logger.debug("Entropia alta em {}: {}", p, e);
                    break;
                }
            } catch (IOException e) {
                logger.debug("Amostra de entropia ignorada: {} ({})", p, e.toString());
            }
        }

        boolean canaryTamper = canary.check() > 0;
        return new DetectionResult(surge, highEntropy, suspiciousExt, canaryTamper);
    }

    boolean isSuspicious(Path p) {
        Path name = p.getFileName();
        if (name == null) return false;
        String ext = FilenameUtils.getExtension(name.toString());
        return !ext.isEmpty() && suspicious.contains("." + ext.toLowerCase(Locale.ROOT));
    }

    public SurgeWindow window() {
        return window;
    }
}
