package com.rxguard.app.watcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Janela deslizante de 60 s com os instantes dos eventos, em ordem.
 * Não é thread-safe: usada só pelo consumidor do watcher.
 */
public final class SurgeWindow {

    public static final Duration WINDOW = Duration.ofSeconds(60);
    private static final int MIN_CAPACITY = 10_000;

    private final Deque<Instant> events = new ArrayDeque<>();
    private final int threshold;
    private final int capacity;

    public SurgeWindow(int thresholdPerMinute) {
        if (thresholdPerMinute <= 0) throw new IllegalArgumentException("threshold deve ser positivo");
        this.threshold = thresholdPerMinute;
        this.capacity = Math.max(MIN_CAPACITY, thresholdPerMinute);
    }

    public void record(Instant at, int count) {
        for (int i = 0; i < count; i++) {
            record(at);
        }
    }

    public void record(Instant at) {
        events.addLast(at);
        while (events.size() > capacity) {
            events.pollFirst();
        }
    }

    /**
     * Descarta eventos mais velhos que 60 s em relação a {@code now} e compara com o limite.
     */
    public boolean isSurge(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!events.isEmpty() && events.peekFirst().isBefore(cutoff)) {
            events.pollFirst();
        }
        return events.size() >= threshold;
    }

    public int size() {
        return events.size();
    }
}
