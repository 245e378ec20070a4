package com.rxguard.app.watcher;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entropia de Shannon em bits por byte (0 a 8). Conteúdo cifrado ou comprimido fica perto de 8.
 */
public final class Entropy {

    private Entropy() {}

    public static double shannon(byte[] data) {
        return shannon(data, data.length);
    }

    public static double shannon(byte[] data, int len) {
        if (len <= 0) return 0.0;
        int[] counts = new int[256];
        for (int i = 0; i < len; i++) {
            counts[data[i] & 0xFF]++;
        }
        double entropy = 0.0;
        for (int c : counts) {
            if (c == 0) continue;
            double p = (double) c / len;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    /**
     * Entropia dos primeiros {@code maxBytes} do arquivo.
     */
    public static double sample(Path file, int maxBytes) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buf = in.readNBytes(maxBytes);
            return shannon(buf);
        }
    }
}
