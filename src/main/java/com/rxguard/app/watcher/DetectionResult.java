package com.rxguard.app.watcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Sinais de um ciclo de detecção. Qualquer um basta para alertar.
 */
public record DetectionResult(boolean surge, boolean highEntropy, boolean suspiciousExtension, boolean canaryTamper) {

    public boolean isAlert() {
        return surge || highEntropy || suspiciousExtension || canaryTamper;
    }

    public List<String> firedSignals() {
        List<String> out = new ArrayList<>(4);
        if (surge) out.add("surge");
        if (highEntropy) out.add("high-entropy");
        if (suspiciousExtension) out.add("suspicious-extension");
        if (canaryTamper) out.add("canary-tamper");
        return out;
    }
}
