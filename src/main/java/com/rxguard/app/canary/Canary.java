package com.rxguard.app.canary;

/**
 * Arquivo isca e o hash do conteúdo gravado na implantação.
 */
public record Canary(String path, String hash) {
}
