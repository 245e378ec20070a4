package com.rxguard.app.crypto;

/**
 * Chave mestra ausente, ilegível ou com tamanho inválido. Fatal na inicialização.
 */
public class KeyException extends IllegalStateException {

    public KeyException(String message) {
        super(message);
    }

    public KeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
