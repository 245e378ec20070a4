package com.rxguard.app.watcher;

import java.nio.file.Path;

/**
 * Evento de alteração no sistema de arquivos. Renomeações chegam como CREATE do novo nome.
 * Sem timestamp próprio: o detector usa o instante do ciclo, vindo do {@link java.time.Clock} do watcher.
 */
public record FsChange(Kind kind, Path path) {

    public enum Kind { CREATE, MODIFY, OVERFLOW }

    public static FsChange modify(Path path) {
        return new FsChange(Kind.MODIFY, path);
    }

    public static FsChange create(Path path) {
        return new FsChange(Kind.CREATE, path);
    }
}
