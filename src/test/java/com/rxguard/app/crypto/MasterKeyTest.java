package com.rxguard.app.crypto;

import org.junit.jupiter.api.Test;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class MasterKeyTest {

    @Test
    void loadOrCreate_generatesOwnerOnlyKeyAndReloadsSameBytes() throws Exception {
        Path dir = Files.createTempDirectory("rxguard-key-");
        Path keyFile = dir.resolve("keys").resolve("master.key");

        MasterKey created = MasterKey.loadOrCreate(keyFile);
        assertTrue(Files.exists(keyFile));
        assertEquals(MasterKey.LENGTH, Files.size(keyFile));

        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(keyFile)));
        }

        MasterKey reloaded = MasterKey.loadOrCreate(keyFile);
        assertArrayEquals(created.bytes(), reloaded.bytes());
    }

    @Test
    void loadOrCreate_leavesOnlyTheFinalKeyFile_evenWithStaleTempFromEarlierCrash() throws Exception {
        Path keysDir = Files.createDirectories(Files.createTempDirectory("rxguard-key-").resolve("keys"));
        Path keyFile = keysDir.resolve("master.key");
        Files.write(keysDir.resolve("master.key.stale.tmp"), new byte[0]);

        MasterKey.loadOrCreate(keyFile);

        List<String> names;
        try (Stream<Path> s = Files.list(keysDir)) {
            names = s.map(p -> p.getFileName().toString()).sorted().toList();
        }
        assertEquals(List.of("master.key", "master.key.stale.tmp"), names, "no new temp file is left behind");
        assertEquals(MasterKey.LENGTH, Files.size(keyFile));
        assertDoesNotThrow(() -> MasterKey.loadOrCreate(keyFile));
    }

    @Test
    void loadOrCreate_wrongLength_isFatal() throws Exception {
        Path dir = Files.createTempDirectory("rxguard-key-");
        Path keyFile = dir.resolve("master.key");
        Files.write(keyFile, new byte[31]);

        assertThrows(KeyException.class, () -> MasterKey.loadOrCreate(keyFile));
    }

    @Test
    void of_rejectsWrongLength_andToStringHidesMaterial() {
        assertThrows(KeyException.class, () -> MasterKey.of(new byte[16]));
        assertFalse(MasterKey.generate().toString().matches(".*[0-9a-f]{8,}.*"));
    }
}
