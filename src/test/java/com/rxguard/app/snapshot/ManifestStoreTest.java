package com.rxguard.app.snapshot;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

public class ManifestStoreTest {

    @Test
    void save_writesDocumentedFieldNames() throws Exception {
        ManifestStore store = new ManifestStore(Files.createTempDirectory("rxguard-manifest-"));
        Snapshot snap = new Snapshot("20260102T030405Z", Instant.parse("2026-01-02T03:04:05Z"), 1, null,
                List.of(new FileEntry("/data/a.txt", 3, 1_700_000_000_123_456_789L, List.of("00112233aabbccdd"))));

        store.save(snap);

        JsonNode root = new ObjectMapper().readTree(
                Files.readString(store.manifestPath(snap.id()), StandardCharsets.UTF_8));
        assertEquals("20260102T030405Z", root.get("id").asText());
        assertEquals("2026-01-02T03:04:05Z", root.get("created_at").asText());
        assertEquals(1, root.get("version").asInt());
        assertTrue(root.get("label").isNull());
        JsonNode f = root.get("files").get(0);
        assertEquals(1_700_000_000_123_456_789L, f.get("mtime_ns").asLong());
        assertEquals("00112233aabbccdd", f.get("chunks").get(0).asText());

        assertEquals(snap, store.load(snap.id()));
    }

    @Test
    void load_acceptsOffsetTimestamps() throws Exception {
        Path dir = Files.createTempDirectory("rxguard-manifest-");
        ManifestStore store = new ManifestStore(dir);
        Files.writeString(store.manifestPath("20250101T000000Z"), """
                {"id": "20250101T000000Z", "created_at": "2025-01-01T00:00:00.123456+00:00",
                 "version": 1, "label": "auto-alert", "files": []}
                """, StandardCharsets.UTF_8);

        Snapshot snap = store.load("20250101T000000Z");

        assertEquals(Instant.parse("2025-01-01T00:00:00.123456Z"), snap.createdAt());
        assertEquals("auto-alert", snap.label());
        assertTrue(snap.files().isEmpty());
    }

    @Test
    void manifestPath_rejectsTraversal() throws Exception {
        ManifestStore store = new ManifestStore(Files.createTempDirectory("rxguard-manifest-"));

        assertThrows(IllegalArgumentException.class, () -> store.manifestPath("../escape"));
        assertThrows(IllegalArgumentException.class, () -> store.manifestPath(""));
    }
}
