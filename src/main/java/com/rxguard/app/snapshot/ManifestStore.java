package com.rxguard.app.snapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rxguard.app.blob.NotFoundException;

/**
 * Persistência dos manifestos em {@code <manifests>/<id>.json}.
 */
public final class ManifestStore {

    private static final String EXT = ".json";
    private static final Pattern ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path dir;
    private final ObjectMapper mapper;

    public ManifestStore(Path dir) throws IOException {
        this.dir = Objects.requireNonNull(dir, "dir").toAbsolutePath().normalize();
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        Files.createDirectories(this.dir);
    }

    public Path manifestPath(String id) {
        if (id == null || !ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Id de snapshot inválido: " + id);
        }
        return dir.resolve(id + EXT);
    }

    public boolean exists(String id) {
        return Files.exists(manifestPath(id));
    }

    /**
     * Ids ordenados; a ordem lexicográfica do formato de timestamp é a cronológica.
     */
    public List<String> list() throws IOException {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(EXT))
                    .map(n -> n.substring(0, n.length() - EXT.length()))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Primeiro id livre a partir de {@code base}: base, base-1, base-2, ...
     */
    public String nextFreeId(String base) {
        String candidate = base;
        int n = 1;
        while (exists(candidate)) {
            candidate = base + "-" + n++;
        }
        return candidate;
    }

    public void save(Snapshot snapshot) throws IOException {
        Path target = manifestPath(snapshot.id());
        Path temp = dir.resolve(snapshot.id() + EXT + ".tmp");
        Files.writeString(temp, toJson(snapshot), StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * @throws NotFoundException se o manifesto não existir
     * @throws CorruptManifestException se o documento for inválido
     */
    public Snapshot load(String id) throws IOException {
        Path path = manifestPath(id);
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new NotFoundException(path.toString(), "snapshot inexistente: " + id);
        }
        return fromJson(id, json);
    }

    String toJson(Snapshot s) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("id", s.id());
        root.put("created_at", s.createdAt().toString());
        root.put("version", s.version());
        if (s.label() == null) root.putNull("label");
        else root.put("label", s.label());

        ArrayNode files = root.putArray("files");
        for (FileEntry fe : s.files()) {
            ObjectNode f = files.addObject();
            f.put("path", fe.path());
            f.put("size", fe.size());
            f.put("mtime_ns", fe.mtimeNs());
            ArrayNode chunks = f.putArray("chunks");
            fe.chunks().forEach(chunks::add);
        }
        return mapper.writeValueAsString(root);
    }

    Snapshot fromJson(String id, String json) throws CorruptManifestException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CorruptManifestException("Manifesto " + id + " não é JSON válido", e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptManifestException("Manifesto " + id + " não é um objeto JSON");
        }

        String sid = requireText(root, "id", id);
        Instant createdAt = parseInstant(requireText(root, "created_at", id), id);
        int version = root.path("version").asInt(Snapshot.CURRENT_VERSION);
        JsonNode labelNode = root.get("label");
        String label = (labelNode == null || labelNode.isNull()) ? null : labelNode.asText();

        JsonNode filesNode = root.get("files");
        if (filesNode == null || !filesNode.isArray()) {
            throw new CorruptManifestException("Manifesto " + id + " sem lista 'files'");
        }

        List<FileEntry> files = new ArrayList<>(filesNode.size());
        for (JsonNode f : filesNode) {
            if (!f.isObject()) {
                throw new CorruptManifestException("Manifesto " + id + ": entrada de arquivo inválida");
            }
            String path = requireText(f, "path", id);
            long size = requireLong(f, "size", id);
            long mtimeNs = requireLong(f, "mtime_ns", id);
            JsonNode chunksNode = f.get("chunks");
            if (chunksNode == null || !chunksNode.isArray()) {
                throw new CorruptManifestException("Manifesto " + id + ": 'chunks' ausente em " + path);
            }
            List<String> chunks = new ArrayList<>(chunksNode.size());
            for (JsonNode c : chunksNode) {
                if (!c.isTextual() || c.asText().isBlank()) {
                    throw new CorruptManifestException("Manifesto " + id + ": hash inválido em " + path);
                }
                chunks.add(c.asText());
            }
            files.add(new FileEntry(path, size, mtimeNs, chunks));
        }
        return new Snapshot(sid, createdAt, version, label, files);
    }

    private static String requireText(JsonNode node, String field, String id) throws CorruptManifestException {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new CorruptManifestException("Manifesto " + id + ": campo '" + field + "' ausente ou inválido");
        }
        return v.asText();
    }

    private static long requireLong(JsonNode node, String field, String id) throws CorruptManifestException {
        JsonNode v = node.get(field);
        if (v == null || !v.isIntegralNumber()) {
            throw new CorruptManifestException("Manifesto " + id + ": campo '" + field + "' ausente ou inválido");
        }
        return v.asLong();
    }

    // Aceita tanto "...Z" quanto offset explícito ("+00:00").
    private static Instant parseInstant(String text, String id) throws CorruptManifestException {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException e2) {
                throw new CorruptManifestException("Manifesto " + id + ": created_at inválido: " + text, e2);
            }
        }
    }
}
