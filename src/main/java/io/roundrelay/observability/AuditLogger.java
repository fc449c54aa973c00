package io.roundrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.roundrelay.util.Hashing;
import io.roundrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail of runs and rounds. Each row carries the hash of the previous row, so a
 * truncated or edited file is detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        try {
            if (auditFile.getParent() != null) {
                Files.createDirectories(auditFile.getParent());
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("run_id", event.runId());
        row.put("group_id", event.groupId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Recomputes the hash chain from the first row.
     *
     * @return {@code true} when every row links to its predecessor and its own hash matches
     */
    public synchronized boolean verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            Map<String, Object> row;
            try {
                row = readRow(line);
            } catch (IOException e) {
                return false;
            }
            Object storedHash = row.remove("hash");
            if (!expectedPrev.equals(row.get("prev_hash"))) {
                return false;
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(storedHash)) {
                return false;
            }
            expectedPrev = recomputed;
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readRow(String line) throws IOException {
        return Jsons.mapper().readValue(line, LinkedHashMap.class);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            Long runId,
            String groupId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, Long runId, String groupId, String result, Map<String, Object> details) {
            return new AuditEvent(action, runId, groupId, result, details == null ? Map.of() : details);
        }
    }
}
