package io.roundrelay.observability;

import io.roundrelay.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {

    @Test
    void rowsAreChainedAndSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("roundrelay-audit-");
        try {
            Path file = root.resolve("logs").resolve("audit.jsonl");
            AuditLogger first = new AuditLogger(file, "fl");
            first.log(AuditLogger.AuditEvent.of("run.start", 1L, null, "ok", Map.of("participants", 3)));
            String hashAfterFirst = first.currentHash();

            AuditLogger reopened = new AuditLogger(file, "fl");
            Assertions.assertEquals(hashAfterFirst, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("round.scatter_gather", 1L, "round-1", "partial", null));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            Assertions.assertTrue(lines.get(1).contains("\"prev_hash\":\"" + hashAfterFirst + "\""));
            Assertions.assertTrue(reopened.verify());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("roundrelay-audit-");
        try {
            Path file = root.resolve("audit.jsonl");
            AuditLogger audit = new AuditLogger(file, "fl");
            audit.log(AuditLogger.AuditEvent.of("run.start", 2L, null, "ok", null));
            audit.log(AuditLogger.AuditEvent.of("run.stop_broadcast", 2L, "shutdown", "ok", null));

            String tampered = Files.readString(file, StandardCharsets.UTF_8).replace("\"run_id\":2", "\"run_id\":3");
            Files.writeString(file, tampered, StandardCharsets.UTF_8);

            Assertions.assertFalse(audit.verify());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
