package io.roundrelay.transport;

import io.roundrelay.config.OrchestratorConfig;
import io.roundrelay.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class DirectoryTransportTest {

    @Test
    void writesRequestUnderRecipientFolderAndReadsSiblingResponse() throws Exception {
        Path root = Files.createTempDirectory("roundrelay-dir-transport-");
        try {
            DirectoryLayout layout = new DirectoryLayout(root, "roundrelay", null);
            DirectoryTransport transport = new DirectoryTransport(layout, "coordinator@example.org");

            transport.put("c-1", "alice@example.org", "req".getBytes(StandardCharsets.UTF_8));

            Path requestFile = root.resolve("alice@example.org").resolve("app_data").resolve("roundrelay")
                    .resolve("rpc").resolve("messages").resolve("coordinator@example.org").resolve("c-1.request");
            Assertions.assertTrue(Files.exists(requestFile));
            Assertions.assertEquals("req", Files.readString(requestFile));
            Assertions.assertTrue(transport.get("c-1").isEmpty());

            Files.writeString(requestFile.resolveSibling("c-1.response"), "resp");
            Assertions.assertEquals("resp", new String(transport.get("c-1").orElseThrow(), StandardCharsets.UTF_8));

            transport.release("c-1");
            Assertions.assertFalse(Files.exists(requestFile));
            Assertions.assertFalse(Files.exists(requestFile.resolveSibling("c-1.response")));
            Assertions.assertEquals(0, transport.pendingCount());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void configuredAppNameSelectsTheAppFolder() throws Exception {
        Path root = Files.createTempDirectory("roundrelay-dir-transport-");
        try {
            OrchestratorConfig config = OrchestratorConfig.fromEnvironment(
                    Map.of(OrchestratorConfig.ENV_APP_NAME, "fl-demo"));
            DirectoryLayout layout = DirectoryLayout.of(root, config, null);
            DirectoryTransport transport = new DirectoryTransport(layout, "coordinator@example.org");

            transport.put("c-1", "alice@example.org", "req".getBytes(StandardCharsets.UTF_8));

            Path expected = root.resolve("alice@example.org").resolve("app_data").resolve("fl-demo")
                    .resolve("rpc").resolve("messages").resolve("coordinator@example.org").resolve("c-1.request");
            Assertions.assertTrue(Files.exists(expected));
            Assertions.assertEquals("roundrelay",
                    DirectoryLayout.of(root, OrchestratorConfig.defaults(), null).appName());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void forgettingPendingKeepsFilesButDropsTracking() throws Exception {
        Path root = Files.createTempDirectory("roundrelay-dir-transport-");
        try {
            DirectoryLayout layout = new DirectoryLayout(root, "roundrelay", null);
            DirectoryTransport transport = new DirectoryTransport(layout, "coordinator@example.org");
            transport.put("c-1", "alice@example.org", "stop".getBytes(StandardCharsets.UTF_8));
            transport.put("c-2", "bob@example.org", "stop".getBytes(StandardCharsets.UTF_8));

            Assertions.assertEquals(2, transport.forgetPending());

            Assertions.assertEquals(0, transport.pendingCount());
            Assertions.assertTrue(Files.exists(layout.requestFile("alice@example.org", "coordinator@example.org", "c-1")));
            Assertions.assertTrue(Files.exists(layout.requestFile("bob@example.org", "coordinator@example.org", "c-2")));
            Assertions.assertTrue(transport.get("c-1").isEmpty());
            Assertions.assertEquals(0, transport.forgetPending());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unknownCorrelationHasNoResponse() throws Exception {
        Path root = Files.createTempDirectory("roundrelay-dir-transport-");
        try {
            DirectoryTransport transport = new DirectoryTransport(
                    new DirectoryLayout(root, "roundrelay", "messages"), "coordinator@example.org");

            Assertions.assertTrue(transport.get("never-sent").isEmpty());
            Assertions.assertDoesNotThrow(() -> transport.release("never-sent"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void pathTraversalSegmentsAreRejected() throws Exception {
        Path root = Files.createTempDirectory("roundrelay-dir-transport-");
        try {
            DirectoryLayout layout = new DirectoryLayout(root, "roundrelay", "/messages");
            Assertions.assertEquals("messages", layout.endpoint());
            Assertions.assertThrows(IllegalArgumentException.class, () -> layout.appDir(".."));
            Assertions.assertThrows(IllegalArgumentException.class, () -> layout.requestFile("alice", "bob", "a/b"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> new DirectoryLayout(root, " ", null));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
