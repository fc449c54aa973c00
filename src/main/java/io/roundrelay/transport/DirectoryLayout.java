package io.roundrelay.transport;

import io.roundrelay.config.OrchestratorConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Folder layout shared by {@link DirectoryTransport} and the participant-side responder:
 * {@code {root}/{recipient}/app_data/{app}/rpc/{endpoint}/{sender}/{id}.request} with the answer written
 * next to it as {@code {id}.response}.
 */
public final class DirectoryLayout {
    public static final String DEFAULT_ENDPOINT = "messages";
    public static final String REQUEST_SUFFIX = ".request";
    public static final String RESPONSE_SUFFIX = ".response";

    private final Path root;
    private final String appName;
    private final String endpoint;

    public DirectoryLayout(Path root, String appName, String endpoint) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.root = root.toAbsolutePath().normalize();
        this.appName = segment("appName", appName);
        this.endpoint = segment("endpoint", endpoint == null ? DEFAULT_ENDPOINT : stripLeadingSlash(endpoint));
    }

    /**
     * Layout under the app name from {@link OrchestratorConfig#appName()} ({@code ROUNDRELAY_APP_NAME}).
     */
    public static DirectoryLayout of(Path root, OrchestratorConfig config, String endpoint) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new DirectoryLayout(root, config.appName(), endpoint);
    }

    public Path root() {
        return root;
    }

    public String appName() {
        return appName;
    }

    public String endpoint() {
        return endpoint;
    }

    public Path appDir(String owner) {
        return root.resolve(segment("owner", owner)).resolve("app_data").resolve(appName);
    }

    public Path endpointDir(String owner) {
        return appDir(owner).resolve("rpc").resolve(endpoint);
    }

    public Path requestDir(String recipient, String sender) {
        return endpointDir(recipient).resolve(segment("sender", sender));
    }

    public Path requestFile(String recipient, String sender, String correlationId) {
        return requestDir(recipient, sender).resolve(segment("correlationId", correlationId) + REQUEST_SUFFIX);
    }

    public static Path responseFileFor(Path requestFile) {
        String name = requestFile.getFileName().toString();
        String base = name.endsWith(REQUEST_SUFFIX)
                ? name.substring(0, name.length() - REQUEST_SUFFIX.length())
                : name;
        return requestFile.resolveSibling(base + RESPONSE_SUFFIX);
    }

    /**
     * Writes through a temp file and a rename so that a polling reader never sees a half-written body.
     */
    public static void writeAtomically(Path target, byte[] body) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, body);
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ignored) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String stripLeadingSlash(String raw) {
        String value = raw.trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        return value;
    }

    private static String segment(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        String value = raw.trim();
        if (value.equals(".") || value.equals("..") || value.contains("/") || value.contains("\\")) {
            throw new IllegalArgumentException(name + " is not a valid path segment: " + raw);
        }
        return value;
    }
}
