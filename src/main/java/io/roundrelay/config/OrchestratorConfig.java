package io.roundrelay.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class OrchestratorConfig {
    public static final String DEFAULT_APP_NAME = "roundrelay";
    public static final long DEFAULT_COORDINATOR_NODE_ID = 1L;
    public static final long DEFAULT_TTL_SECONDS = 43_200L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 3_000L;
    public static final long DEFAULT_STOP_TTL_SECONDS = 60L;
    public static final String DEFAULT_STOP_REASON = "Run complete";
    public static final String DEFAULT_STOP_GROUP_ID = "shutdown";

    public static final String ENV_APP_NAME = "ROUNDRELAY_APP_NAME";
    public static final String ENV_ENCRYPTION_ENABLED = "ROUNDRELAY_ENCRYPTION_ENABLED";
    public static final String ENV_MSG_TIMEOUT = "ROUNDRELAY_MSG_TIMEOUT";
    public static final String ENV_POLL_INTERVAL_MS = "ROUNDRELAY_POLL_INTERVAL_MS";
    public static final String ENV_DEFAULT_TTL_SECONDS = "ROUNDRELAY_DEFAULT_TTL_SECONDS";

    private final String appName;
    private final long coordinatorNodeId;
    private final long defaultTtlSeconds;
    private final Duration pollInterval;
    private final Duration messageTimeoutOverride;
    private final boolean encryptionEnabled;
    private final long stopTtlSeconds;

    public OrchestratorConfig(
            String appName,
            long coordinatorNodeId,
            long defaultTtlSeconds,
            Duration pollInterval,
            Duration messageTimeoutOverride,
            boolean encryptionEnabled,
            long stopTtlSeconds
    ) {
        if (defaultTtlSeconds <= 0L) {
            throw new IllegalArgumentException("defaultTtlSeconds must be > 0: " + defaultTtlSeconds);
        }
        if (stopTtlSeconds <= 0L) {
            throw new IllegalArgumentException("stopTtlSeconds must be > 0: " + stopTtlSeconds);
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (messageTimeoutOverride != null && messageTimeoutOverride.isNegative()) {
            throw new IllegalArgumentException("messageTimeoutOverride must not be negative: " + messageTimeoutOverride);
        }
        this.appName = appName == null || appName.isBlank() ? DEFAULT_APP_NAME : appName.trim();
        this.coordinatorNodeId = coordinatorNodeId;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.pollInterval = pollInterval;
        this.messageTimeoutOverride = messageTimeoutOverride;
        this.encryptionEnabled = encryptionEnabled;
        this.stopTtlSeconds = stopTtlSeconds;
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(
                DEFAULT_APP_NAME,
                DEFAULT_COORDINATOR_NODE_ID,
                DEFAULT_TTL_SECONDS,
                Duration.ofMillis(DEFAULT_POLL_INTERVAL_MS),
                null,
                true,
                DEFAULT_STOP_TTL_SECONDS
        );
    }

    public static OrchestratorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static OrchestratorConfig fromEnvironment(Map<String, String> env) {
        String appName = trimmed(env.get(ENV_APP_NAME));
        String encryptionRaw = trimmed(env.get(ENV_ENCRYPTION_ENABLED));
        // Anything but an explicit "false" keeps encryption on.
        boolean encryption = encryptionRaw == null || !"false".equals(encryptionRaw.toLowerCase(Locale.ROOT));
        Duration timeout = null;
        String timeoutRaw = trimmed(env.get(ENV_MSG_TIMEOUT));
        if (timeoutRaw != null) {
            double seconds = parseDouble(ENV_MSG_TIMEOUT, timeoutRaw);
            if (!Double.isFinite(seconds) || seconds < 0d) {
                throw new IllegalArgumentException(ENV_MSG_TIMEOUT + " must not be negative: " + timeoutRaw);
            }
            timeout = Duration.ofMillis(Math.round(seconds * 1_000d));
        }
        long pollMs = parseLong(ENV_POLL_INTERVAL_MS, trimmed(env.get(ENV_POLL_INTERVAL_MS)), DEFAULT_POLL_INTERVAL_MS);
        long ttl = parseLong(ENV_DEFAULT_TTL_SECONDS, trimmed(env.get(ENV_DEFAULT_TTL_SECONDS)), DEFAULT_TTL_SECONDS);
        return new OrchestratorConfig(
                appName,
                DEFAULT_COORDINATOR_NODE_ID,
                ttl,
                Duration.ofMillis(pollMs),
                timeout,
                encryption,
                DEFAULT_STOP_TTL_SECONDS
        );
    }

    public OrchestratorConfig withPollInterval(Duration interval) {
        return new OrchestratorConfig(appName, coordinatorNodeId, defaultTtlSeconds, interval,
                messageTimeoutOverride, encryptionEnabled, stopTtlSeconds);
    }

    public OrchestratorConfig withMessageTimeoutOverride(Duration timeout) {
        return new OrchestratorConfig(appName, coordinatorNodeId, defaultTtlSeconds, pollInterval,
                timeout, encryptionEnabled, stopTtlSeconds);
    }

    public OrchestratorConfig withEncryptionEnabled(boolean enabled) {
        return new OrchestratorConfig(appName, coordinatorNodeId, defaultTtlSeconds, pollInterval,
                messageTimeoutOverride, enabled, stopTtlSeconds);
    }

    public OrchestratorConfig withCoordinatorNodeId(long nodeId) {
        return new OrchestratorConfig(appName, nodeId, defaultTtlSeconds, pollInterval,
                messageTimeoutOverride, encryptionEnabled, stopTtlSeconds);
    }

    private static String trimmed(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static long parseLong(String name, String raw, long fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
        }
    }

    private static double parseDouble(String name, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
        }
    }

    public String appName() {
        return appName;
    }

    public long coordinatorNodeId() {
        return coordinatorNodeId;
    }

    public long defaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Optional<Duration> messageTimeoutOverride() {
        return Optional.ofNullable(messageTimeoutOverride);
    }

    public boolean encryptionEnabled() {
        return encryptionEnabled;
    }

    public long stopTtlSeconds() {
        return stopTtlSeconds;
    }
}
