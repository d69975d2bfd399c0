package io.meshbroker.config;

import io.meshbroker.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public record BrokerSettings(
        int wsPort,
        int httpPort,
        String wsPath,
        long defaultTaskTimeoutMs,
        RegistrationPolicy registrationPolicy,
        CapabilityFramePolicy capabilityFramePolicy,
        int auditMaxEntries,
        int storeMaxAttempts,
        long storeRetryDelayMs,
        int maxFrameBytes
) {
    public static BrokerSettings defaults() {
        return new BrokerSettings(
                BrokerConfig.DEFAULT_WS_PORT,
                BrokerConfig.DEFAULT_HTTP_PORT,
                BrokerConfig.DEFAULT_WS_PATH,
                BrokerConfig.DEFAULT_TASK_TIMEOUT_MS,
                RegistrationPolicy.REPLACE,
                CapabilityFramePolicy.IGNORE_UNREGISTERED,
                BrokerConfig.DEFAULT_AUDIT_MAX_ENTRIES,
                BrokerConfig.DEFAULT_STORE_MAX_ATTEMPTS,
                BrokerConfig.DEFAULT_STORE_RETRY_DELAY_MS,
                BrokerConfig.DEFAULT_MAX_FRAME_BYTES
        );
    }

    /**
     * Reads the settings file under the config root. A missing file yields defaults;
     * fields absent from the file keep their default value.
     */
    public static BrokerSettings load(BrokerConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static BrokerSettings fromFile(SettingsFile file, BrokerSettings d) {
        if (file == null) {
            return d;
        }
        return new BrokerSettings(
                port(file.wsPort(), d.wsPort(), "wsPort"),
                port(file.httpPort(), d.httpPort(), "httpPort"),
                file.wsPath() == null || file.wsPath().isBlank() ? d.wsPath() : normalizePath(file.wsPath()),
                positive(file.defaultTaskTimeoutMs(), d.defaultTaskTimeoutMs()),
                file.registrationPolicy() == null
                        ? d.registrationPolicy()
                        : RegistrationPolicy.valueOf(file.registrationPolicy().trim().toUpperCase(Locale.ROOT)),
                file.capabilityFramePolicy() == null
                        ? d.capabilityFramePolicy()
                        : CapabilityFramePolicy.valueOf(file.capabilityFramePolicy().trim().toUpperCase(Locale.ROOT)),
                (int) positive(file.auditMaxEntries() == null ? null : file.auditMaxEntries().longValue(), d.auditMaxEntries()),
                (int) positive(file.storeMaxAttempts() == null ? null : file.storeMaxAttempts().longValue(), d.storeMaxAttempts()),
                file.storeRetryDelayMs() == null ? d.storeRetryDelayMs() : Math.max(0L, file.storeRetryDelayMs()),
                (int) positive(file.maxFrameBytes() == null ? null : file.maxFrameBytes().longValue(), d.maxFrameBytes())
        );
    }

    public BrokerSettings withPorts(Integer wsPortOverride, Integer httpPortOverride) {
        return new BrokerSettings(
                wsPortOverride == null ? wsPort : wsPortOverride,
                httpPortOverride == null ? httpPort : httpPortOverride,
                wsPath,
                defaultTaskTimeoutMs,
                registrationPolicy,
                capabilityFramePolicy,
                auditMaxEntries,
                storeMaxAttempts,
                storeRetryDelayMs,
                maxFrameBytes
        );
    }

    public BrokerSettings withTaskTimeout(long timeoutMs) {
        return new BrokerSettings(wsPort, httpPort, wsPath, timeoutMs, registrationPolicy, capabilityFramePolicy,
                auditMaxEntries, storeMaxAttempts, storeRetryDelayMs, maxFrameBytes);
    }

    public BrokerSettings withRegistrationPolicy(RegistrationPolicy policy) {
        return new BrokerSettings(wsPort, httpPort, wsPath, defaultTaskTimeoutMs, policy, capabilityFramePolicy,
                auditMaxEntries, storeMaxAttempts, storeRetryDelayMs, maxFrameBytes);
    }

    public BrokerSettings withCapabilityFramePolicy(CapabilityFramePolicy policy) {
        return new BrokerSettings(wsPort, httpPort, wsPath, defaultTaskTimeoutMs, registrationPolicy, policy,
                auditMaxEntries, storeMaxAttempts, storeRetryDelayMs, maxFrameBytes);
    }

    private static int port(Integer raw, int fallback, String field) {
        if (raw == null) {
            return fallback;
        }
        if (raw < 0 || raw > 65_535) {
            throw new IllegalArgumentException(field + " out of range: " + raw);
        }
        return raw;
    }

    private static long positive(Long raw, long fallback) {
        return raw == null || raw <= 0L ? fallback : raw;
    }

    private static String normalizePath(String raw) {
        String trimmed = raw.trim();
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    record SettingsFile(
            Integer wsPort,
            Integer httpPort,
            String wsPath,
            Long defaultTaskTimeoutMs,
            String registrationPolicy,
            String capabilityFramePolicy,
            Integer auditMaxEntries,
            Integer storeMaxAttempts,
            Long storeRetryDelayMs,
            Integer maxFrameBytes
    ) {
    }
}
