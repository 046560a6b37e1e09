package io.querygate.config;

import io.querygate.safety.SafetyRules;
import io.querygate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolved gate settings. Read from {@code querygate-settings.json} in the data root; every field of
 * the file is optional and falls back to the defaults, out-of-range values are clamped.
 */
public record GateSettings(
        TenantLimits defaultLimits,
        Map<String, TenantLimits> tenants,
        Map<String, String> partitionedTables,
        int partitionLookbackDays,
        double pricePerTibUsd,
        long callTimeoutMs,
        Set<String> retryableSignals,
        int idempotencyTtlDays
) implements TenantLimitsProvider {
    private static final Logger log = LoggerFactory.getLogger(GateSettings.class);

    public static final Set<String> DEFAULT_RETRYABLE_SIGNALS = Set.of("transient_error", "timeout");

    public GateSettings {
        tenants = tenants == null ? Map.of() : Map.copyOf(tenants);
        partitionedTables = partitionedTables == null ? Map.of() : Map.copyOf(partitionedTables);
        retryableSignals = retryableSignals == null ? DEFAULT_RETRYABLE_SIGNALS : Set.copyOf(retryableSignals);
    }

    public static GateSettings defaults() {
        return new GateSettings(
                TenantLimits.defaults(),
                Map.of(),
                SafetyRules.DEFAULT_PARTITIONED_TABLES,
                SafetyRules.DEFAULT_LOOKBACK_DAYS,
                QueryGateConfig.DEFAULT_PRICE_PER_TIB_USD,
                QueryGateConfig.DEFAULT_CALL_TIMEOUT_MS,
                DEFAULT_RETRYABLE_SIGNALS,
                QueryGateConfig.DEFAULT_IDEMPOTENCY_TTL_DAYS
        );
    }

    public static GateSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file " + settingsFile, e);
        }
    }

    static GateSettings fromFile(SettingsFile file, GateSettings defaults) {
        if (file == null) {
            return defaults;
        }
        TenantLimits base = sanitizeLimits(file.defaults(), defaults.defaultLimits());
        Map<String, TenantLimits> tenants = new TreeMap<>();
        if (file.tenants() != null) {
            file.tenants().forEach((tenantId, raw) -> {
                if (tenantId == null || tenantId.isBlank()) {
                    log.warn("Ignoring tenant limits with blank tenant id");
                    return;
                }
                tenants.put(tenantId.trim(), sanitizeLimits(raw, base));
            });
        }
        Map<String, String> partitioned = defaults.partitionedTables();
        if (file.partitionedTables() != null) {
            partitioned = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : file.partitionedTables().entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank()
                        || entry.getValue() == null || entry.getValue().isBlank()) {
                    continue;
                }
                partitioned.put(entry.getKey().trim().toLowerCase(Locale.ROOT), entry.getValue().trim());
            }
        }
        Set<String> signals = defaults.retryableSignals();
        if (file.retryableSignals() != null && !file.retryableSignals().isEmpty()) {
            signals = new TreeSet<>();
            for (String signal : file.retryableSignals()) {
                if (signal != null && !signal.isBlank()) {
                    signals.add(signal.trim().toLowerCase(Locale.ROOT));
                }
            }
            if (signals.isEmpty()) {
                signals = defaults.retryableSignals();
            }
        }
        double price = file.pricePerTibUsd() == null || file.pricePerTibUsd() < 0.0
                ? defaults.pricePerTibUsd()
                : file.pricePerTibUsd();
        return new GateSettings(
                base,
                tenants,
                partitioned,
                sanitizeInt(file.partitionLookbackDays(), defaults.partitionLookbackDays(), 1),
                price,
                sanitizeLong(file.callTimeoutMs(), defaults.callTimeoutMs(), 1L),
                signals,
                sanitizeInt(file.idempotencyTtlDays(), defaults.idempotencyTtlDays(), 1)
        );
    }

    private static TenantLimits sanitizeLimits(TenantLimitsFile raw, TenantLimits fallback) {
        if (raw == null) {
            return fallback;
        }
        long hard = sanitizeLong(raw.perQueryHardCapBytes(), fallback.perQueryHardCapBytes(), 1L);
        long soft = sanitizeLong(raw.perQuerySoftCapBytes(), fallback.perQuerySoftCapBytes(), 1L);
        if (soft > hard) {
            soft = hard;
        }
        return new TenantLimits(
                sanitizeLong(raw.hourlyBudgetBytes(), fallback.hourlyBudgetBytes(), 1L),
                soft,
                hard,
                sanitizeInt(raw.maxRetries(), fallback.maxRetries(), 0),
                sanitizeInt(raw.defaultLimit(), fallback.defaultLimit(), 1),
                sanitizeInt(raw.maxJoinDepth(), fallback.maxJoinDepth(), 0),
                sanitizeInt(raw.maxSubqueryDepth(), fallback.maxSubqueryDepth(), 0)
        );
    }

    @Override
    public TenantLimits limitsFor(String tenantId) {
        if (tenantId == null) {
            return defaultLimits;
        }
        return tenants.getOrDefault(tenantId, defaultLimits);
    }

    public SafetyRules baseSafetyRules() {
        return new SafetyRules(
                defaultLimits.defaultLimit(),
                defaultLimits.maxJoinDepth(),
                defaultLimits.maxSubqueryDepth(),
                partitionedTables,
                partitionLookbackDays
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    public record SettingsFile(
            TenantLimitsFile defaults,
            Map<String, TenantLimitsFile> tenants,
            Map<String, String> partitionedTables,
            Integer partitionLookbackDays,
            Double pricePerTibUsd,
            Long callTimeoutMs,
            List<String> retryableSignals,
            Integer idempotencyTtlDays
    ) {
    }

    public record TenantLimitsFile(
            Long hourlyBudgetBytes,
            Long perQuerySoftCapBytes,
            Long perQueryHardCapBytes,
            Integer maxRetries,
            Integer defaultLimit,
            Integer maxJoinDepth,
            Integer maxSubqueryDepth
    ) {
    }
}
