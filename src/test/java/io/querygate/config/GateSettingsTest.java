package io.querygate.config;

import io.querygate.safety.SafetyRules;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

final class GateSettingsTest {

    @Test
    void missingFileFallsBackToDefaults() {
        GateSettings settings = GateSettings.load(Path.of("does-not-exist", "querygate-settings.json"));

        Assertions.assertEquals(TenantLimits.defaults(), settings.limitsFor("anyone"));
        Assertions.assertEquals(TenantLimits.defaults(), settings.limitsFor(null));
        Assertions.assertEquals(SafetyRules.DEFAULT_LOOKBACK_DAYS, settings.partitionLookbackDays());
        Assertions.assertEquals(GateSettings.DEFAULT_RETRYABLE_SIGNALS, settings.retryableSignals());
        Assertions.assertEquals(SafetyRules.defaults(), settings.baseSafetyRules());
    }

    @Test
    void tenantOverridesInheritFromFileDefaults() throws Exception {
        Path file = Files.createTempFile("querygate-settings-", ".json");
        try {
            Files.writeString(file, """
                    {
                      "defaults": {"hourlyBudgetBytes": 1000000, "maxRetries": 1},
                      "tenants": {
                        "acme": {"perQuerySoftCapBytes": 2000, "perQueryHardCapBytes": 5000, "maxJoinDepth": 2}
                      },
                      "partitionedTables": {"Warehouse.Clicks": "event_date"},
                      "partitionLookbackDays": 7,
                      "retryableSignals": ["Throttled", " "],
                      "callTimeoutMs": 1500
                    }
                    """, StandardCharsets.UTF_8);

            GateSettings settings = GateSettings.load(file);

            TenantLimits acme = settings.limitsFor("acme");
            Assertions.assertEquals(1_000_000L, acme.hourlyBudgetBytes());
            Assertions.assertEquals(1, acme.maxRetries());
            Assertions.assertEquals(2_000L, acme.perQuerySoftCapBytes());
            Assertions.assertEquals(5_000L, acme.perQueryHardCapBytes());
            Assertions.assertEquals(2, acme.maxJoinDepth());

            TenantLimits other = settings.limitsFor("globex");
            Assertions.assertEquals(1_000_000L, other.hourlyBudgetBytes());
            Assertions.assertEquals(TenantLimits.DEFAULT_HARD_CAP_BYTES, other.perQueryHardCapBytes());

            Assertions.assertEquals("event_date", settings.partitionedTables().get("warehouse.clicks"));
            Assertions.assertEquals(7, settings.partitionLookbackDays());
            Assertions.assertEquals(Set.of("throttled"), settings.retryableSignals());
            Assertions.assertEquals(1_500L, settings.callTimeoutMs());
            Assertions.assertEquals(QueryGateConfig.DEFAULT_IDEMPOTENCY_TTL_DAYS, settings.idempotencyTtlDays());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void outOfRangeValuesAreClamped() {
        GateSettings.SettingsFile file = new GateSettings.SettingsFile(
                new GateSettings.TenantLimitsFile(-5L, 900L, 100L, -1, 0, null, null),
                null, null, 0, -2.0, 0L, null, -3
        );

        GateSettings settings = GateSettings.fromFile(file, GateSettings.defaults());

        TenantLimits limits = settings.limitsFor("acme");
        Assertions.assertEquals(1L, limits.hourlyBudgetBytes());
        Assertions.assertEquals(100L, limits.perQuerySoftCapBytes());
        Assertions.assertEquals(100L, limits.perQueryHardCapBytes());
        Assertions.assertEquals(0, limits.maxRetries());
        Assertions.assertEquals(1, limits.defaultLimit());
        Assertions.assertEquals(1, settings.partitionLookbackDays());
        Assertions.assertEquals(QueryGateConfig.DEFAULT_PRICE_PER_TIB_USD, settings.pricePerTibUsd());
        Assertions.assertEquals(1L, settings.callTimeoutMs());
        Assertions.assertEquals(1, settings.idempotencyTtlDays());
    }

    @Test
    void softCapAboveHardCapIsRejectedWhenBuiltDirectly() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new TenantLimits(1_000L, 500L, 100L, 3, 10, 5, 3));
    }
}
