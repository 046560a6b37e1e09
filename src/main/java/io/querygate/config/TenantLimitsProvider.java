package io.querygate.config;

@FunctionalInterface
public interface TenantLimitsProvider {
    TenantLimits limitsFor(String tenantId);

    static TenantLimitsProvider fixed(TenantLimits limits) {
        return tenantId -> limits;
    }
}
