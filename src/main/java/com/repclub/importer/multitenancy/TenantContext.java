package com.repclub.importer.multitenancy;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the organization id of the current request.
 * Populated by {@link TenantFilter} and cleared once the request completes.
 */
@Slf4j
public class TenantContext {

    private static final ThreadLocal<String> currentTenant = new ThreadLocal<>();

    private TenantContext() {}

    public static void setCurrentTenant(String organizationId) {
        log.debug("Setting tenant context to organization: {}", organizationId);
        currentTenant.set(organizationId);
    }

    public static String getCurrentTenant() {
        return currentTenant.get();
    }

    public static void clear() {
        currentTenant.remove();
    }

    public static boolean hasTenant() {
        return currentTenant.get() != null;
    }
}
