package io.fwaas.orchestrator.domain;

import java.util.List;

/**
 * Looks up the routers a tenant owns.
 */
public interface RouterDirectory {
    List<String> listRoutersForTenant(String tenantId);
}
