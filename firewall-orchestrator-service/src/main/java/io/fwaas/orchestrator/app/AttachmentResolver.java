package io.fwaas.orchestrator.app;

import io.fwaas.orchestrator.domain.FirewallStore;
import io.fwaas.orchestrator.domain.RouterDiff;
import io.fwaas.orchestrator.domain.RouterDirectory;
import io.fwaas.orchestrator.domain.RoutersInUseException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns a requested router set into the set a firewall should be attached to.
 */
@Component
public class AttachmentResolver {

    private final RouterDirectory routers;
    private final FirewallStore store;

    public AttachmentResolver(RouterDirectory routers, FirewallStore store) {
        this.routers = Objects.requireNonNull(routers, "routers");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @param requested {@code null} to attach every router of the tenant
     */
    public List<String> resolveForCreate(String tenantId, List<String> requested) {
        List<String> resolved = requested == null
            ? distinct(routers.listRoutersForTenant(tenantId))
            : distinct(requested);
        validateNotInUse(null, resolved);
        return resolved;
    }

    public List<String> resolveForUpdate(String firewallId, List<String> requested) {
        Objects.requireNonNull(firewallId, "firewallId");
        Objects.requireNonNull(requested, "requested");
        List<String> resolved = distinct(requested);
        validateNotInUse(firewallId, resolved);
        return resolved;
    }

    /**
     * Fails when any router already belongs to a firewall other than {@code firewallId}.
     */
    public void validateNotInUse(String firewallId, Collection<String> routerIds) {
        List<String> inUse = routerIds.stream()
            .filter(router -> {
                Optional<String> owner = store.firewallOwningRouter(router);
                return owner.isPresent() && !owner.get().equals(firewallId);
            })
            .toList();
        if (!inUse.isEmpty()) {
            throw new RoutersInUseException(inUse);
        }
    }

    public RouterDiff diff(Collection<String> current, Collection<String> desired) {
        return RouterDiff.between(current, desired);
    }

    private static List<String> distinct(Collection<String> ids) {
        return List.copyOf(new LinkedHashSet<>(ids));
    }
}
