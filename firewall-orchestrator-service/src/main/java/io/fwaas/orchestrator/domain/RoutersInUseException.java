package io.fwaas.orchestrator.domain;

import java.util.List;

public class RoutersInUseException extends FirewallException {
    private final List<String> routerIds;

    public RoutersInUseException(List<String> routerIds) {
        super("Router(s) %s provided already has a firewall association".formatted(routerIds));
        this.routerIds = List.copyOf(routerIds);
    }

    public List<String> getRouterIds() {
        return routerIds;
    }
}
