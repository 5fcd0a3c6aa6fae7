package io.fwaas.orchestrator.domain;

import io.fwaas.firewall.model.FirewallStatus;
import java.util.Collection;

/**
 * Firewall state machine.
 * <p>
 * A firewall in a {@code PENDING_*} state has a mutation in flight and rejects further mutations
 * until an agent reports back. Deletion is always allowed and always passes through
 * {@code PENDING_DELETE}. A firewall without routers is {@code INACTIVE} and is never announced
 * to agents.
 */
public final class FirewallLifecycle {

    private FirewallLifecycle() {
    }

    public static boolean canTransition(FirewallStatus from, FirewallStatus to) {
        if (to == FirewallStatus.PENDING_DELETE || to == FirewallStatus.ERROR) {
            return true;
        }
        if (from == FirewallStatus.PENDING_DELETE) {
            return false;
        }
        return switch (to) {
            case ACTIVE, DOWN, INACTIVE -> true;
            case PENDING_UPDATE -> !from.isPending();
            case PENDING_CREATE, PENDING_DELETE, ERROR -> false;
        };
    }

    /**
     * Rejects a mutation while a previous one is still waiting for agent acknowledgment.
     */
    public static void ensureMutable(Firewall firewall) {
        if (firewall.getStatus().isPending()) {
            throw new FirewallInPendingStateException(firewall.getId(), firewall.getStatus());
        }
    }

    public static FirewallStatus initialStatus(Collection<String> routers) {
        return routers.isEmpty() ? FirewallStatus.INACTIVE : FirewallStatus.PENDING_CREATE;
    }

    public static FirewallStatus statusForUpdate(Collection<String> currentRouters, Collection<String> desiredRouters) {
        if (currentRouters.isEmpty() && desiredRouters.isEmpty()) {
            return FirewallStatus.INACTIVE;
        }
        return FirewallStatus.PENDING_UPDATE;
    }

    /**
     * Applies an agent status report. A pending delete always wins over a late report; only
     * {@code ACTIVE} and {@code DOWN} are accepted, anything else turns the firewall to
     * {@code ERROR}. An accepted report for a firewall left without routers settles it as
     * {@code INACTIVE}.
     */
    public static StatusReport onStatusReport(FirewallStatus current, FirewallStatus reported, boolean hasRouters) {
        if (current == FirewallStatus.PENDING_DELETE) {
            return new StatusReport(false, current);
        }
        if (reported == FirewallStatus.ACTIVE || reported == FirewallStatus.DOWN) {
            return new StatusReport(true, hasRouters ? reported : FirewallStatus.INACTIVE);
        }
        return new StatusReport(false, FirewallStatus.ERROR);
    }

    /**
     * Decides what an agent's deletion report means for a firewall in {@code current} state.
     */
    public static DeleteReport onDeleteReport(FirewallStatus current) {
        if (current == FirewallStatus.PENDING_DELETE || current == FirewallStatus.ERROR) {
            return DeleteReport.DESTROY;
        }
        return DeleteReport.UNEXPECTED;
    }

    public record StatusReport(boolean accepted, FirewallStatus status) {
    }

    public enum DeleteReport {
        DESTROY,
        UNEXPECTED
    }
}
