package io.fwaas.orchestrator.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Routers to attach and detach when moving a firewall from one router set to another.
 * Both lists keep the order in which routers appear in their source collection.
 */
public record RouterDiff(List<String> added, List<String> removed) {

    public RouterDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }

    public static RouterDiff between(Collection<String> current, Collection<String> desired) {
        Set<String> currentSet = new LinkedHashSet<>(current);
        Set<String> desiredSet = new LinkedHashSet<>(desired);
        List<String> removed = currentSet.stream().filter(id -> !desiredSet.contains(id)).toList();
        List<String> added = desiredSet.stream().filter(id -> !currentSet.contains(id)).toList();
        return new RouterDiff(added, removed);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
