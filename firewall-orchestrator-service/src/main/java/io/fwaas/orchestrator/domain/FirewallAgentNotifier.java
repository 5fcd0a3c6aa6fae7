package io.fwaas.orchestrator.domain;

import io.fwaas.firewall.model.FirewallDocument;

/**
 * One-way broadcasts to every firewall agent.
 * <p>
 * Implementations never wait for a reply and never retry; the outcome is learned later through
 * {@link FirewallAgentCallbacks}.
 */
public interface FirewallAgentNotifier {

    void notifyCreate(FirewallDocument firewall);

    void notifyUpdate(FirewallDocument firewall);

    void notifyDelete(FirewallDocument firewall);
}
