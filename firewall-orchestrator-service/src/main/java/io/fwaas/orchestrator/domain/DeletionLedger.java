package io.fwaas.orchestrator.domain;

/**
 * Remembers firewalls whose deletion an agent already confirmed, so repeated confirmations do
 * not run the destroy path again.
 */
public interface DeletionLedger {
    boolean isConfirmed(String firewallId);

    void markConfirmed(String firewallId);
}
