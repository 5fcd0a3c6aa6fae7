package io.fwaas.orchestrator.domain;

/**
 * Base type for request failures the orchestrator reports to its caller.
 */
public class FirewallException extends RuntimeException {
    public FirewallException(String message) {
        super(message);
    }
}
