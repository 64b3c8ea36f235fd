package io.conductor.core.orchestrator;

/**
 * A condition the orchestrator cannot recover from by failing over. Recovered provider failures
 * never surface as this exception; they come back as a degraded response.
 */
public class OrchestrationException extends Exception {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
