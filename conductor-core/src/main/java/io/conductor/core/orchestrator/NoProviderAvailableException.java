package io.conductor.core.orchestrator;

public class NoProviderAvailableException extends OrchestrationException {

    public NoProviderAvailableException(String message) {
        super(message);
    }
}
