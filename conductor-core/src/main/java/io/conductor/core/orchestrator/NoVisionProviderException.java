package io.conductor.core.orchestrator;

public class NoVisionProviderException extends OrchestrationException {

    public NoVisionProviderException(String message) {
        super(message);
    }
}
