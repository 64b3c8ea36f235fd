package io.conductor.core.provider;

import java.io.IOException;

/**
 * Failure reported by a provider adapter: transport error, vendor error status or unusable payload.
 */
public class ProviderException extends IOException {
    private final String providerName;
    private final int statusCode;

    public ProviderException(String providerName, String message) {
        this(providerName, message, -1, null);
    }

    public ProviderException(String providerName, String message, Throwable cause) {
        this(providerName, message, -1, cause);
    }

    public ProviderException(String providerName, String message, int statusCode, Throwable cause) {
        super(providerName + ": " + message, cause);
        this.providerName = providerName;
        this.statusCode = statusCode;
    }

    public String providerName() {
        return providerName;
    }

    /**
     * HTTP status returned by the vendor, or -1 when the failure happened before a response.
     */
    public int statusCode() {
        return statusCode;
    }
}
