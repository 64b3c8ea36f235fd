package io.conductor.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code backend} is one of {@code sqlite}, {@code file} or {@code memory}. {@code path} is the
 * database file for sqlite and the directory for file storage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String backend, String path) {

    public static StorageConfig defaults() {
        return new StorageConfig("sqlite", "~/.conductor/conversations.db");
    }
}
