package com.soundledger.domain.error;

/**
 * An operation was invoked without the collaborator it needs. Fatal to that call.
 */
public final class ConfigurationMissingException extends RuntimeException {
    public ConfigurationMissingException(String message) {
        super(message);
    }
}
