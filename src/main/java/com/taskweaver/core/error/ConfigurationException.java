package com.taskweaver.core.error;

/**
 * Thrown when a delegation is misconfigured. Raised before any child session is created.
 */
public class ConfigurationException extends DelegationException {

    public ConfigurationException(String message) {
        super(message);
    }
}
