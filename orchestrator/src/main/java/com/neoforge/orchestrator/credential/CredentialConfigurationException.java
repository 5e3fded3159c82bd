package com.neoforge.orchestrator.credential;

/**
 * No usable credential was configured. Fatal before any phase runs.
 */
public class CredentialConfigurationException extends RuntimeException {

    public CredentialConfigurationException(String message) {
        super(message);
    }
}
