package com.marketintel.core;

/**
 * Thrown when a required provider credential is not configured.
 */
public class MissingCredentialException extends RuntimeException {
    public MissingCredentialException(String provider, String envName) {
        super("missing credential for " + provider + " (set " + envName + ")");
    }
}
