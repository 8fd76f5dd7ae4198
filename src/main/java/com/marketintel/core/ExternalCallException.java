package com.marketintel.core;

/**
 * Raised by {@link ResilientCaller} once every attempt for a signature has failed.
 */
public class ExternalCallException extends RuntimeException {
    private final String signature;
    private final int attempts;

    public ExternalCallException(String signature, int attempts, Throwable cause) {
        super("external call failed signature=" + signature
                + ", attempts=" + attempts
                + ", err=" + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.signature = signature;
        this.attempts = attempts;
    }

    public String signature() {
        return signature;
    }

    public int attempts() {
        return attempts;
    }
}
