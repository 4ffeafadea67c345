package com.minicrm.backend.service;

/**
 * The language model could not produce a usable answer: not configured, unreachable,
 * timed out, interrupted or returned something that is not the expected JSON.
 */
public class BridgeUnavailableException extends RuntimeException {

    public BridgeUnavailableException(String message) {
        super(message);
    }

    public BridgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
