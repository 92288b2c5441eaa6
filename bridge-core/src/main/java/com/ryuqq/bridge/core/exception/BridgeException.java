package com.ryuqq.bridge.core.exception;

/**
 * Base exception for the knowledge bridge.
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
