package com.ryuqq.bridge.core.exception;

/**
 * The bridge is not accepting calls (not started, init failed or closed).
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class BridgeNotReadyException extends BridgeException {

    public BridgeNotReadyException(String message) {
        super(message);
    }
}
