package com.ryuqq.bridge.core.exception;

/**
 * A backend operation raised an error while running on the worker.
 *
 * <p>The original failure is kept as the cause and the operation name is kept for diagnostics.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class BackendOperationException extends BridgeException {

    private final String operationName;

    public BackendOperationException(String operationName, Throwable cause) {
        super(buildMessage(operationName, cause), cause);
        this.operationName = operationName;
    }

    public BackendOperationException(String operationName, String message) {
        super(message);
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }

    private static String buildMessage(String operationName, Throwable cause) {
        if (cause == null) {
            return operationName + " failed";
        }
        String detail = cause.getMessage();
        return detail == null || detail.isBlank() ? cause.getClass().getSimpleName() : detail;
    }
}
