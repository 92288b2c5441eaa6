package com.ryuqq.bridge.core.exception;

/**
 * The backend could not be created or initialized on the worker thread.
 *
 * <p>Used to fail every call dequeued after an initialization failure.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class BackendInitializationException extends BackendOperationException {

    public BackendInitializationException(String operationName, Throwable cause) {
        super(operationName, "Knowledge base initialization failed: " + describe(cause));
        if (cause != null) {
            initCause(cause);
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
