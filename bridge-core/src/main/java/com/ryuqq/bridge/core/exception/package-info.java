/**
 * Bridge exception hierarchy.
 *
 * <pre>
 * BridgeException (unchecked)
 *  ├── BackendOperationException      backend call failed on the worker
 *  │    └── BackendInitializationException   backend could not be initialized
 *  └── BridgeNotReadyException        bridge not accepting calls
 * </pre>
 *
 * @since 1.0.0
 * @author Bridge Team
 */
package com.ryuqq.bridge.core.exception;
