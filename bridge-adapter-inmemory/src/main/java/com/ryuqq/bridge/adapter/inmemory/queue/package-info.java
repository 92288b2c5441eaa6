/**
 * In-memory dispatch queue.
 *
 * <p>{@link com.ryuqq.bridge.adapter.inmemory.queue.LinkedDispatchQueue} is the production queue
 * for a single-process bridge; there is no durable variant.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.inmemory.queue;
