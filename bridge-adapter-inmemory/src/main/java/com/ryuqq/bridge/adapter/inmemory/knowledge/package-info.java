/**
 * In-memory reference knowledge base.
 *
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.inmemory.knowledge;
