/**
 * Core value objects of the bridge.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.model.CallId} - identifier of one submitted call</li>
 * </ul>
 *
 * <h2>Backend Result Schema</h2>
 * <p>The knowledge-base backend returns these typed records. Required fields are validated at
 * construction; optional fields are documented per record and are {@code null} when absent.</p>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.model.SearchResult} - total, memories, resources</li>
 *   <li>{@link com.ryuqq.bridge.core.model.MemoryHit} - matched memory</li>
 *   <li>{@link com.ryuqq.bridge.core.model.ResourceHit} - matched resource (uri + optional title/abstract/content)</li>
 *   <li>{@link com.ryuqq.bridge.core.model.AddResourceResult} - status, errors, root URI</li>
 *   <li>{@link com.ryuqq.bridge.core.model.DirectoryEntry} - name, directory flag, size</li>
 *   <li>{@link com.ryuqq.bridge.core.model.SessionInfo} - session identifier</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Bridge Team
 */
package com.ryuqq.bridge.core.model;
