/**
 * Call outcomes returned by the bridge.
 *
 * <p>Every awaited submission resolves to exactly one of
 * {@link com.ryuqq.bridge.core.outcome.Completed}, {@link com.ryuqq.bridge.core.outcome.Failed},
 * {@link com.ryuqq.bridge.core.outcome.TimedOut} or {@link com.ryuqq.bridge.core.outcome.NotReady}.
 * The facade never throws for backend errors or timeouts.</p>
 *
 * @since 1.0.0
 * @author Bridge Team
 */
package com.ryuqq.bridge.core.outcome;
