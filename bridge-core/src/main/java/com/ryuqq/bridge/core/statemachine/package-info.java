/**
 * Worker lifecycle state machine.
 *
 * @since 1.0.0
 * @author Bridge Team
 */
package com.ryuqq.bridge.core.statemachine;
