/**
 * Breaker state model and transition rules.
 *
 * <p>{@link com.ryuqq.breaker.core.statemachine.BreakerState} is a sealed type with three
 * record implementations. {@link com.ryuqq.breaker.core.statemachine.StateTransition} rejects
 * any move outside the allowed graph.</p>
 *
 * <h2>Allowed Transitions</h2>
 * <ul>
 *   <li>CLOSED to OPEN when the error rate exceeds the threshold</li>
 *   <li>OPEN to HALF_OPEN once the retry timeout elapses</li>
 *   <li>HALF_OPEN to CLOSED after enough consecutive trial successes</li>
 *   <li>HALF_OPEN to OPEN on any trial failure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Breaker Team
 */
package com.ryuqq.breaker.core.statemachine;
