/**
 * Circuit breaker SPI and its windowed implementation.
 *
 * <p>Callers run the protected operation themselves and report each outcome. The breaker only
 * decides whether the next call should be attempted.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.protection.CircuitBreaker} - the contract surface</li>
 *   <li>{@link com.ryuqq.breaker.core.protection.WindowedCircuitBreaker} - lazy three-state machine
 *       over a {@link com.ryuqq.breaker.core.window.WindowedCounter}</li>
 *   <li>{@link com.ryuqq.breaker.core.protection.BreakerConfig} - immutable configuration</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CircuitBreaker cb = new WindowedCircuitBreaker(new BreakerConfig()
 *     .withErrorThreshold(25.0)
 *     .withRetryTimeout(Duration.ofSeconds(10)));
 *
 * if (cb.tryAcquire()) {
 *     cb.reportOutcome(callDependency());
 * }
 * }</pre>
 *
 * <p>Implementations are not thread-safe. Shared instances need external mutual exclusion.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
package com.ryuqq.breaker.core.protection;
