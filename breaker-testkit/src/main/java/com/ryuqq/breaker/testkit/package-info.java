/**
 * Test support for circuit breaker implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.breaker.testkit.clock.ManualClock} - deterministic time source</li>
 *   <li>{@link com.ryuqq.breaker.testkit.contract.AbstractCircuitBreakerContractTest} - behavioural
 *       contract any windowed breaker should pass</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.breaker.testkit;
