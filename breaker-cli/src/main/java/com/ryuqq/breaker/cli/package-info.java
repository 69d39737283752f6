/**
 * Terminal front end for the circuit breaker.
 *
 * <p>Builds a configuration from command-line flags, then lets a user report outcomes by hand
 * while watching the state and the bucket window change.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.breaker.cli.BreakerCli} - picocli entry point</li>
 *   <li>{@link com.ryuqq.breaker.cli.BreakerConsole} - read-eval-print loop with optional autoplay</li>
 *   <li>{@link com.ryuqq.breaker.cli.BreakerRenderer} - ASCII/ANSI frame renderer</li>
 * </ul>
 *
 * <p>Nothing here makes breaker decisions. All of it goes through
 * {@link com.ryuqq.breaker.core.protection.CircuitBreaker}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.breaker.cli;
