/**
 * Time-partitioned outcome statistics.
 *
 * <p>{@link com.ryuqq.breaker.core.window.WindowedCounter} keeps a fixed ring of buckets, one per
 * span of time, and answers what fraction of recent, completed observations were failures.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.window.WindowedCounter} - circular bucket array with lazy eviction</li>
 *   <li>{@link com.ryuqq.breaker.core.window.BucketSnapshot} - immutable view of one bucket</li>
 * </ul>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>The bucket under the cursor is in progress and never counts toward the error rate</li>
 *   <li>Advancing is idempotent for the same instant</li>
 *   <li>Skipping {@code capacity} spans or more empties the whole window</li>
 *   <li>Buckets not passed by the cursor keep their counts</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Breaker Team
 */
package com.ryuqq.breaker.core.window;
