/**
 * Execution package.
 *
 * <p>{@link io.stepgraph.runtime.GraphExecutor} drives a single run through its graph and
 * checkpoints after every step; {@link io.stepgraph.runtime.GraphWorker} feeds it runs from a
 * {@link io.stepgraph.runtime.WorkSource} on a bounded thread pool.
 */
package io.stepgraph.runtime;
