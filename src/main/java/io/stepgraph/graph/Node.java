package io.stepgraph.graph;

/**
 * One named step of a graph.
 *
 * <p>Steps run at least once: a crash after a step returned but before its checkpoint was
 * written makes the step run again on resume. Implementations with external side effects
 * must therefore be idempotent or compensate on their own. The executor never interrupts a
 * running step and applies no timeout of its own.
 */
@FunctionalInterface
public interface Node {
    /**
     * @param state read-only view of the run's state before this step
     * @return the fields to merge into the state, never null
     */
    StateUpdate apply(RunState state) throws Exception;
}
