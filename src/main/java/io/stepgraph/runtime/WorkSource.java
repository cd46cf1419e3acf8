package io.stepgraph.runtime;

import java.util.Iterator;
import java.util.Optional;

/**
 * Where a {@link GraphWorker} takes runs from.
 *
 * <p>A polling source returns an empty result while it has nothing to offer and keeps
 * {@link #isExhausted()} false; the worker then waits and polls again.
 */
public interface WorkSource {
    Optional<WorkItem> poll() throws InterruptedException;

    default boolean isExhausted() {
        return false;
    }

    /**
     * A finite source over {@code items}. It is exhausted once the iterator runs dry.
     */
    static WorkSource of(Iterable<WorkItem> items) {
        Iterator<WorkItem> iterator = items.iterator();
        return new WorkSource() {
            @Override
            public synchronized Optional<WorkItem> poll() {
                return iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
            }

            @Override
            public synchronized boolean isExhausted() {
                return !iterator.hasNext();
            }
        };
    }
}
