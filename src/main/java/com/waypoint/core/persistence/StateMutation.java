package com.waypoint.core.persistence;

import com.waypoint.core.state.SprintState;

/**
 * A change applied to freshly loaded state inside {@link TaskGraphStore#atomicUpdate}.
 * Throwing any exception abandons the change before anything is written.
 *
 * @param <T> value handed back to the caller once the change is persisted
 */
@FunctionalInterface
public interface StateMutation<T> {

    T apply(SprintState state);
}
