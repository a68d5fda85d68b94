package dk.cloudcreate.toggles.eventsourced.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The single source of state transitions for an aggregate type.<br>
 * <code>applyEvent</code> must be a pure and deterministic function of its arguments, so replaying the same events
 * always produces the same aggregate.
 *
 * @param <EVENT>          the aggregate's event type
 * @param <AGGREGATE_TYPE> the aggregate type
 */
@FunctionalInterface
public interface EventApplier<EVENT, AGGREGATE_TYPE extends Aggregate<?, AGGREGATE_TYPE>> {
    /**
     * Apply an event to the current state
     *
     * @param currentState the current state. {@link Optional#empty()} if the aggregate doesn't exist yet
     * @param event        the event to apply
     * @return the new state
     * @throws InvalidStateEventException if the event isn't valid for the current state
     * @throws AggregateException         if the event otherwise violates the aggregate's rules
     */
    AGGREGATE_TYPE applyEvent(Optional<AGGREGATE_TYPE> currentState, EVENT event);

    /**
     * Left fold {@link #applyEvent(Optional, Object)} over the events, starting from {@link Optional#empty()}.<br>
     * The first failing event aborts the fold; no partially hydrated aggregate is ever returned.
     *
     * @param events the events in the order they were persisted
     * @return the hydrated aggregate or {@link Optional#empty()} if <code>events</code> is empty
     */
    default Optional<AGGREGATE_TYPE> hydrate(List<EVENT> events) {
        requireNonNull(events, "No events provided");
        Optional<AGGREGATE_TYPE> state = Optional.empty();
        for (var event : events) {
            state = Optional.of(requireNonNull(applyEvent(state, event), "applyEvent returned null"));
        }
        return state;
    }
}
