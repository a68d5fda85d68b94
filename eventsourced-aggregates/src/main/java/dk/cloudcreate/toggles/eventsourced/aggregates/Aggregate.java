package dk.cloudcreate.toggles.eventsourced.aggregates;

import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;

/**
 * Common interface that all event sourced aggregates implement.<br>
 * An aggregate is an immutable value: it is only ever created or changed by its {@link EventApplier}
 * applying events, and every applied event produces a new aggregate instance.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 * @see EventApplier
 */
public interface Aggregate<ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> {
    /**
     * The id of the aggregate (aka. the stream-id)
     */
    ID aggregateId();

    /**
     * The {@link Generation} of the last event applied to this aggregate.<br>
     * An aggregate created by its creation event has {@link Generation#first()}.
     */
    Generation generation();
}
