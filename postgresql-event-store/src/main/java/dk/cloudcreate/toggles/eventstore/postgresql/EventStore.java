package dk.cloudcreate.toggles.eventstore.postgresql;

import dk.cloudcreate.toggles.eventstore.postgresql.eventstream.StoredEvent;
import dk.cloudcreate.toggles.eventstore.postgresql.persistence.*;

import java.util.List;

/**
 * Append only storage of {@link StoredEvent}'s.<br>
 * The store guarantees that at most one event exists per aggregate id and generation and that every event id is unique.
 */
public interface EventStore {
    /**
     * Load all events related to the given aggregate id
     *
     * @param aggregateId the serialized aggregate id
     * @return the events ordered by ascending generation. Empty if no events have been stored for the aggregate
     */
    List<StoredEvent> loadEvents(String aggregateId);

    /**
     * Append the events atomically: either all events are stored or none are.
     *
     * @param events the events to append
     * @throws OptimisticAppendToStreamException if an event with the same aggregate id and generation already exists
     * @throws AppendToStreamException           in case of any other storage failure
     */
    void appendEvents(List<StoredEvent> events);
}
