package dk.cloudcreate.toggles.eventsourced.aggregates.repository;

/**
 * Maps aggregate ids and events to and from the textual columns of the event store
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the aggregate's event type
 */
public interface AggregateEventMapper<ID, EVENT> {
    String serializeAggregateId(ID aggregateId);

    /**
     * @throws RuntimeException if the value isn't a valid aggregate id
     */
    ID deserializeAggregateId(String aggregateId);

    /**
     * The discriminator stored in the <code>type</code> column, e.g. <code>Created</code>
     */
    String eventTypeOf(EVENT event);

    String serializeEvent(EVENT event);

    /**
     * @param eventType the discriminator stored alongside the event
     * @param data      the serialized event
     * @return the event
     * @throws RuntimeException if the data can't be deserialized or doesn't match the <code>eventType</code>
     */
    EVENT deserializeEvent(String eventType, String data);
}
