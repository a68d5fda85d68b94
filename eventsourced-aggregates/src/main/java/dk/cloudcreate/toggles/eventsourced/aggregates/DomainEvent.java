package dk.cloudcreate.toggles.eventsourced.aggregates;

import dk.cloudcreate.toggles.eventstore.postgresql.types.EventId;

import java.time.*;
import java.util.*;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Envelope around an aggregate event carrying its identity, the aggregate it belongs to and when it was created
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the aggregate's event type
 */
public final class DomainEvent<ID, EVENT> {
    public final EventId        eventId;
    public final ID             aggregateId;
    public final OffsetDateTime createdAt;
    public final EVENT          event;

    public DomainEvent(EventId eventId, ID aggregateId, OffsetDateTime createdAt, EVENT event) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.createdAt = requireNonNull(createdAt, "No createdAt provided");
        this.event = requireNonNull(event, "No event provided");
    }

    public static <ID, EVENT> DomainEvent<ID, EVENT> of(EventId eventId, ID aggregateId, OffsetDateTime createdAt, EVENT event) {
        return new DomainEvent<>(eventId, aggregateId, createdAt, event);
    }

    /**
     * Wrap each event in a new {@link DomainEvent} with a fresh {@link EventId} from <code>idGenerator</code>
     * and <code>createdAt</code> set to the current time of <code>clock</code>
     */
    public static <ID, EVENT> List<DomainEvent<ID, EVENT>> wrap(ID aggregateId, List<EVENT> events, Supplier<UUID> idGenerator, Clock clock) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(events, "No events provided");
        requireNonNull(idGenerator, "No idGenerator provided");
        requireNonNull(clock, "No clock provided");
        var envelopes = new ArrayList<DomainEvent<ID, EVENT>>(events.size());
        for (var event : events) {
            envelopes.add(new DomainEvent<>(EventId.of(idGenerator.get()), aggregateId, OffsetDateTime.now(clock), event));
        }
        return envelopes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainEvent)) return false;
        DomainEvent<?, ?> that = (DomainEvent<?, ?>) o;
        return eventId.equals(that.eventId) &&
                aggregateId.equals(that.aggregateId) &&
                createdAt.isEqual(that.createdAt) &&
                event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, aggregateId, createdAt.toInstant(), event);
    }

    @Override
    public String toString() {
        return "DomainEvent{" +
                "eventId=" + eventId +
                ", aggregateId=" + aggregateId +
                ", createdAt=" + createdAt +
                ", event=" + event +
                '}';
    }
}
