package dk.cloudcreate.toggles.eventsourced.aggregates.repository;

import dk.cloudcreate.toggles.eventsourced.aggregates.*;
import dk.cloudcreate.toggles.eventstore.postgresql.*;
import dk.cloudcreate.toggles.eventstore.postgresql.eventstream.StoredEvent;
import dk.cloudcreate.toggles.eventstore.postgresql.persistence.*;
import dk.cloudcreate.toggles.eventstore.postgresql.types.*;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Loads aggregates by replaying their events and persists new events under optimistic concurrency control.<br>
 * Use {@link #from(EventStore, AggregateEventMapper, EventApplier, Class)} to create a {@link DefaultRepository}
 * or extend {@link DefaultRepository} if you need additional methods.
 *
 * @param <ID>             the aggregate id type
 * @param <EVENT>          the aggregate's event type
 * @param <AGGREGATE_TYPE> the aggregate type
 */
public interface Repository<ID, EVENT, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> {
    /**
     * Create a {@link Repository} for the given aggregate type
     *
     * @param eventStore    the event store holding the aggregate's events
     * @param eventMapper   maps ids and events to and from their stored form
     * @param eventApplier  the aggregate's {@link EventApplier}
     * @param aggregateType the aggregate type
     */
    static <ID, EVENT, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> Repository<ID, EVENT, AGGREGATE_TYPE> from(EventStore eventStore,
                                                                                                                       AggregateEventMapper<ID, EVENT> eventMapper,
                                                                                                                       EventApplier<EVENT, AGGREGATE_TYPE> eventApplier,
                                                                                                                       Class<AGGREGATE_TYPE> aggregateType) {
        return new DefaultRepository<>(eventStore, eventMapper, eventApplier, aggregateType);
    }

    /**
     * Load all events related to the aggregate
     *
     * @param aggregateId the aggregate id
     * @return the events ordered by generation. Empty if the aggregate doesn't exist
     * @throws EventDecodingException if any stored event can't be decoded or the generations aren't gap free
     */
    List<DomainEvent<ID, EVENT>> loadEvents(ID aggregateId);

    /**
     * Load and hydrate the aggregate
     *
     * @param aggregateId the aggregate id
     * @return the aggregate or {@link Optional#empty()} if no events exist for it
     * @throws EventDecodingException if any stored event can't be decoded or the events describe another aggregate
     * @throws AggregateException     if an event can't be applied
     */
    Optional<AGGREGATE_TYPE> tryGet(ID aggregateId);

    /**
     * Load and hydrate the aggregate
     *
     * @param aggregateId the aggregate id
     * @return the aggregate
     * @throws AggregateNotFoundException if no events exist for the aggregate
     * @throws EventDecodingException     if any stored event can't be decoded
     * @throws AggregateException         if an event can't be applied
     */
    default AGGREGATE_TYPE get(ID aggregateId) {
        return tryGet(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateType()));
    }

    /**
     * Persist new events atomically. The events are given the generations <code>startingGeneration</code>,
     * <code>startingGeneration + 1</code>, ... in list order.
     *
     * @param startingGeneration the generation of the first event. {@link Generation#first()} for a new aggregate,
     *                           otherwise the {@link Generation#next()} of the loaded aggregate's generation
     * @param events             the events to persist (all related to the same aggregate). An empty list is a no-op
     * @throws OptimisticAppendToStreamException if another writer already persisted an event with one of the generations
     * @throws AppendToStreamException           in case of any other storage failure
     */
    void persist(Generation startingGeneration, List<DomainEvent<ID, EVENT>> events);

    Class<AGGREGATE_TYPE> aggregateType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Default {@link Repository} implementation
     */
    class DefaultRepository<ID, EVENT, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> implements Repository<ID, EVENT, AGGREGATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(Repository.class);

        private final EventStore                          eventStore;
        private final AggregateEventMapper<ID, EVENT>     eventMapper;
        private final EventApplier<EVENT, AGGREGATE_TYPE> eventApplier;
        private final Class<AGGREGATE_TYPE>               aggregateType;

        public DefaultRepository(EventStore eventStore,
                                 AggregateEventMapper<ID, EVENT> eventMapper,
                                 EventApplier<EVENT, AGGREGATE_TYPE> eventApplier,
                                 Class<AGGREGATE_TYPE> aggregateType) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.eventMapper = requireNonNull(eventMapper, "You must supply an AggregateEventMapper instance");
            this.eventApplier = requireNonNull(eventApplier, "You must supply an EventApplier instance");
            this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
        }

        @Override
        public List<DomainEvent<ID, EVENT>> loadEvents(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            var storedEvents = eventStore.loadEvents(eventMapper.serializeAggregateId(aggregateId));
            var events       = new ArrayList<DomainEvent<ID, EVENT>>(storedEvents.size());
            for (var position = 0; position < storedEvents.size(); position++) {
                events.add(decode(storedEvents.get(position), position));
            }
            return events;
        }

        @Override
        public Optional<AGGREGATE_TYPE> tryGet(ID aggregateId) {
            log.trace("Trying to load {} with id '{}'", aggregateType.getSimpleName(), aggregateId);
            var events = loadEvents(aggregateId);
            if (events.isEmpty()) {
                log.debug("Didn't find a {} with id '{}'", aggregateType.getSimpleName(), aggregateId);
                return Optional.empty();
            }
            var aggregate = eventApplier.hydrate(events.stream()
                                                       .map(domainEvent -> domainEvent.event)
                                                       .collect(Collectors.toList()));
            aggregate.ifPresent(hydrated -> {
                if (!aggregateId.equals(hydrated.aggregateId())) {
                    throw new EventDecodingException(msg("The events stored for {} with id '{}' describe a {} with id '{}'",
                                                         aggregateType.getSimpleName(),
                                                         aggregateId,
                                                         aggregateType.getSimpleName(),
                                                         hydrated.aggregateId()));
                }
            });
            log.debug("Loaded {} with id '{}' from {} event(s)", aggregateType.getSimpleName(), aggregateId, events.size());
            return aggregate;
        }

        @Override
        public void persist(Generation startingGeneration, List<DomainEvent<ID, EVENT>> events) {
            requireNonNull(startingGeneration, "No startingGeneration provided");
            requireNonNull(events, "No events provided");
            if (events.isEmpty()) {
                log.trace("No events to persist for {}", aggregateType.getSimpleName());
                return;
            }

            var aggregateId  = events.get(0).aggregateId;
            var storedEvents = new ArrayList<StoredEvent>(events.size());
            for (var index = 0; index < events.size(); index++) {
                var domainEvent = events.get(index);
                if (!aggregateId.equals(domainEvent.aggregateId)) {
                    throw new IllegalArgumentException(msg("All events must belong to the same aggregate. Expected aggregate id '{}' but event '{}' belongs to '{}'",
                                                           aggregateId,
                                                           domainEvent.eventId,
                                                           domainEvent.aggregateId));
                }
                storedEvents.add(encode(domainEvent, startingGeneration.plus(index)));
            }

            if (log.isTraceEnabled()) {
                log.trace("Persisting {} event(s) related to {} with id '{}': {}", events.size(), aggregateType.getSimpleName(), aggregateId, storedEvents);
            } else {
                log.debug("Persisting {} event(s) related to {} with id '{}' starting at generation {}", events.size(), aggregateType.getSimpleName(), aggregateId, startingGeneration);
            }
            eventStore.appendEvents(storedEvents);
        }

        @Override
        public Class<AGGREGATE_TYPE> aggregateType() {
            return aggregateType;
        }

        private StoredEvent encode(DomainEvent<ID, EVENT> domainEvent, Generation generation) {
            return new StoredEvent(domainEvent.eventId.toString(),
                                   eventMapper.serializeAggregateId(domainEvent.aggregateId),
                                   generation,
                                   Rfc3339Timestamps.format(domainEvent.createdAt),
                                   eventMapper.eventTypeOf(domainEvent.event),
                                   eventMapper.serializeEvent(domainEvent.event));
        }

        private DomainEvent<ID, EVENT> decode(StoredEvent storedEvent, int position) {
            if (storedEvent.generation.longValue() != position) {
                throw new EventDecodingException(msg("{} with id '{}' has event '{}' with generation {} at position {}. The event stream has a gap or a duplicate",
                                                     aggregateType.getSimpleName(),
                                                     storedEvent.aggregateId,
                                                     storedEvent.eventId,
                                                     storedEvent.generation,
                                                     position),
                                                 storedEvent);
            }
            try {
                return DomainEvent.of(EventId.of(storedEvent.eventId),
                                      eventMapper.deserializeAggregateId(storedEvent.aggregateId),
                                      Rfc3339Timestamps.parse(storedEvent.createdAt),
                                      eventMapper.deserializeEvent(storedEvent.eventType, storedEvent.data));
            } catch (RuntimeException e) {
                throw new EventDecodingException(msg("Failed to decode event '{}' with generation {} related to {} with id '{}'",
                                                     storedEvent.eventId,
                                                     storedEvent.generation,
                                                     aggregateType.getSimpleName(),
                                                     storedEvent.aggregateId),
                                                 storedEvent,
                                                 e);
            }
        }

        @Override
        public String toString() {
            return "Repository{" +
                    "aggregateType=" + aggregateType.getName() +
                    ", eventStore=" + eventStore +
                    '}';
        }
    }
}
