package dk.cloudcreate.toggles.test_data;

import dk.cloudcreate.toggles.eventstore.postgresql.EventStore;
import dk.cloudcreate.toggles.eventstore.postgresql.eventstream.StoredEvent;
import dk.cloudcreate.toggles.eventstore.postgresql.persistence.OptimisticAppendToStreamException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * In memory {@link EventStore} that rejects duplicate generations. It can be told to let a competing writer
 * append its events right before the next append, or to reject a number of appends outright
 */
public class RecordingEventStore implements EventStore {
    private final List<StoredEvent> events = new ArrayList<>();
    private final List<StoredEvent> competingEvents = new ArrayList<>();
    private       int               appendsToReject;
    public        int               numberOfAppendAttempts;

    @Override
    public synchronized List<StoredEvent> loadEvents(String aggregateId) {
        return events.stream()
                     .filter(event -> event.aggregateId.equals(aggregateId))
                     .sorted(Comparator.comparing(event -> event.generation.longValue()))
                     .collect(Collectors.toList());
    }

    @Override
    public synchronized void appendEvents(List<StoredEvent> eventsToAppend) {
        numberOfAppendAttempts++;
        var first = eventsToAppend.get(0);
        if (!competingEvents.isEmpty()) {
            events.addAll(competingEvents);
            competingEvents.clear();
        }
        if (appendsToReject > 0) {
            appendsToReject--;
            throw new OptimisticAppendToStreamException("Simulated concurrent writer", first.aggregateId, first.generation, new IllegalStateException("simulated"));
        }
        for (var event : eventsToAppend) {
            var exists = events.stream().anyMatch(existing -> existing.aggregateId.equals(event.aggregateId) && existing.generation.equals(event.generation));
            if (exists) {
                throw new OptimisticAppendToStreamException("Generation already exists", event.aggregateId, event.generation, new IllegalStateException("duplicate"));
            }
        }
        events.addAll(eventsToAppend);
    }

    /**
     * The given events are stored, as if written by another writer, right before the next append is attempted
     */
    public synchronized void competingWriterAppendsBeforeNextAppend(StoredEvent... events) {
        competingEvents.addAll(Arrays.asList(events));
    }

    public synchronized void rejectNextAppends(int numberOfAppends) {
        appendsToReject = numberOfAppends;
    }

    public synchronized List<StoredEvent> allEvents() {
        return new ArrayList<>(events);
    }
}
