package dk.cloudcreate.toggles.eventsourced.aggregates.repository;

import dk.cloudcreate.toggles.eventstore.postgresql.serializer.json.*;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link AggregateEventMapper} that stores events as JSON using a {@link JSONSerializer}
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the aggregate's event type
 */
public class JSONAggregateEventMapper<ID, EVENT> implements AggregateEventMapper<ID, EVENT> {
    private final JSONSerializer          jsonSerializer;
    private final Class<EVENT>            eventClass;
    private final Function<ID, String>    aggregateIdSerializer;
    private final Function<String, ID>    aggregateIdDeserializer;
    private final Function<EVENT, String> eventTypeResolver;

    /**
     * @param jsonSerializer          the serializer used for the event payload
     * @param eventClass              the (base) event class the payload is deserialized into
     * @param aggregateIdSerializer   converts an aggregate id into its stored form
     * @param aggregateIdDeserializer parses a stored aggregate id; must throw if the value is invalid
     * @param eventTypeResolver       resolves the discriminator of an event
     */
    public JSONAggregateEventMapper(JSONSerializer jsonSerializer,
                                    Class<EVENT> eventClass,
                                    Function<ID, String> aggregateIdSerializer,
                                    Function<String, ID> aggregateIdDeserializer,
                                    Function<EVENT, String> eventTypeResolver) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.eventClass = requireNonNull(eventClass, "No eventClass provided");
        this.aggregateIdSerializer = requireNonNull(aggregateIdSerializer, "No aggregateIdSerializer provided");
        this.aggregateIdDeserializer = requireNonNull(aggregateIdDeserializer, "No aggregateIdDeserializer provided");
        this.eventTypeResolver = requireNonNull(eventTypeResolver, "No eventTypeResolver provided");
    }

    @Override
    public String serializeAggregateId(ID aggregateId) {
        return aggregateIdSerializer.apply(requireNonNull(aggregateId, "No aggregateId provided"));
    }

    @Override
    public ID deserializeAggregateId(String aggregateId) {
        return requireNonNull(aggregateIdDeserializer.apply(requireNonNull(aggregateId, "No aggregateId provided")),
                              "aggregateIdDeserializer returned null");
    }

    @Override
    public String eventTypeOf(EVENT event) {
        return eventTypeResolver.apply(requireNonNull(event, "No event provided"));
    }

    @Override
    public String serializeEvent(EVENT event) {
        return jsonSerializer.serialize(requireNonNull(event, "No event provided"));
    }

    @Override
    public EVENT deserializeEvent(String eventType, String data) {
        requireNonNull(eventType, "No eventType provided");
        var event = jsonSerializer.deserialize(requireNonNull(data, "No data provided"), eventClass);
        if (event == null) {
            throw new JSONDeserializationException(msg("Event data '{}' deserialized to null", data));
        }
        var actualEventType = eventTypeOf(event);
        if (!eventType.equals(actualEventType)) {
            throw new JSONDeserializationException(msg("Expected an event of type '{}' but the data contained an event of type '{}'",
                                                       eventType,
                                                       actualEventType));
        }
        return event;
    }
}
