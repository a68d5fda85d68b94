package dk.cloudcreate.toggles.eventstore.postgresql;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when no events exist for the requested aggregate id
 */
public class AggregateNotFoundException extends EventStoreException {
    public final Object   aggregateId;
    public final Class<?> aggregateType;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateType) {
        super(msg("Couldn't find a '{}' aggregate with Id '{}'",
                  requireNonNull(aggregateType, "You must supply an aggregateType").getSimpleName(),
                  aggregateId));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateType = aggregateType;
    }
}
