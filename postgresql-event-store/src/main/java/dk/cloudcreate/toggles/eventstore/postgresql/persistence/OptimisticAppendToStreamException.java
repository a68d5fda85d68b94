package dk.cloudcreate.toggles.eventstore.postgresql.persistence;

import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;

/**
 * Thrown when another writer already appended an event with the same aggregate id and {@link Generation}.<br>
 * The caller is expected to reload the aggregate and retry the command.
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public final String     aggregateId;
    public final Generation generation;

    public OptimisticAppendToStreamException(String msg, String aggregateId, Generation generation, RuntimeException cause) {
        super(msg, cause);
        this.aggregateId = aggregateId;
        this.generation = generation;
    }
}
