package dk.cloudcreate.toggles.eventsourced.aggregates;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by an {@link EventApplier} when an event can't be applied to the current state of the aggregate
 */
public class InvalidStateEventException extends AggregateException {
    public final String state;
    public final String event;

    public InvalidStateEventException(Optional<?> state, Object event) {
        this(describe(state), String.valueOf(event));
    }

    public InvalidStateEventException(String state, String event) {
        super(msg("Event {} is not valid for state {}", event, state));
        this.state = state;
        this.event = event;
    }

    private static String describe(Optional<?> state) {
        return state == null ? "None" : state.map(String::valueOf).orElse("None");
    }
}
