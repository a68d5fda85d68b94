package dk.cloudcreate.toggles.eventstore.postgresql.types;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Zero based position of an event within the event stream of a single aggregate instance.<br>
 * The first event persisted for an aggregate has {@link #first()}, every following event has the {@link #next()} generation
 * of its predecessor, so the generation of the N'th event (counting from 0) is always N.<br>
 * <br>
 * The generation also acts as the optimistic concurrency token: the storage only accepts one event per
 * aggregate id and generation, so two writers racing to append the same generation cannot both succeed.
 */
public class Generation extends LongType<Generation> {
    private static final Generation FIRST = new Generation(0L);

    public Generation(Long value) {
        super(value);
        requireTrue(value >= 0, msg("Generation must be 0 or larger, but was {}", value));
    }

    public static Generation of(long value) {
        return new Generation(value);
    }

    /**
     * @return the generation of the first event of an aggregate (0)
     */
    public static Generation first() {
        return FIRST;
    }

    /**
     * @return the generation that follows this generation
     */
    public Generation next() {
        return new Generation(value() + 1);
    }

    /**
     * @param numberOfGenerations how many generations to advance
     * @return the generation that lies <code>numberOfGenerations</code> after this generation
     */
    public Generation plus(int numberOfGenerations) {
        requireTrue(numberOfGenerations >= 0, "numberOfGenerations must be 0 or larger");
        return new Generation(value() + numberOfGenerations);
    }
}
