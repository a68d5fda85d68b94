package dk.cloudcreate.toggles;

import dk.cloudcreate.toggles.eventsourced.aggregates.AggregateException;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a project or toggle is given a name that is null or blank
 */
public class InvalidNameException extends AggregateException {
    public final String name;

    public InvalidNameException(String name) {
        super(msg("invalid name: '{}'", name));
        this.name = name;
    }

    /**
     * @param name the name to validate
     * @return the name
     * @throws InvalidNameException if the name is null or blank
     */
    public static String requireValidName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidNameException(name);
        }
        return name;
    }
}
