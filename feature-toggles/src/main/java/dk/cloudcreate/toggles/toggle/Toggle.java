package dk.cloudcreate.toggles.toggle;

import dk.cloudcreate.toggles.eventsourced.aggregates.*;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.toggles.InvalidNameException.requireValidName;

/**
 * A feature toggle.<br>
 * The <code>version</code> starts at 0 and is increased every time the toggle is renamed.
 * A retired toggle can't be renamed until it has been revived.
 */
public final class Toggle implements Aggregate<ToggleId, Toggle> {
    public static final EventApplier<ToggleEvent, Toggle> APPLIER = Toggle::applyEvent;

    public final ToggleId   id;
    public final Generation generation;
    public final String     name;
    public final int        version;
    public final boolean    retired;

    private Toggle(ToggleId id, Generation generation, String name, int version, boolean retired) {
        this.id = id;
        this.generation = generation;
        this.name = name;
        this.version = version;
        this.retired = retired;
    }

    public static List<ToggleEvent> create(ToggleId id, String name) {
        requireNonNull(id, "No toggle id provided");
        return List.of(new ToggleEvent.Created(id, requireValidName(name)));
    }

    /**
     * @throws dk.cloudcreate.toggles.InvalidNameException if the name is blank
     * @throws InvalidStateEventException                  if the toggle is retired
     */
    public List<ToggleEvent> rename(String newName) {
        return decide(new ToggleEvent.Renamed(requireValidName(newName)));
    }

    /**
     * @throws InvalidStateEventException if the toggle is already retired
     */
    public List<ToggleEvent> retire() {
        return decide(new ToggleEvent.Retired());
    }

    /**
     * @throws InvalidStateEventException if the toggle isn't retired
     */
    public List<ToggleEvent> revive() {
        return decide(new ToggleEvent.Revived());
    }

    private List<ToggleEvent> decide(ToggleEvent event) {
        applyEvent(Optional.of(this), event);
        return List.of(event);
    }

    public static Toggle applyEvent(Optional<Toggle> currentState, ToggleEvent event) {
        requireNonNull(currentState, "No currentState provided");
        requireNonNull(event, "No event provided");
        if (currentState.isEmpty()) {
            if (event instanceof ToggleEvent.Created) {
                var created = (ToggleEvent.Created) event;
                return new Toggle(created.id, Generation.first(), created.name, 0, false);
            }
            throw new InvalidStateEventException(currentState, event);
        }

        var toggle = currentState.get();
        if (event instanceof ToggleEvent.Renamed && !toggle.retired) {
            return new Toggle(toggle.id, toggle.generation.next(), ((ToggleEvent.Renamed) event).name, toggle.version + 1, false);
        }
        if (event instanceof ToggleEvent.Retired && !toggle.retired) {
            return new Toggle(toggle.id, toggle.generation.next(), toggle.name, toggle.version, true);
        }
        if (event instanceof ToggleEvent.Revived && toggle.retired) {
            return new Toggle(toggle.id, toggle.generation.next(), toggle.name, toggle.version, false);
        }
        throw new InvalidStateEventException(currentState, event);
    }

    @Override
    public ToggleId aggregateId() {
        return id;
    }

    @Override
    public Generation generation() {
        return generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Toggle)) return false;
        Toggle toggle = (Toggle) o;
        return version == toggle.version &&
                retired == toggle.retired &&
                id.equals(toggle.id) &&
                generation.equals(toggle.generation) &&
                name.equals(toggle.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, generation, name, version, retired);
    }

    @Override
    public String toString() {
        return "Toggle{id=" + id + ", generation=" + generation + ", name='" + name + "', version=" + version + ", retired=" + retired + '}';
    }
}
