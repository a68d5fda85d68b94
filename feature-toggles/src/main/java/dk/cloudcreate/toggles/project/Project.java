package dk.cloudcreate.toggles.project;

import dk.cloudcreate.toggles.eventsourced.aggregates.*;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.toggles.InvalidNameException.requireValidName;

/**
 * A project groups feature toggles. A project only has a name and can't change after it has been created.
 */
public final class Project implements Aggregate<ProjectId, Project> {
    public static final EventApplier<ProjectEvent, Project> APPLIER = Project::applyEvent;

    public final ProjectId  id;
    public final Generation generation;
    public final String     name;

    private Project(ProjectId id, Generation generation, String name) {
        this.id = id;
        this.generation = generation;
        this.name = name;
    }

    /**
     * Decide the events that create a new project
     *
     * @param id   the id of the new project
     * @param name the name of the project
     * @return the {@link ProjectEvent.Created} event
     * @throws dk.cloudcreate.toggles.InvalidNameException if the name is blank
     */
    public static List<ProjectEvent> create(ProjectId id, String name) {
        requireNonNull(id, "No project id provided");
        return List.of(new ProjectEvent.Created(id, requireValidName(name)));
    }

    public static Project applyEvent(Optional<Project> currentState, ProjectEvent event) {
        requireNonNull(currentState, "No currentState provided");
        requireNonNull(event, "No event provided");
        if (currentState.isEmpty() && event instanceof ProjectEvent.Created) {
            var created = (ProjectEvent.Created) event;
            return new Project(created.id, Generation.first(), created.name);
        }
        throw new InvalidStateEventException(currentState, event);
    }

    @Override
    public ProjectId aggregateId() {
        return id;
    }

    @Override
    public Generation generation() {
        return generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Project)) return false;
        Project project = (Project) o;
        return id.equals(project.id) && generation.equals(project.generation) && name.equals(project.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, generation, name);
    }

    @Override
    public String toString() {
        return "Project{id=" + id + ", generation=" + generation + ", name='" + name + "'}";
    }
}
