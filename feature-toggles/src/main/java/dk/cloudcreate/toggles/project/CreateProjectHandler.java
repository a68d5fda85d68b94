package dk.cloudcreate.toggles.project;

import dk.cloudcreate.toggles.eventsourced.aggregates.DomainEvent;
import dk.cloudcreate.toggles.eventsourced.aggregates.repository.Repository;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;
import org.slf4j.*;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates new {@link Project}'s.<br>
 * The project id and the event ids are taken from the <code>idGenerator</code> (project id first) and
 * the event timestamps from the <code>clock</code>.
 */
public class CreateProjectHandler {
    private static final Logger log = LoggerFactory.getLogger(CreateProjectHandler.class);

    private final Repository<ProjectId, ProjectEvent, Project> repository;
    private final Supplier<UUID>                               idGenerator;
    private final Clock                                        clock;

    public CreateProjectHandler(Repository<ProjectId, ProjectEvent, Project> repository) {
        this(repository, UUID::randomUUID, Clock.systemUTC());
    }

    public CreateProjectHandler(Repository<ProjectId, ProjectEvent, Project> repository,
                                Supplier<UUID> idGenerator,
                                Clock clock) {
        this.repository = requireNonNull(repository, "No repository provided");
        this.idGenerator = requireNonNull(idGenerator, "No idGenerator provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    /**
     * @return the created project
     * @throws dk.cloudcreate.toggles.InvalidNameException if the name is blank
     */
    public Project handle(CreateProject command) {
        requireNonNull(command, "No command provided");
        var projectId = ProjectId.of(idGenerator.get());
        var events    = Project.create(projectId, command.name);
        var project = Project.APPLIER.hydrate(events)
                                     .orElseThrow(() -> new IllegalStateException("Creating a project resulted in no events"));
        repository.persist(Generation.first(), DomainEvent.wrap(projectId, events, idGenerator, clock));
        log.debug("Created {}", project);
        return project;
    }
}
