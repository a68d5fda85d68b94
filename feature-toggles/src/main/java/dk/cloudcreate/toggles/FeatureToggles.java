package dk.cloudcreate.toggles;

import dk.cloudcreate.toggles.common.transaction.*;
import dk.cloudcreate.toggles.eventsourced.aggregates.repository.Repository;
import dk.cloudcreate.toggles.eventsourced.aggregates.retry.*;
import dk.cloudcreate.toggles.eventstore.postgresql.*;
import dk.cloudcreate.toggles.eventstore.postgresql.serializer.json.*;
import dk.cloudcreate.toggles.project.*;
import dk.cloudcreate.toggles.toggle.*;
import org.slf4j.*;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Wires the project and toggle handlers on top of a single {@link EventStore}
 */
public class FeatureToggles {
    private static final Logger log = LoggerFactory.getLogger(FeatureToggles.class);

    public final EventStore                                    eventStore;
    public final Repository<ProjectId, ProjectEvent, Project> projectRepository;
    public final Repository<ToggleId, ToggleEvent, Toggle>    toggleRepository;
    public final CreateProjectHandler                          createProjectHandler;
    public final GetProjectHandler                             getProjectHandler;
    public final ToggleCommandHandler                          toggleCommandHandler;

    public FeatureToggles(EventStore eventStore,
                          JSONSerializer jsonSerializer,
                          Supplier<UUID> idGenerator,
                          Clock clock,
                          ConcurrencyRetryPolicy retryPolicy) {
        this(eventStore, jsonSerializer, idGenerator, clock, new OptimisticConcurrencyRetry(retryPolicy));
    }

    public FeatureToggles(EventStore eventStore,
                          JSONSerializer jsonSerializer,
                          Supplier<UUID> idGenerator,
                          Clock clock,
                          OptimisticConcurrencyRetry retry) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        requireNonNull(jsonSerializer, "No jsonSerializer provided");
        requireNonNull(retry, "No retry provided");
        projectRepository = Repository.from(eventStore, new ProjectEventMapper(jsonSerializer), Project.APPLIER, Project.class);
        toggleRepository = Repository.from(eventStore, new ToggleEventMapper(jsonSerializer), Toggle.APPLIER, Toggle.class);
        createProjectHandler = new CreateProjectHandler(projectRepository, idGenerator, clock);
        getProjectHandler = new GetProjectHandler(projectRepository);
        toggleCommandHandler = new ToggleCommandHandler(toggleRepository, idGenerator, clock, retry);
        log.info("Feature toggles initialized using {} and {}", eventStore.getClass().getSimpleName(), retry);
    }

    /**
     * Feature toggles backed by a {@link PostgresqlEventStore} with the default configuration, random ids and the UTC system clock.<br>
     * Conflicting toggle updates are retried unless they were issued inside an already active {@link UnitOfWork}
     */
    public static FeatureToggles usingPostgresql(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        return new FeatureToggles(new PostgresqlEventStore(unitOfWorkFactory),
                                  JacksonJSONSerializer.createDefault(),
                                  UUID::randomUUID,
                                  Clock.systemUTC(),
                                  new OptimisticConcurrencyRetry(ConcurrencyRetryPolicy.defaultPolicy(), unitOfWorkFactory));
    }
}
