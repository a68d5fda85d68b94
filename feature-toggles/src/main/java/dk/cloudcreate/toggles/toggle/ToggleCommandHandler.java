package dk.cloudcreate.toggles.toggle;

import dk.cloudcreate.toggles.eventsourced.aggregates.DomainEvent;
import dk.cloudcreate.toggles.eventsourced.aggregates.repository.Repository;
import dk.cloudcreate.toggles.eventsourced.aggregates.retry.*;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;
import dk.cloudcreate.toggles.toggle.ToggleCommands.*;
import org.slf4j.*;

import java.time.Clock;
import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Handles the {@link ToggleCommands}.<br>
 * Commands that change an existing {@link Toggle} load it, decide the new events, apply them and persist them at the
 * generation following the loaded toggle. If another writer changed the toggle in the meantime the whole attempt is
 * repeated according to the {@link OptimisticConcurrencyRetry}.
 */
public class ToggleCommandHandler {
    private static final Logger log = LoggerFactory.getLogger(ToggleCommandHandler.class);

    private final Repository<ToggleId, ToggleEvent, Toggle> repository;
    private final Supplier<UUID>                            idGenerator;
    private final Clock                                     clock;
    private final OptimisticConcurrencyRetry                retry;

    public ToggleCommandHandler(Repository<ToggleId, ToggleEvent, Toggle> repository) {
        this(repository, UUID::randomUUID, Clock.systemUTC(), new OptimisticConcurrencyRetry(ConcurrencyRetryPolicy.defaultPolicy()));
    }

    public ToggleCommandHandler(Repository<ToggleId, ToggleEvent, Toggle> repository,
                                Supplier<UUID> idGenerator,
                                Clock clock,
                                OptimisticConcurrencyRetry retry) {
        this.repository = requireNonNull(repository, "No repository provided");
        this.idGenerator = requireNonNull(idGenerator, "No idGenerator provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.retry = requireNonNull(retry, "No retry provided");
    }

    public Toggle handle(CreateToggle command) {
        requireNonNull(command, "No command provided");
        var toggleId = ToggleId.of(idGenerator.get());
        var events   = Toggle.create(toggleId, command.name);
        var toggle = Toggle.APPLIER.hydrate(events)
                                   .orElseThrow(() -> new IllegalStateException("Creating a toggle resulted in no events"));
        repository.persist(Generation.first(), DomainEvent.wrap(toggleId, events, idGenerator, clock));
        log.debug("Created {}", toggle);
        return toggle;
    }

    public Toggle handle(RenameToggle command) {
        requireNonNull(command, "No command provided");
        return update(command.id, toggle -> toggle.rename(command.name));
    }

    public Toggle handle(RetireToggle command) {
        requireNonNull(command, "No command provided");
        return update(command.id, Toggle::retire);
    }

    public Toggle handle(ReviveToggle command) {
        requireNonNull(command, "No command provided");
        return update(command.id, Toggle::revive);
    }

    /**
     * @throws dk.cloudcreate.toggles.eventstore.postgresql.AggregateNotFoundException if the toggle doesn't exist
     */
    public Toggle handle(GetToggle query) {
        requireNonNull(query, "No query provided");
        return repository.get(query.id);
    }

    private Toggle update(ToggleId toggleId, Function<Toggle, List<ToggleEvent>> decide) {
        return retry.execute(() -> {
            var current = repository.get(toggleId);
            var events  = decide.apply(current);
            var updated = current;
            for (var event : events) {
                updated = Toggle.APPLIER.applyEvent(Optional.of(updated), event);
            }
            repository.persist(current.generation().next(), DomainEvent.wrap(toggleId, events, idGenerator, clock));
            log.debug("Updated {} to {}", current, updated);
            return updated;
        });
    }
}
