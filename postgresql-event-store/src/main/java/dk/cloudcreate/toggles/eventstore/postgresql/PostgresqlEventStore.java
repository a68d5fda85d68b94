package dk.cloudcreate.toggles.eventstore.postgresql;

import dk.cloudcreate.essentials.shared.Exceptions;
import dk.cloudcreate.toggles.common.transaction.*;
import dk.cloudcreate.toggles.eventstore.postgresql.eventstream.StoredEvent;
import dk.cloudcreate.toggles.eventstore.postgresql.persistence.*;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.sql.SQLException;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;

/**
 * Postgresql backed {@link EventStore}.<br>
 * All events are kept in a single table (see {@link EventStoreConfiguration#tableName}) with the columns
 * <code>id, aggregate_id, generation, created_at, type, data</code>. The table, its <code>(aggregate_id, generation)</code>
 * unique constraint and the <code>aggregate_id</code> index are created when the event store is constructed, unless they already exist.<br>
 * <br>
 * Every operation joins the {@link UnitOfWork} that is active on the calling thread. If none is active, the operation
 * runs in its own {@link UnitOfWork} that is committed (or rolled back) before the method returns.<br>
 * A failed append leaves a joined {@link UnitOfWork} marked as rollback only, and Postgresql rejects any further statement in it.
 */
public class PostgresqlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final EventStoreConfiguration                                        configuration;
    private final StoredEventRowMapper                                           rowMapper;

    public PostgresqlEventStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, EventStoreConfiguration.defaultConfiguration());
    }

    public PostgresqlEventStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                                EventStoreConfiguration configuration) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.rowMapper = new StoredEventRowMapper();
        unitOfWorkFactory.getJdbi().setSqlLogger(new EventStoreSqlLogger());
        initializeStorage();
    }

    private void initializeStorage() {
        log.info("Initializing event storage using {}", configuration);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            createEventsTable(handle);
            createAggregateIdIndex(handle);
        });
    }

    private void createEventsTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "    id TEXT PRIMARY KEY,\n" +
                                    "    aggregate_id TEXT NOT NULL,\n" +
                                    "    generation INTEGER NOT NULL,\n" +
                                    "    created_at TEXT NOT NULL,\n" +
                                    "    type TEXT NOT NULL,\n" +
                                    "    data TEXT NOT NULL,\n" +
                                    "    CONSTRAINT {:constraintName} UNIQUE (aggregate_id, generation)\n" +
                                    ")",
                            arg("tableName", configuration.tableName),
                            arg("constraintName", configuration.aggregateIdGenerationConstraintName())));
        log.debug("Ensured that table '{}' exists", configuration.tableName);
    }

    private void createAggregateIdIndex(Handle handle) {
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:tableName}_aggregate_id_idx ON {:tableName} (aggregate_id)",
                            arg("tableName", configuration.tableName)));
        log.debug("Ensured that index '{}_aggregate_id_idx' exists", configuration.tableName);
    }

    @Override
    public List<StoredEvent> loadEvents(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var events = unitOfWork.handle()
                                   .createQuery(bind("SELECT id, aggregate_id, generation, created_at, type, data FROM {:tableName}\n" +
                                                             " WHERE aggregate_id = :aggregateId\n" +
                                                             " ORDER BY generation ASC",
                                                     arg("tableName", configuration.tableName)))
                                   .setFetchSize(configuration.queryFetchSize)
                                   .bind("aggregateId", aggregateId)
                                   .map(rowMapper)
                                   .list();
            log.debug("Loaded {} event(s) related to aggregate with id '{}'", events.size(), aggregateId);
            return events;
        });
    }

    @Override
    public void appendEvents(List<StoredEvent> events) {
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            log.trace("No events to append");
            return;
        }

        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            try {
                var batch = unitOfWork.handle()
                                      .prepareBatch(bind("INSERT INTO {:tableName} (id, aggregate_id, generation, created_at, type, data)\n" +
                                                                 " VALUES (:id, :aggregateId, :generation, :createdAt, :type, :data)",
                                                         arg("tableName", configuration.tableName)));
                events.forEach(event -> batch.bind("id", event.eventId)
                                             .bind("aggregateId", event.aggregateId)
                                             .bind("generation", Math.toIntExact(event.generation.longValue()))
                                             .bind("createdAt", event.createdAt)
                                             .bind("type", event.eventType)
                                             .bind("data", event.data)
                                             .add());
                batch.execute();
            } catch (RuntimeException e) {
                throw translateAppendFailure(events, e);
            }
            log.debug("Appended {} event(s) with generations {} to {}",
                      events.size(),
                      events.get(0).generation,
                      events.get(events.size() - 1).generation);
        });
    }

    private AppendToStreamException translateAppendFailure(List<StoredEvent> events, RuntimeException e) {
        var firstEvent = events.get(0);
        if (isUniqueViolationOf(e, configuration.aggregateIdGenerationConstraintName())) {
            var cause = Exceptions.getRootCause(e);
            log.debug("Optimistic concurrency conflict appending {} event(s) to aggregate with id '{}' starting at generation {}",
                      events.size(), firstEvent.aggregateId, firstEvent.generation);
            return new OptimisticAppendToStreamException(msg("Optimistic Concurrency Exception Failed to Append {} Events to Stream related to aggregate with id '{}'. " +
                                                                     "First event was appended with generation {}. Details: {}",
                                                             events.size(),
                                                             firstEvent.aggregateId,
                                                             firstEvent.generation,
                                                             cause.getMessage()),
                                                         firstEvent.aggregateId,
                                                         firstEvent.generation,
                                                         e);
        }
        return new AppendToStreamException(msg("Failed to Append {} Events to Stream related to aggregate with id '{}'",
                                               events.size(),
                                               firstEvent.aggregateId), e);
    }

    /**
     * Walks the cause chain (including chained {@link SQLException#getNextException()}'s, which is where batch failures end up)
     * looking for a unique constraint violation of the given constraint. Postgresql reports the constraint name in double quotes
     */
    static boolean isUniqueViolationOf(Throwable failure, String constraintName) {
        var quotedConstraintName = "\"" + constraintName + "\"";
        var visited = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
        var pending = new ArrayDeque<Throwable>();
        pending.push(failure);
        while (!pending.isEmpty()) {
            var current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            var message = current.getMessage();
            if (message != null && message.contains(quotedConstraintName)) {
                if (!(current instanceof SQLException) ||
                        UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) current).getSQLState()) ||
                        message.contains("duplicate key value violates unique constraint")) {
                    return true;
                }
            }
            if (current instanceof SQLException && ((SQLException) current).getNextException() != null) {
                pending.push(((SQLException) current).getNextException());
            }
            if (current.getCause() != null) {
                pending.push(current.getCause());
            }
        }
        return false;
    }
}
