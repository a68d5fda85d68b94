package dk.cloudcreate.toggles.eventstore.postgresql;

import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configuration of the {@link PostgresqlEventStore}
 */
public class EventStoreConfiguration {
    public static final String DEFAULT_EVENTS_TABLE_NAME = "events";
    public static final int    DEFAULT_QUERY_FETCH_SIZE  = 100;

    private static final Pattern VALID_TABLE_NAME = Pattern.compile("^[a-z_][a-z0-9_]{0,34}$");

    /**
     * Name of the table that stores the events. The table name is used directly in SQL as an unquoted identifier, so only
     * lower case letters, digits and underscore are allowed. Postgresql folds unquoted identifiers to lower case and reports
     * constraint violations using the folded name
     */
    public final String tableName;
    /**
     * JDBC fetch size used when loading events
     */
    public final int    queryFetchSize;

    public EventStoreConfiguration(String tableName, int queryFetchSize) {
        this.tableName = requireNonNull(tableName, "No tableName provided");
        requireTrue(VALID_TABLE_NAME.matcher(tableName).matches(), msg("Invalid tableName '{}'", tableName));
        requireTrue(queryFetchSize > 0, msg("queryFetchSize must be larger than 0, but was {}", queryFetchSize));
        this.queryFetchSize = queryFetchSize;
    }

    public static EventStoreConfiguration defaultConfiguration() {
        return new EventStoreConfiguration(DEFAULT_EVENTS_TABLE_NAME, DEFAULT_QUERY_FETCH_SIZE);
    }

    public static EventStoreConfiguration withTableName(String tableName) {
        return new EventStoreConfiguration(tableName, DEFAULT_QUERY_FETCH_SIZE);
    }

    /**
     * @return the name of the unique constraint that guards against two events with the same aggregate id and generation
     */
    public String aggregateIdGenerationConstraintName() {
        return tableName + "_aggregate_id_generation_key";
    }

    @Override
    public String toString() {
        return "EventStoreConfiguration{" +
                "tableName='" + tableName + '\'' +
                ", queryFetchSize=" + queryFetchSize +
                '}';
    }
}
