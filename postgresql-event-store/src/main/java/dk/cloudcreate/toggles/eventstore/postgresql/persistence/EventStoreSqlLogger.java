package dk.cloudcreate.toggles.eventstore.postgresql.persistence;

import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class EventStoreSqlLogger implements org.jdbi.v3.core.statement.SqlLogger {
    private final Logger log;

    public EventStoreSqlLogger() {
        log = LoggerFactory.getLogger("EventStore.Sql");
    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}", durationInMs(context, context.getCompletionMoment()), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        log.error(msg("Failed Execution time: {} ms - {}", durationInMs(context, context.getExceptionMoment()), context.getRenderedSql()), ex);
    }

    private static long durationInMs(StatementContext context, java.time.Instant endMoment) {
        if (context.getExecutionMoment() == null || endMoment == null) {
            return -1;
        }
        return Duration.between(context.getExecutionMoment(), endMoment).toMillis();
    }
}
