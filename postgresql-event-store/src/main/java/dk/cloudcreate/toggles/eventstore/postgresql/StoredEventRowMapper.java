package dk.cloudcreate.toggles.eventstore.postgresql;

import dk.cloudcreate.toggles.eventstore.postgresql.eventstream.StoredEvent;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;

class StoredEventRowMapper implements RowMapper<StoredEvent> {
    @Override
    public StoredEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new StoredEvent(rs.getString("id"),
                               rs.getString("aggregate_id"),
                               Generation.of(rs.getLong("generation")),
                               rs.getString("created_at"),
                               rs.getString("type"),
                               rs.getString("data"));
    }
}
