package dk.cloudcreate.domainkit.eventstore.postgresql;

import dk.cloudcreate.domainkit.eventsourced.aggregates.store.StoredEvent;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;
import java.util.UUID;

class StoredEventRowMapper implements RowMapper<StoredEvent> {
    @Override
    public StoredEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new StoredEvent().aggregateId(rs.getString("aggregate_id"))
                                .version(rs.getLong("version"))
                                .eventId(UUID.fromString(rs.getString("event_id")))
                                .eventType(rs.getString("event_type"))
                                .event(rs.getString("event"))
                                .timestamp(rs.getObject("added_ts", OffsetDateTime.class));
    }
}
