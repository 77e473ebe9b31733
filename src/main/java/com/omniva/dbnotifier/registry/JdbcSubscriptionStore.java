package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.engine.fault.DuplicateSubscriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.omniva.dbnotifier.engine.postgres.SqlQuoting.quoteIdent;
import static com.omniva.dbnotifier.engine.postgres.SqlQuoting.quoteQualified;

/**
 * Registry rows in a PostgreSQL table. Column and event lists are {@code text[]}; uniqueness is
 * enforced by a unique index over {@code (table_name, channel_name, COALESCE(notif_name, ''), events)}.
 */
public class JdbcSubscriptionStore implements SubscriptionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSubscriptionStore.class);

    private static final String SELECT_COLUMNS =
            "id, table_name, channel_name, notif_name, columns, events, trg_fn_name, trg_name";

    private final JdbcTemplate jdbcTemplate;
    private final String registryTable;
    private final String qualifiedTable;

    public JdbcSubscriptionStore(JdbcTemplate jdbcTemplate, String registryTable) {
        this.jdbcTemplate = jdbcTemplate;
        this.registryTable = registryTable;
        this.qualifiedTable = quoteQualified(registryTable);
    }

    /**
     * Create the registry table and its unique index if they are missing
     */
    public void initializeSchema() {
        log.info("Ensuring registry table {} exists", registryTable);
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                    id serial PRIMARY KEY,
                    table_name text NOT NULL,
                    channel_name text NOT NULL,
                    notif_name text,
                    columns text[] NOT NULL,
                    events text[] NOT NULL,
                    trg_fn_name text,
                    trg_name text
                )""".formatted(qualifiedTable));
        jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS %s ON %s (table_name, channel_name, COALESCE(notif_name, ''), events)"
                .formatted(quoteIdent(unqualifiedName() + "_unique_key"), qualifiedTable));
    }

    @Override
    public Subscription insert(Subscription subscription) {
        String sql = "INSERT INTO " + qualifiedTable
                + " (table_name, channel_name, notif_name, columns, events, trg_fn_name, trg_name)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?) RETURNING id";
        try {
            Long id = jdbcTemplate.execute((ConnectionCallback<Long>) connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    bindRow(connection, statement, subscription);
                    try (ResultSet rs = statement.executeQuery()) {
                        rs.next();
                        return rs.getLong(1);
                    }
                }
            });
            return subscription.toBuilder().id(id).build();
        } catch (DuplicateKeyException e) {
            throw duplicate(subscription, e);
        }
    }

    @Override
    public boolean update(Subscription subscription) {
        String sql = "UPDATE " + qualifiedTable
                + " SET table_name = ?, channel_name = ?, notif_name = ?, columns = ?, events = ?,"
                + " trg_fn_name = ?, trg_name = ? WHERE id = ?";
        try {
            Integer updated = jdbcTemplate.execute((ConnectionCallback<Integer>) connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    bindRow(connection, statement, subscription);
                    statement.setLong(8, subscription.getId());
                    return statement.executeUpdate();
                }
            });
            return updated != null && updated > 0;
        } catch (DuplicateKeyException e) {
            throw duplicate(subscription, e);
        }
    }

    @Override
    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM " + qualifiedTable + " WHERE id = ?", id) > 0;
    }

    @Override
    public Optional<Subscription> find(long id) {
        return jdbcTemplate.query("SELECT " + SELECT_COLUMNS + " FROM " + qualifiedTable + " WHERE id = ?",
                ROW_MAPPER, id).stream().findFirst();
    }

    @Override
    public Optional<Subscription> findForUpdate(long id) {
        return jdbcTemplate.query("SELECT " + SELECT_COLUMNS + " FROM " + qualifiedTable + " WHERE id = ? FOR UPDATE",
                ROW_MAPPER, id).stream().findFirst();
    }

    @Override
    public List<Subscription> findByTable(String tableName) {
        return jdbcTemplate.query("SELECT " + SELECT_COLUMNS + " FROM " + qualifiedTable + " WHERE table_name = ? ORDER BY id",
                ROW_MAPPER, tableName);
    }

    @Override
    public List<Subscription> findByHandlerName(String handlerName) {
        return jdbcTemplate.query("SELECT " + SELECT_COLUMNS + " FROM " + qualifiedTable + " WHERE trg_fn_name = ? ORDER BY id",
                ROW_MAPPER, handlerName);
    }

    @Override
    public List<Subscription> list() {
        return jdbcTemplate.query("SELECT " + SELECT_COLUMNS + " FROM " + qualifiedTable + " ORDER BY id", ROW_MAPPER);
    }

    private void bindRow(Connection connection, PreparedStatement statement, Subscription subscription)
            throws SQLException {
        statement.setString(1, subscription.getTableName());
        statement.setString(2, subscription.getChannelName());
        if (subscription.getNotifName() != null) {
            statement.setString(3, subscription.getNotifName());
        } else {
            statement.setNull(3, Types.VARCHAR);
        }
        statement.setArray(4, connection.createArrayOf("text", subscription.getColumns().toArray()));
        statement.setArray(5, connection.createArrayOf("text", subscription.getEvents().toArray()));
        statement.setString(6, subscription.getGeneratedHandlerName());
        statement.setString(7, subscription.getGeneratedArtifactName());
    }

    private DuplicateSubscriptionException duplicate(Subscription subscription, DuplicateKeyException e) {
        return new DuplicateSubscriptionException(String.format(
                "A subscription for table %s, channel %s, name %s and events %s already exists in %s",
                subscription.getTableName(), subscription.getChannelName(), subscription.getNotifName(),
                subscription.getEvents(), registryTable), e);
    }

    private String unqualifiedName() {
        int dot = registryTable.lastIndexOf('.');
        return dot < 0 ? registryTable : registryTable.substring(dot + 1);
    }

    private static final RowMapper<Subscription> ROW_MAPPER = (rs, rowNum) -> Subscription.builder()
            .id(rs.getLong("id"))
            .tableName(rs.getString("table_name"))
            .channelName(rs.getString("channel_name"))
            .notifName(rs.getString("notif_name"))
            .columns(toList(rs.getArray("columns")))
            .events(toList(rs.getArray("events")))
            .generatedHandlerName(rs.getString("trg_fn_name"))
            .generatedArtifactName(rs.getString("trg_name"))
            .build();

    private static List<String> toList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        return Arrays.stream((Object[]) array.getArray())
                .map(String.class::cast)
                .toList();
    }
}
