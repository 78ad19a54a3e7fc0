package com.chimera.core.persistence;

import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;
import com.chimera.core.model.Fact;
import com.chimera.core.model.Link;
import com.chimera.core.model.LinkStatus;
import com.chimera.core.model.OperationRecord;
import com.chimera.core.model.OperationStatus;
import com.chimera.core.model.Provenance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link OperationJournal}.
 * <p>
 * Rows are written with an update-then-insert so the same SQL runs on
 * PostgreSQL and on embedded databases. Agent executor lists are stored as JSON.
 * Tables are created by {@link #createTables()}.
 */
public class JdbcOperationJournal implements OperationJournal {

    private static final Logger log = LoggerFactory.getLogger(JdbcOperationJournal.class);

    private static final List<String> CREATE_TABLES_SQL = List.of("""
            CREATE TABLE IF NOT EXISTS chimera_agents (
                paw            VARCHAR(64) PRIMARY KEY,
                platform       VARCHAR(64),
                hostname       VARCHAR(255),
                agent_group    VARCHAR(128),
                executors      TEXT,
                sleep_seconds  INT NOT NULL,
                jitter_seconds INT NOT NULL,
                first_seen     TIMESTAMP NOT NULL,
                last_seen      TIMESTAMP NOT NULL,
                status         VARCHAR(16) NOT NULL
            )
            """, """
            CREATE TABLE IF NOT EXISTS chimera_operations (
                id            VARCHAR(64) PRIMARY KEY,
                name          VARCHAR(255),
                adversary_id  VARCHAR(128) NOT NULL,
                agent_group   VARCHAR(128),
                status        VARCHAR(16) NOT NULL,
                error_message TEXT,
                created_at    TIMESTAMP NOT NULL,
                finished_at   TIMESTAMP
            )
            """, """
            CREATE TABLE IF NOT EXISTS chimera_links (
                id            VARCHAR(64) PRIMARY KEY,
                operation_id  VARCHAR(64) NOT NULL,
                ability_id    VARCHAR(128) NOT NULL,
                paw           VARCHAR(64) NOT NULL,
                executor      VARCHAR(32),
                command       TEXT NOT NULL,
                status        VARCHAR(16) NOT NULL,
                attempt       INT NOT NULL,
                seq           BIGINT NOT NULL,
                created_at    TIMESTAMP NOT NULL,
                dispatched_at TIMESTAMP,
                finished_at   TIMESTAMP,
                raw_output    TEXT,
                exit_code     INT,
                reason        TEXT
            )
            """, """
            CREATE TABLE IF NOT EXISTS chimera_facts (
                operation_id VARCHAR(64) NOT NULL,
                version      BIGINT NOT NULL,
                fact_key     VARCHAR(255) NOT NULL,
                fact_value   TEXT NOT NULL,
                source_link  VARCHAR(64),
                created_at   TIMESTAMP NOT NULL,
                PRIMARY KEY (operation_id, version)
            )
            """);

    private static final String UPDATE_AGENT_SQL = """
            UPDATE chimera_agents SET platform = ?, hostname = ?, agent_group = ?, executors = ?,
                sleep_seconds = ?, jitter_seconds = ?, first_seen = ?, last_seen = ?, status = ?
            WHERE paw = ?
            """;

    private static final String INSERT_AGENT_SQL = """
            INSERT INTO chimera_agents (platform, hostname, agent_group, executors,
                sleep_seconds, jitter_seconds, first_seen, last_seen, status, paw)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_OPERATION_SQL = """
            UPDATE chimera_operations SET name = ?, adversary_id = ?, agent_group = ?, status = ?,
                error_message = ?, created_at = ?, finished_at = ?
            WHERE id = ?
            """;

    private static final String INSERT_OPERATION_SQL = """
            INSERT INTO chimera_operations (name, adversary_id, agent_group, status,
                error_message, created_at, finished_at, id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_LINK_SQL = """
            UPDATE chimera_links SET operation_id = ?, ability_id = ?, paw = ?, executor = ?, command = ?,
                status = ?, attempt = ?, seq = ?, created_at = ?, dispatched_at = ?, finished_at = ?,
                raw_output = ?, exit_code = ?, reason = ?
            WHERE id = ?
            """;

    private static final String INSERT_LINK_SQL = """
            INSERT INTO chimera_links (operation_id, ability_id, paw, executor, command,
                status, attempt, seq, created_at, dispatched_at, finished_at,
                raw_output, exit_code, reason, id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_FACT_SQL = """
            INSERT INTO chimera_facts (operation_id, version, fact_key, fact_value, source_link, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcOperationJournal(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the journal tables if they do not exist. Called once at startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String ddl : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(ddl)) {
                    stmt.execute();
                }
            }
        }
        log.info("Journal tables ensured");
    }

    @Override
    public void saveAgent(Agent agent) {
        upsert(UPDATE_AGENT_SQL, INSERT_AGENT_SQL, "agent " + agent.paw(), stmt -> {
            stmt.setString(1, agent.platform());
            stmt.setString(2, agent.hostname());
            stmt.setString(3, agent.group());
            stmt.setString(4, writeJson(agent.executors()));
            stmt.setInt(5, agent.sleepSeconds());
            stmt.setInt(6, agent.jitterSeconds());
            stmt.setTimestamp(7, timestamp(agent.firstSeen()));
            stmt.setTimestamp(8, timestamp(agent.lastSeen()));
            stmt.setString(9, agent.status().name());
            stmt.setString(10, agent.paw());
        });
    }

    @Override
    public void saveOperation(OperationRecord op) {
        upsert(UPDATE_OPERATION_SQL, INSERT_OPERATION_SQL, "operation " + op.id(), stmt -> {
            stmt.setString(1, op.name());
            stmt.setString(2, op.adversaryId());
            stmt.setString(3, op.group());
            stmt.setString(4, op.status().name());
            stmt.setString(5, op.error());
            stmt.setTimestamp(6, timestamp(op.createdAt()));
            stmt.setTimestamp(7, timestamp(op.finishedAt()));
            stmt.setString(8, op.id());
        });
    }

    @Override
    public void saveLink(Link link) {
        upsert(UPDATE_LINK_SQL, INSERT_LINK_SQL, "link " + link.id(), stmt -> {
            stmt.setString(1, link.operationId());
            stmt.setString(2, link.abilityId());
            stmt.setString(3, link.paw());
            stmt.setString(4, link.executor());
            stmt.setString(5, link.command());
            stmt.setString(6, link.status().name());
            stmt.setInt(7, link.attempt());
            stmt.setLong(8, link.sequence());
            stmt.setTimestamp(9, timestamp(link.createdAt()));
            stmt.setTimestamp(10, timestamp(link.dispatchedAt()));
            stmt.setTimestamp(11, timestamp(link.finishedAt()));
            stmt.setString(12, link.output());
            if (link.exitCode() == null) {
                stmt.setNull(13, Types.INTEGER);
            } else {
                stmt.setInt(13, link.exitCode());
            }
            stmt.setString(14, link.reason());
            stmt.setString(15, link.id());
        });
    }

    @Override
    public void appendFact(String operationId, Fact fact) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_FACT_SQL)) {
            stmt.setString(1, operationId);
            stmt.setLong(2, fact.version());
            stmt.setString(3, fact.key());
            stmt.setString(4, fact.value());
            stmt.setString(5, fact.provenance().linkId());
            stmt.setTimestamp(6, timestamp(fact.createdAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new JournalException("Failed to append fact " + fact.key() + " for operation " + operationId, e);
        }
    }

    @Override
    public List<Agent> agents() {
        return query("SELECT * FROM chimera_agents ORDER BY first_seen", null, this::toAgent);
    }

    @Override
    public List<OperationRecord> operations() {
        return query("SELECT * FROM chimera_operations ORDER BY created_at", null, this::toOperation);
    }

    @Override
    public Optional<OperationRecord> operation(String operationId) {
        return query("SELECT * FROM chimera_operations WHERE id = ?", operationId, this::toOperation)
                .stream().findFirst();
    }

    @Override
    public List<Link> links(String operationId) {
        return query("SELECT * FROM chimera_links WHERE operation_id = ? ORDER BY seq", operationId, this::toLink);
    }

    @Override
    public List<Fact> facts(String operationId) {
        return query("SELECT * FROM chimera_facts WHERE operation_id = ? ORDER BY version", operationId, this::toFact);
    }

    @Override
    public void deleteOperation(String operationId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                for (String sql : List.of("DELETE FROM chimera_facts WHERE operation_id = ?",
                        "DELETE FROM chimera_links WHERE operation_id = ?",
                        "DELETE FROM chimera_operations WHERE id = ?")) {
                    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                        stmt.setString(1, operationId);
                        stmt.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new JournalException("Failed to delete operation " + operationId, e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private void upsert(String updateSql, String insertSql, String what, Binder binder) {
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(updateSql)) {
                binder.bind(stmt);
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                    binder.bind(stmt);
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved {}", what);
        } catch (SQLException e) {
            throw new JournalException("Failed to save " + what, e);
        }
    }

    private <T> List<T> query(String sql, String param, RowMapper<T> mapper) {
        var result = new ArrayList<T>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (param != null) {
                stmt.setString(1, param);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            throw new JournalException("Journal query failed: " + sql.strip(), e);
        }
        return result;
    }

    private Agent toAgent(ResultSet rs) throws SQLException {
        return new Agent(rs.getString("paw"), rs.getString("platform"), rs.getString("hostname"),
                rs.getString("agent_group"), readStringList(rs.getString("executors")),
                rs.getInt("sleep_seconds"), rs.getInt("jitter_seconds"),
                instant(rs.getTimestamp("first_seen")), instant(rs.getTimestamp("last_seen")),
                AgentStatus.valueOf(rs.getString("status")));
    }

    private OperationRecord toOperation(ResultSet rs) throws SQLException {
        return new OperationRecord(rs.getString("id"), rs.getString("name"), rs.getString("adversary_id"),
                rs.getString("agent_group"), OperationStatus.valueOf(rs.getString("status")),
                rs.getString("error_message"), instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("finished_at")));
    }

    private Link toLink(ResultSet rs) throws SQLException {
        int exitCode = rs.getInt("exit_code");
        Integer code = rs.wasNull() ? null : exitCode;
        return new Link(rs.getString("id"), rs.getString("operation_id"), rs.getString("ability_id"),
                rs.getString("paw"), rs.getString("executor"), rs.getString("command"),
                LinkStatus.valueOf(rs.getString("status")), rs.getInt("attempt"), rs.getLong("seq"),
                instant(rs.getTimestamp("created_at")), instant(rs.getTimestamp("dispatched_at")),
                instant(rs.getTimestamp("finished_at")), rs.getString("raw_output"), code,
                rs.getString("reason"));
    }

    private Fact toFact(ResultSet rs) throws SQLException {
        String source = rs.getString("source_link");
        return new Fact(rs.getString("fact_key"), rs.getString("fact_value"),
                source == null ? Provenance.seed() : Provenance.link(source),
                rs.getLong("version"), instant(rs.getTimestamp("created_at")));
    }

    private String writeJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize executor list", e);
        }
    }

    private List<String> readStringList(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize executor list", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
