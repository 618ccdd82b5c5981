package com.property.reconciliation.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.property.reconciliation.api.Page;
import com.property.reconciliation.api.PageRequest;
import com.property.reconciliation.core.model.FieldProvenance;
import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.StatusChange;
import com.property.reconciliation.core.model.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransactionRollbackException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PropertyStore} over a JDBC {@link DataSource}.
 *
 * <p>One row per property in {@code property_states}, with a unique {@code listing_id} and a
 * {@code version} column used for optimistic concurrency. Images and field provenance are
 * stored as JSON text. The append-only transition log lives in {@code property_status_transitions}
 * keyed by (property_id, seq_no). Timestamps are epoch milliseconds. Free text, the address
 * envelope and the JSON columns are unbounded {@code TEXT}; the image list only grows under
 * union merges.</p>
 *
 * <p>A conditional update is a single {@code UPDATE ... WHERE id = ? AND version = ?} in the
 * same transaction as the log inserts.</p>
 */
public class JdbcPropertyStore implements PropertyStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcPropertyStore.class);

    private static final String[] SCHEMA = {
            """
            CREATE TABLE IF NOT EXISTS property_states (
                id VARCHAR(64) PRIMARY KEY,
                listing_id VARCHAR(128) UNIQUE,
                address_ciphertext TEXT,
                city VARCHAR(255),
                state_code VARCHAR(64),
                postal_code VARCHAR(32),
                bedrooms INT,
                bathrooms DOUBLE PRECISION,
                square_feet INT,
                property_type VARCHAR(64),
                price DECIMAL(19, 2),
                description TEXT,
                images_json TEXT,
                agent VARCHAR(255),
                office VARCHAR(255),
                source_url VARCHAR(1024),
                available BOOLEAN,
                internal_notes TEXT,
                status VARCHAR(32) NOT NULL,
                provenance_json TEXT,
                version BIGINT NOT NULL,
                created_at BIGINT NOT NULL,
                updated_at BIGINT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_property_states_status ON property_states (status)",
            """
            CREATE TABLE IF NOT EXISTS property_status_transitions (
                property_id VARCHAR(64) NOT NULL,
                seq_no INT NOT NULL,
                from_status VARCHAR(32),
                to_status VARCHAR(32) NOT NULL,
                source VARCHAR(32) NOT NULL,
                source_id VARCHAR(128),
                transitioned_at BIGINT NOT NULL,
                PRIMARY KEY (property_id, seq_no)
            )
            """
    };

    private static final String COLUMNS = """
            id, listing_id, address_ciphertext, city, state_code, postal_code, bedrooms, bathrooms,
            square_feet, property_type, price, description, images_json, agent, office, source_url,
            available, internal_notes, status, provenance_json, version, created_at, updated_at""";

    private static final String INSERT_STATE = "INSERT INTO property_states (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_STATE = """
            UPDATE property_states SET
                listing_id = ?, address_ciphertext = ?, city = ?, state_code = ?, postal_code = ?,
                bedrooms = ?, bathrooms = ?, square_feet = ?, property_type = ?, price = ?,
                description = ?, images_json = ?, agent = ?, office = ?, source_url = ?, available = ?,
                internal_notes = ?, status = ?, provenance_json = ?, version = ?, created_at = ?,
                updated_at = ?
            WHERE id = ? AND version = ?""";

    private static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM property_states WHERE id = ?";
    private static final String SELECT_BY_LISTING = "SELECT " + COLUMNS + " FROM property_states WHERE listing_id = ?";
    private static final String SELECT_BY_STATUS = "SELECT " + COLUMNS
            + " FROM property_states WHERE status = ? ORDER BY created_at, id";
    private static final String SELECT_PAGE_BY_STATUS = SELECT_BY_STATUS + " LIMIT ? OFFSET ?";
    private static final String COUNT_BY_STATUS = "SELECT status, COUNT(*) FROM property_states GROUP BY status";

    private static final String MAX_SEQUENCE =
            "SELECT COALESCE(MAX(seq_no), 0) FROM property_status_transitions WHERE property_id = ?";
    private static final String INSERT_TRANSITION = """
            INSERT INTO property_status_transitions
                (property_id, seq_no, from_status, to_status, source, source_id, transitioned_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)""";
    private static final String SELECT_TRANSITIONS = """
            SELECT property_id, seq_no, from_status, to_status, source, source_id, transitioned_at
            FROM property_status_transitions WHERE property_id = ? ORDER BY seq_no""";

    private static final TypeReference<List<String>> IMAGE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<PropertyField, ProvenanceColumn>> PROVENANCE_MAP =
            new TypeReference<>() {
            };

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcPropertyStore(DataSource dataSource) {
        this(dataSource, new ObjectMapper());
    }

    public JdbcPropertyStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource is required");
        this.objectMapper = objectMapper;
    }

    /**
     * JSON form of one provenance entry.
     */
    record ProvenanceColumn(@JsonProperty("source") String source,
                            @JsonProperty("sourceId") String sourceId,
                            @JsonProperty("updatedAt") long updatedAt) {
    }

    /**
     * Creates the tables and index if they do not exist yet.
     */
    public void createSchema() {
        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
            log.info("store.schema_ready tables=property_states,property_status_transitions");
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to create property schema", e);
        }
    }

    @Override
    public Optional<PropertyState> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return querySingle(SELECT_BY_ID, id);
    }

    @Override
    public Optional<PropertyState> findByListingId(String listingId) {
        if (listingId == null) {
            return Optional.empty();
        }
        return querySingle(SELECT_BY_LISTING, listingId);
    }

    @Override
    public List<PropertyState> listByStatus(PropertyStatus status) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(SELECT_BY_STATUS)) {
            stmt.setString(1, status.value());
            return readStates(stmt);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list properties with status " + status.value(), e);
        }
    }

    @Override
    public Page<PropertyState> listByStatus(PropertyStatus status, PageRequest page) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(SELECT_PAGE_BY_STATUS)) {
            stmt.setString(1, status.value());
            stmt.setInt(2, page.limit());
            stmt.setInt(3, page.offset());
            List<PropertyState> content = readStates(stmt);
            long total = countBy(PropertyCriteria.withStatus(status));
            return new Page<>(content, total, page.pageNumber(), page.limit());
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to page properties with status " + status.value(), e);
        }
    }

    @Override
    public String create(PropertyState state, List<StatusChange> changes) {
        Objects.requireNonNull(state, "state is required");
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = connection.prepareStatement(INSERT_STATE)) {
                    stmt.setString(1, state.getId());
                    bindState(stmt, 2, state);
                    stmt.executeUpdate();
                }
                insertTransitions(connection, state.getId(), 0, changes);
                connection.commit();
                log.debug("store.created propertyId={} listingId={}", state.getId(), state.getListingId());
                return state.getId();
            } catch (SQLException e) {
                connection.rollback();
                if (isConstraintViolation(e) && state.getListingId() != null) {
                    throw new DuplicateListingException(state.getListingId(), e);
                }
                throw e;
            } finally {
                restoreAutoCommit(connection, autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to create property " + state.getId(), e);
        }
    }

    @Override
    public UpdateResult conditionalUpdate(String id, long expectedVersion, PropertyState newState,
                                          List<StatusChange> changes) {
        Objects.requireNonNull(newState, "newState is required");
        if (newState.getVersion() != expectedVersion + 1) {
            throw new IllegalArgumentException("newState must carry version " + (expectedVersion + 1)
                    + ", got " + newState.getVersion());
        }
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                int rows;
                try (PreparedStatement stmt = connection.prepareStatement(UPDATE_STATE)) {
                    int next = bindState(stmt, 1, newState);
                    stmt.setString(next, id);
                    stmt.setLong(next + 1, expectedVersion);
                    rows = stmt.executeUpdate();
                }
                if (rows == 0) {
                    connection.rollback();
                    log.debug("store.version_conflict propertyId={} expectedVersion={}", id, expectedVersion);
                    return UpdateResult.CONFLICT;
                }
                if (changes != null && !changes.isEmpty()) {
                    insertTransitions(connection, id, currentSequence(connection, id), changes);
                }
                connection.commit();
                return UpdateResult.UPDATED;
            } catch (SQLException e) {
                connection.rollback();
                if (isConstraintViolation(e) && newState.getListingId() != null) {
                    throw new DuplicateListingException(newState.getListingId(), e);
                }
                if (isSerializationFailure(e)) {
                    log.debug("store.serialization_conflict propertyId={} sqlState={}", id, e.getSQLState());
                    return UpdateResult.CONFLICT;
                }
                throw e;
            } finally {
                restoreAutoCommit(connection, autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to update property " + id, e);
        }
    }

    @Override
    public long countBy(PropertyCriteria criteria) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM property_states");
        List<String> params = where(criteria, sql);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            bindAll(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count properties", e);
        }
    }

    @Override
    public Map<PropertyStatus, Long> countByStatus() {
        Map<PropertyStatus, Long> counts = new EnumMap<>(PropertyStatus.class);
        for (PropertyStatus status : PropertyStatus.values()) {
            counts.put(status, 0L);
        }
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(COUNT_BY_STATUS);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                PropertyStatus status = parseStatus(rs.getString(1));
                counts.put(status, rs.getLong(2));
            }
            return counts;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count properties by status", e);
        }
    }

    @Override
    public Optional<BigDecimal> averagePrice(PropertyCriteria criteria) {
        StringBuilder sql = new StringBuilder("SELECT SUM(price), COUNT(price) FROM property_states");
        List<String> params = where(criteria, sql);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            bindAll(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                BigDecimal sum = rs.getBigDecimal(1);
                long n = rs.getLong(2);
                if (sum == null || n == 0) {
                    return Optional.empty();
                }
                return Optional.of(sum.divide(BigDecimal.valueOf(n), 2, RoundingMode.HALF_UP));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to average property prices", e);
        }
    }

    @Override
    public List<StatusTransition> transitionsFor(String id) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(SELECT_TRANSITIONS)) {
            stmt.setString(1, id);
            List<StatusTransition> transitions = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_status");
                    transitions.add(new StatusTransition(
                            rs.getString("property_id"),
                            rs.getInt("seq_no"),
                            from == null ? null : parseStatus(from),
                            parseStatus(rs.getString("to_status")),
                            PropertySource.valueOf(rs.getString("source")),
                            rs.getString("source_id"),
                            Instant.ofEpochMilli(rs.getLong("transitioned_at"))));
                }
            }
            return transitions;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read transitions for property " + id, e);
        }
    }

    @Override
    public void ping() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(2)) {
                throw new StoreUnavailableException("Database connection is not valid");
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Database unreachable", e);
        }
    }

    private Optional<PropertyState> querySingle(String sql, String key) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, key);
            List<PropertyState> rows = readStates(stmt);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to load property", e);
        }
    }

    private List<PropertyState> readStates(PreparedStatement stmt) throws SQLException {
        List<PropertyState> states = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                states.add(mapRow(rs));
            }
        }
        return states;
    }

    private PropertyState mapRow(ResultSet rs) throws SQLException {
        PropertyState.Builder builder = PropertyState.builder()
                .id(rs.getString("id"))
                .listingId(rs.getString("listing_id"))
                .addressCiphertext(rs.getString("address_ciphertext"))
                .city(rs.getString("city"))
                .state(rs.getString("state_code"))
                .postalCode(rs.getString("postal_code"))
                .bedrooms(rs.getObject("bedrooms", Integer.class))
                .bathrooms(rs.getObject("bathrooms", Double.class))
                .squareFeet(rs.getObject("square_feet", Integer.class))
                .propertyType(rs.getString("property_type"))
                .price(rs.getBigDecimal("price"))
                .description(rs.getString("description"))
                .images(readJson(rs.getString("images_json"), IMAGE_LIST))
                .agent(rs.getString("agent"))
                .office(rs.getString("office"))
                .sourceUrl(rs.getString("source_url"))
                .available(rs.getObject("available", Boolean.class))
                .internalNotes(rs.getString("internal_notes"))
                .status(parseStatus(rs.getString("status")))
                .version(rs.getLong("version"))
                .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")));

        Map<PropertyField, ProvenanceColumn> provenance = readJson(rs.getString("provenance_json"), PROVENANCE_MAP);
        if (provenance != null) {
            provenance.forEach((field, column) -> builder.provenance(field, new FieldProvenance(
                    PropertySource.valueOf(column.source()), column.sourceId(),
                    Instant.ofEpochMilli(column.updatedAt()))));
        }
        return builder.build();
    }

    /**
     * Binds every column except id, starting at {@code index}.
     *
     * @return the next free parameter index
     */
    private int bindState(PreparedStatement stmt, int index, PropertyState state) throws SQLException {
        int i = index;
        stmt.setString(i++, state.getListingId());
        stmt.setString(i++, state.getAddressCiphertext());
        stmt.setString(i++, state.getCity());
        stmt.setString(i++, state.getState());
        stmt.setString(i++, state.getPostalCode());
        setNullable(stmt, i++, state.getBedrooms(), Types.INTEGER);
        setNullable(stmt, i++, state.getBathrooms(), Types.DOUBLE);
        setNullable(stmt, i++, state.getSquareFeet(), Types.INTEGER);
        stmt.setString(i++, state.getPropertyType());
        stmt.setBigDecimal(i++, state.getPrice());
        stmt.setString(i++, state.getDescription());
        stmt.setString(i++, state.getImages().isEmpty() ? null : writeJson(state.getImages()));
        stmt.setString(i++, state.getAgent());
        stmt.setString(i++, state.getOffice());
        stmt.setString(i++, state.getSourceUrl());
        setNullable(stmt, i++, state.getAvailable(), Types.BOOLEAN);
        stmt.setString(i++, state.getInternalNotes());
        stmt.setString(i++, state.getStatus().value());
        stmt.setString(i++, writeJson(provenanceColumns(state)));
        stmt.setLong(i++, state.getVersion());
        stmt.setLong(i++, state.getCreatedAt().toEpochMilli());
        stmt.setLong(i++, state.getUpdatedAt().toEpochMilli());
        return i;
    }

    private static Map<PropertyField, ProvenanceColumn> provenanceColumns(PropertyState state) {
        Map<PropertyField, ProvenanceColumn> columns = new LinkedHashMap<>();
        state.getProvenance().forEach((field, p) -> columns.put(field,
                new ProvenanceColumn(p.source().name(), p.sourceId(), p.updatedAt().toEpochMilli())));
        return columns;
    }

    private void insertTransitions(Connection connection, String id, int existing,
                                   List<StatusChange> changes) throws SQLException {
        if (changes == null || changes.isEmpty()) {
            return;
        }
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_TRANSITION)) {
            int sequence = existing;
            for (StatusChange change : changes) {
                stmt.setString(1, id);
                stmt.setInt(2, ++sequence);
                stmt.setString(3, change.fromStatus() == null ? null : change.fromStatus().value());
                stmt.setString(4, change.toStatus().value());
                stmt.setString(5, change.source().name());
                stmt.setString(6, change.sourceId());
                stmt.setLong(7, change.changedAt().toEpochMilli());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private static int currentSequence(Connection connection, String id) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(MAX_SEQUENCE)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private static List<String> where(PropertyCriteria criteria, StringBuilder sql) {
        List<String> params = new ArrayList<>();
        List<String> clauses = new ArrayList<>();
        if (!criteria.statuses().isEmpty()) {
            StringBuilder in = new StringBuilder("status IN (");
            boolean first = true;
            for (PropertyStatus status : PropertyStatus.values()) {
                if (criteria.statuses().contains(status)) {
                    in.append(first ? "?" : ", ?");
                    params.add(status.value());
                    first = false;
                }
            }
            clauses.add(in.append(')').toString());
        }
        if (criteria.city() != null) {
            clauses.add("LOWER(city) = LOWER(?)");
            params.add(criteria.city());
        }
        if (!clauses.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", clauses));
        }
        return params;
    }

    private static void bindAll(PreparedStatement stmt, List<String> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            stmt.setString(i + 1, params.get(i));
        }
    }

    private static void setNullable(PreparedStatement stmt, int index, Object value, int sqlType)
            throws SQLException {
        if (value == null) {
            stmt.setNull(index, sqlType);
        } else {
            stmt.setObject(index, value, sqlType);
        }
    }

    private static PropertyStatus parseStatus(String value) {
        return PropertyStatus.fromValue(value)
                .orElseThrow(() -> new StoreUnavailableException("Unknown status in store: " + value));
    }

    /**
     * Deadlock or serialization failure (SQLSTATE class 40): the losing writer retries.
     */
    private static boolean isSerializationFailure(SQLException e) {
        return e instanceof SQLTransactionRollbackException
                || (e.getSQLState() != null && e.getSQLState().startsWith("40"));
    }

    private static void restoreAutoCommit(Connection connection, boolean autoCommit) throws SQLException {
        if (connection.getAutoCommit() != autoCommit) {
            connection.setAutoCommit(autoCommit);
        }
    }

    private static boolean isConstraintViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || (e.getSQLState() != null && e.getSQLState().startsWith("23"));
    }

    private String writeJson(Object value) throws SQLException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize JSON column", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) throws SQLException {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column", e);
        }
    }
}
