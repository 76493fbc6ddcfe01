package com.ads.signaldetection.ingestion;

import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.OverflowRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Durable FIFO of spilled sample batches, backed by SQLite.
 * <p>
 * Records survive a restart and are replayed by the next recovery sweep. The store refuses new
 * records once {@code maxRecords} are pending.
 */
@Slf4j
@Component
public class OverflowStore {

    private static final TypeReference<List<MetricSample>> SAMPLE_LIST = new TypeReference<>() {
    };

    private final String databasePath;
    private final long maxRecords;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Connection connection;
    private PreparedStatement insertStatement;
    private PreparedStatement oldestStatement;
    private PreparedStatement deleteStatement;

    private final AtomicLong pendingRecords = new AtomicLong();
    private final AtomicLong pendingSamples = new AtomicLong();

    public OverflowStore(
            @Value("${signal.ingestion.spillover.path:./data/overflow.db}") String databasePath,
            @Value("${signal.ingestion.spillover.max-records:100000}") long maxRecords,
            ObjectMapper objectMapper
    ) {
        this(databasePath, maxRecords, objectMapper, Clock.systemUTC());
    }

    OverflowStore(String databasePath, long maxRecords, ObjectMapper objectMapper, Clock clock) {
        this.databasePath = databasePath;
        this.maxRecords = maxRecords;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() throws SQLException {
        log.info("Initializing overflow store with database: {}", databasePath);

        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }

        connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
        connection.setAutoCommit(true);
        createTable();

        insertStatement = connection.prepareStatement("""
            INSERT INTO overflow_records (source_id, spilled_at, sample_count, json_data)
            VALUES (?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS);
        oldestStatement = connection.prepareStatement("""
            SELECT id, source_id, spilled_at, json_data FROM overflow_records ORDER BY id LIMIT 1
            """);
        deleteStatement = connection.prepareStatement("DELETE FROM overflow_records WHERE id = ?");

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*), COALESCE(SUM(sample_count), 0) FROM overflow_records")) {
            if (rs.next()) {
                pendingRecords.set(rs.getLong(1));
                pendingSamples.set(rs.getLong(2));
            }
        }
        log.info("Overflow store initialized ({} pending records, {} pending samples)",
                pendingRecords.get(), pendingSamples.get());
    }

    private void createTable() throws SQLException {
        String createTableSql = """
            CREATE TABLE IF NOT EXISTS overflow_records (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                source_id TEXT NOT NULL,
                spilled_at TEXT NOT NULL,
                sample_count INTEGER NOT NULL,
                json_data TEXT NOT NULL
            )
            """;
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
        }
    }

    /**
     * Persist one batch of samples of a single source.
     *
     * @throws SpilloverFailureException if the quota is reached or the write fails
     */
    public synchronized OverflowRecord append(String sourceId, List<MetricSample> samples) {
        if (pendingRecords.get() >= maxRecords) {
            throw new SpilloverFailureException(
                    "Overflow store quota reached (" + maxRecords + " records), cannot spill " + samples.size()
                            + " samples of " + sourceId);
        }
        Instant spilledAt = clock.instant();
        try {
            insertStatement.setString(1, sourceId);
            insertStatement.setString(2, spilledAt.toString());
            insertStatement.setInt(3, samples.size());
            insertStatement.setString(4, objectMapper.writeValueAsString(samples));
            insertStatement.executeUpdate();

            long id;
            try (ResultSet keys = insertStatement.getGeneratedKeys()) {
                id = keys.next() ? keys.getLong(1) : -1L;
            }
            pendingRecords.incrementAndGet();
            pendingSamples.addAndGet(samples.size());
            log.debug("Spilled {} samples of {} as record {}", samples.size(), sourceId, id);
            return new OverflowRecord(id, sourceId, spilledAt, List.copyOf(samples));
        } catch (SQLException | JsonProcessingException e) {
            throw new SpilloverFailureException("Failed to spill " + samples.size() + " samples of " + sourceId, e);
        }
    }

    /**
     * Oldest pending record, if any.
     *
     * @throws SpilloverFailureException if the store cannot be read
     */
    public synchronized Optional<OverflowRecord> oldest() {
        try (ResultSet rs = oldestStatement.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new OverflowRecord(
                    rs.getLong("id"),
                    rs.getString("source_id"),
                    Instant.parse(rs.getString("spilled_at")),
                    objectMapper.readValue(rs.getString("json_data"), SAMPLE_LIST)
            ));
        } catch (SQLException | JsonProcessingException e) {
            throw new SpilloverFailureException("Failed to read oldest overflow record", e);
        }
    }

    /**
     * @throws SpilloverFailureException if the delete fails
     */
    public synchronized void delete(OverflowRecord record) {
        try {
            deleteStatement.setLong(1, record.id());
            if (deleteStatement.executeUpdate() > 0) {
                pendingRecords.decrementAndGet();
                pendingSamples.addAndGet(-record.size());
            }
        } catch (SQLException e) {
            throw new SpilloverFailureException("Failed to delete overflow record " + record.id(), e);
        }
    }

    /**
     * Pending sample count per source, used to restore ordering state after a restart.
     */
    public synchronized Map<String, Integer> pendingBySource() {
        Map<String, Integer> result = new HashMap<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT source_id, SUM(sample_count) FROM overflow_records GROUP BY source_id")) {
            while (rs.next()) {
                result.put(rs.getString(1), rs.getInt(2));
            }
        } catch (SQLException e) {
            throw new SpilloverFailureException("Failed to read pending overflow counts", e);
        }
        return result;
    }

    public long recordCount() {
        return pendingRecords.get();
    }

    public long sampleCount() {
        return pendingSamples.get();
    }

    @PreDestroy
    public synchronized void close() {
        try {
            if (insertStatement != null) {
                insertStatement.close();
            }
            if (oldestStatement != null) {
                oldestStatement.close();
            }
            if (deleteStatement != null) {
                deleteStatement.close();
            }
            if (connection != null) {
                connection.close();
            }
            log.info("Overflow store closed ({} pending records)", pendingRecords.get());
        } catch (SQLException e) {
            log.error("Error closing overflow store", e);
        }
    }
}
