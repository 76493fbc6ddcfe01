package com.ads.signaldetection.output;

import com.ads.signaldetection.model.AnomalyEvent;
import com.ads.signaldetection.model.DeadLetter;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SQLite table of batches that exhausted their delivery attempts.
 */
@Slf4j
@Component
public class DeadLetterStore {

    private static final TypeReference<List<AnomalyEvent>> EVENT_LIST = new TypeReference<>() {
    };

    private final String databasePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Connection connection;
    private final AtomicLong count = new AtomicLong();

    public DeadLetterStore(
            @Value("${signal.sink.dead-letter.path:./data/dead_letters.db}") String databasePath,
            ObjectMapper objectMapper
    ) {
        this(databasePath, objectMapper, Clock.systemUTC());
    }

    DeadLetterStore(String databasePath, ObjectMapper objectMapper, Clock clock) {
        this.databasePath = databasePath;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() throws SQLException {
        log.info("Initializing dead-letter store with database: {}", databasePath);

        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
        connection.setAutoCommit(true);

        String createTableSql = """
            CREATE TABLE IF NOT EXISTS dead_letters (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                failed_at TEXT NOT NULL,
                attempts INTEGER NOT NULL,
                reason TEXT,
                event_count INTEGER NOT NULL,
                json_data TEXT NOT NULL
            )
            """;
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM dead_letters")) {
                count.set(rs.next() ? rs.getLong(1) : 0L);
            }
        }
        log.info("Dead-letter store initialized ({} stored batches)", count.get());
    }

    /**
     * @throws DeliveryFailureException if the batch cannot be persisted
     */
    public synchronized DeadLetter store(List<AnomalyEvent> events, int attempts, String reason) {
        Instant failedAt = clock.instant();
        String sql = """
            INSERT INTO dead_letters (failed_at, attempts, reason, event_count, json_data)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (PreparedStatement insert = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            insert.setString(1, failedAt.toString());
            insert.setInt(2, attempts);
            insert.setString(3, reason);
            insert.setInt(4, events.size());
            insert.setString(5, objectMapper.writeValueAsString(events));
            insert.executeUpdate();

            long id;
            try (ResultSet keys = insert.getGeneratedKeys()) {
                id = keys.next() ? keys.getLong(1) : -1L;
            }
            count.incrementAndGet();
            return new DeadLetter(id, failedAt, attempts, reason, List.copyOf(events));
        } catch (SQLException | JsonProcessingException e) {
            throw new DeliveryFailureException("Failed to dead-letter batch of " + events.size() + " events", e);
        }
    }

    /**
     * Oldest dead letters first.
     */
    public synchronized List<DeadLetter> list(int limit) {
        List<DeadLetter> result = new ArrayList<>();
        String sql = "SELECT id, failed_at, attempts, reason, json_data FROM dead_letters ORDER BY id LIMIT ?";
        try (PreparedStatement query = connection.prepareStatement(sql)) {
            query.setInt(1, limit);
            try (ResultSet rs = query.executeQuery()) {
                while (rs.next()) {
                    result.add(new DeadLetter(
                            rs.getLong("id"),
                            Instant.parse(rs.getString("failed_at")),
                            rs.getInt("attempts"),
                            rs.getString("reason"),
                            objectMapper.readValue(rs.getString("json_data"), EVENT_LIST)
                    ));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new DeliveryFailureException("Failed to read dead letters", e);
        }
        return result;
    }

    public synchronized void delete(long id) {
        try (PreparedStatement delete = connection.prepareStatement("DELETE FROM dead_letters WHERE id = ?")) {
            delete.setLong(1, id);
            if (delete.executeUpdate() > 0) {
                count.decrementAndGet();
            }
        } catch (SQLException e) {
            throw new DeliveryFailureException("Failed to delete dead letter " + id, e);
        }
    }

    public long count() {
        return count.get();
    }

    @PreDestroy
    public synchronized void close() {
        try {
            if (connection != null) {
                connection.close();
            }
            log.info("Dead-letter store closed ({} stored batches)", count.get());
        } catch (SQLException e) {
            log.error("Error closing dead-letter store", e);
        }
    }
}
