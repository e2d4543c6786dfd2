package com.wordscout.discovery.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordscout.config.DiscoveryProperties;
import com.wordscout.discovery.model.SuggestionResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Response cache in the {@code response_cache} table. Reads run on the caller thread; every
 * mutation, including the periodic expiry sweep, runs on the single {@code response-cache-writer}
 * thread.
 */
@Repository
public class JdbcResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(JdbcResponseCache.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final long writeTimeoutSeconds;
    private final ScheduledExecutorService writer;

    public JdbcResponseCache(
        NamedParameterJdbcTemplate jdbc,
        ObjectMapper objectMapper,
        Clock clock,
        DiscoveryProperties properties
    ) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
        DiscoveryProperties.Cache cache = properties.getCache();
        this.ttl = Duration.ofDays(Math.max(1, cache.getTtlDays()));
        this.writeTimeoutSeconds = cache.getWriteTimeoutSeconds();
        this.writer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "response-cache-writer");
            thread.setDaemon(true);
            return thread;
        });
        long sweepSeconds = cache.getSweepIntervalSeconds();
        writer.scheduleWithFixedDelay(this::sweepQuietly, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
    }

    @Override
    public Optional<SuggestionResponse> get(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        List<CachedRow> rows;
        try {
            rows = jdbc.query(
                """
                    SELECT payload, written_at, ttl_seconds
                    FROM response_cache
                    WHERE cache_key = :key
                    """,
                new MapSqlParameterSource("key", key),
                (rs, rowNum) -> new CachedRow(
                    rs.getString("payload"),
                    rs.getTimestamp("written_at").toInstant(),
                    rs.getLong("ttl_seconds")
                )
            );
        } catch (DataAccessException e) {
            log.warn("Cache read failed for '{}', treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        CachedRow row = rows.get(0);
        Instant now = clock.instant();
        if (Duration.between(row.writtenAt(), now).compareTo(Duration.ofSeconds(row.ttlSeconds())) > 0) {
            log.debug("Cache entry '{}' expired, scheduling delete", key);
            submitQuietly(() -> deleteExpired(key, now));
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(row.payload(), SuggestionResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Cache entry '{}' is unreadable, treating as miss: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, SuggestionResponse response) {
        if (key == null || key.isBlank() || response == null) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize response for '{}': {}", key, e.getOriginalMessage());
            return;
        }
        awaitWrite("set " + key, () -> upsert(key, payload));
    }

    @Override
    public void delete(String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        awaitWrite("delete " + key, () -> jdbc.update(
            "DELETE FROM response_cache WHERE cache_key = :key",
            new MapSqlParameterSource("key", key)
        ));
    }

    @Override
    public void clear() {
        Integer removed = awaitWrite("clear", () -> jdbc.update(
            "DELETE FROM response_cache",
            new MapSqlParameterSource()
        ));
        log.info("Response cache cleared ({} entries)", removed == null ? 0 : removed);
    }

    @Override
    public CacheStats stats() {
        try {
            MapSqlParameterSource params = new MapSqlParameterSource("now", Timestamp.from(clock.instant()));
            Long total = jdbc.queryForObject("SELECT COUNT(*) FROM response_cache", params, Long.class);
            Long expired = jdbc.queryForObject(
                "SELECT COUNT(*) FROM response_cache WHERE expires_at < :now",
                params,
                Long.class
            );
            long safeTotal = total == null ? 0 : total;
            long safeExpired = expired == null ? 0 : expired;
            return new CacheStats(safeTotal, safeTotal - safeExpired, safeExpired);
        } catch (DataAccessException e) {
            log.warn("Cache stats unavailable: {}", e.getMessage());
            return CacheStats.empty();
        }
    }

    @Override
    public int sweepExpired() {
        Integer removed = awaitWrite("sweep", () -> deleteAllExpired(clock.instant()));
        return removed == null ? 0 : removed;
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(writeTimeoutSeconds, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private int upsert(String key, String payload) {
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("payload", payload)
            .addValue("writtenAt", Timestamp.from(now))
            .addValue("ttlSeconds", ttl.getSeconds())
            .addValue("expiresAt", Timestamp.from(now.plus(ttl)));
        int updated = jdbc.update(
            """
                UPDATE response_cache
                SET payload = :payload,
                    written_at = :writtenAt,
                    ttl_seconds = :ttlSeconds,
                    expires_at = :expiresAt
                WHERE cache_key = :key
                """,
            params
        );
        if (updated > 0) {
            return updated;
        }
        return jdbc.update(
            """
                INSERT INTO response_cache (cache_key, payload, written_at, ttl_seconds, expires_at)
                VALUES (:key, :payload, :writtenAt, :ttlSeconds, :expiresAt)
                """,
            params
        );
    }

    private int deleteExpired(String key, Instant now) {
        return jdbc.update(
            "DELETE FROM response_cache WHERE cache_key = :key AND expires_at < :now",
            new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("now", Timestamp.from(now))
        );
    }

    private int deleteAllExpired(Instant now) {
        return jdbc.update(
            "DELETE FROM response_cache WHERE expires_at < :now",
            new MapSqlParameterSource("now", Timestamp.from(now))
        );
    }

    private void sweepQuietly() {
        try {
            int removed = deleteAllExpired(clock.instant());
            if (removed > 0) {
                log.info("Cache sweep removed {} expired entries", removed);
            }
        } catch (DataAccessException e) {
            log.warn("Cache sweep failed: {}", e.getMessage());
        }
    }

    private void submitQuietly(Callable<Integer> task) {
        try {
            writer.submit(() -> {
                try {
                    return task.call();
                } catch (DataAccessException e) {
                    log.warn("Cache write failed: {}", e.getMessage());
                    return 0;
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Cache writer is shut down, dropping write");
        }
    }

    private Integer awaitWrite(String label, Callable<Integer> task) {
        Future<Integer> future;
        try {
            future = writer.submit(task);
        } catch (RejectedExecutionException e) {
            log.warn("Cache writer is shut down, skipped {}", label);
            return null;
        }
        try {
            return future.get(writeTimeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            log.warn("Cache write failed ({}): {}", label, e.getCause() == null ? e.toString() : e.getCause().getMessage());
            return null;
        } catch (TimeoutException e) {
            log.warn("Cache write timed out after {}s ({})", writeTimeoutSeconds, label);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private record CachedRow(String payload, Instant writtenAt, long ttlSeconds) {
    }
}
