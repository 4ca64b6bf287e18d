package com.knowledge.extraction.lock;

import com.knowledge.extraction.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Advisory lock stored as a {@code :Lock} node, for ingestion workers and
 * maintenance jobs running in different JVMs against the same graph.
 *
 * <p>The lease is a node property holding its expiry in epoch milliseconds. Acquiring
 * an own lease again renews it.</p>
 */
public class GraphDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(GraphDistributedLock.class);

    private final GraphConnection connection;
    private final LockConfig config;
    private final String ownerId;

    public GraphDistributedLock(GraphConnection connection) {
        this(connection, LockConfig.defaults());
    }

    public GraphDistributedLock(GraphConnection connection, LockConfig config) {
        this.connection = connection;
        this.config = config;
        this.ownerId = ProcessHandle.current().pid() + "-" + UUID.randomUUID();
        createLockIndex();
    }

    @Override
    public boolean tryLock(String key) {
        int attempts = config.maxRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attemptLock(key)) {
                log.debug("lock.acquired key={} attempt={}", key, attempt);
                return true;
            }
            if (attempt < attempts) {
                pause(key);
            }
        }
        throw new LockAcquisitionException(
                "Failed to acquire lock for key '" + key + "' after " + attempts + " attempts");
    }

    @Override
    public void unlock(String key) {
        String query = """
                MATCH (l:Lock {key: $key, owner: $owner})
                DELETE l
                """;
        try {
            connection.execute(query, Map.of("key", key, "owner", ownerId));
            log.debug("lock.released key={}", key);
        } catch (RuntimeException e) {
            // the lease expires on its own after lockTtlSeconds
            log.warn("lock.release_failed key={} error={}", key, e.getMessage());
        }
    }

    String getOwnerId() {
        return ownerId;
    }

    /**
     * Takes the lease when the node is new, already ours, or expired. A lease held by
     * another owner matches no row.
     */
    private boolean attemptLock(String key) {
        long nowMs = System.currentTimeMillis();
        String query = """
                MERGE (l:Lock {key: $key})
                ON CREATE SET l.owner = $owner, l.expiresAtMs = $expiresAtMs
                WITH l
                WHERE l.owner = $owner OR l.expiresAtMs < $nowMs
                SET l.owner = $owner, l.acquiredAtMs = $nowMs, l.expiresAtMs = $expiresAtMs
                RETURN l.owner AS owner
                """;
        try {
            List<Map<String, Object>> rows = connection.query(query, Map.of(
                    "key", key,
                    "owner", ownerId,
                    "nowMs", nowMs,
                    "expiresAtMs", nowMs + config.lockTtlSeconds() * 1000L));
            return !rows.isEmpty() && ownerId.equals(rows.get(0).get("owner"));
        } catch (RuntimeException e) {
            log.warn("lock.attempt_failed key={} error={}", key, e.getMessage());
            return false;
        }
    }

    private void pause(String key) {
        try {
            Thread.sleep(config.retryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for: " + key, e);
        }
    }

    private void createLockIndex() {
        try {
            connection.execute("CREATE INDEX FOR (l:Lock) ON (l.key)");
        } catch (RuntimeException e) {
            log.debug("lock.index_exists error={}", e.getMessage());
        }
    }
}
