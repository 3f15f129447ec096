package email.agent.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

/**
 * Database lease per mailbox so only one node polls a user at a time.
 * A lease that outlives its holder expires and can be taken over.
 */
@Slf4j
@Service
public class DistributedLockService {
    private static final String LOCK_TABLE = "mailbox_poll_locks";
    private static final Duration LEASE = Duration.ofMinutes(10);

    private final JdbcTemplate jdbcTemplate;
    private final String nodeId;

    public DistributedLockService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.nodeId = resolveNodeId();
        jdbcTemplate.execute(
            "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
            "lock_key VARCHAR(255) PRIMARY KEY, " +
            "locked_by VARCHAR(255) NOT NULL, " +
            "expires_at TIMESTAMP NOT NULL" +
            ")"
        );
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * @return true if this node now holds the lease for the key
     */
    public boolean tryLock(String lockKey) {
        Instant now = Instant.now();
        try {
            // Drop a stale lease for this key before competing for it
            jdbcTemplate.update("DELETE FROM " + LOCK_TABLE + " WHERE lock_key = ? AND expires_at < ?",
                lockKey, Timestamp.from(now));
            jdbcTemplate.update("INSERT INTO " + LOCK_TABLE + " (lock_key, locked_by, expires_at) VALUES (?, ?, ?)",
                lockKey, nodeId, Timestamp.from(now.plus(LEASE)));
            log.debug("Acquired poll lock {} on node {}", lockKey, nodeId);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Poll lock {} is held by another node", lockKey);
            return false;
        }
    }

    public void releaseLock(String lockKey) {
        int rows = jdbcTemplate.update("DELETE FROM " + LOCK_TABLE + " WHERE lock_key = ? AND locked_by = ?",
            lockKey, nodeId);
        if (rows == 0) {
            log.warn("Poll lock {} was not held by node {} at release", lockKey, nodeId);
        }
    }

    private static String resolveNodeId() {
        String id = System.getenv("FLY_APP_INSTANCE_ID");
        if (id == null || id.isEmpty()) {
            id = System.getenv("HOSTNAME");
        }
        if (id == null || id.isEmpty()) {
            id = System.getProperty("user.name") + "-" + ProcessHandle.current().pid();
        }
        return id;
    }
}
