package com.stemtutor.core.health;

import com.stemtutor.core.graph.TutorGraph;
import com.stemtutor.core.ratelimit.RateLimitStore;
import com.stemtutor.core.ratelimit.RateLimiterUnavailableException;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private static final String PROBE_IDENTITY = "__health_probe__";

    private final TutorGraph tutorGraph;
    private final BaseCheckpointSaver checkpointSaver;
    private final DataSource dataSource;
    private final RateLimitStore rateLimitStore;

    public HealthCheckService(
            @Autowired(required = false) TutorGraph tutorGraph,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver,
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) RateLimitStore rateLimitStore) {
        this.tutorGraph = tutorGraph;
        this.checkpointSaver = checkpointSaver;
        this.dataSource = dataSource;
        this.rateLimitStore = rateLimitStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkCheckpointStore());
        results.add(checkRateLimitStore());
        return results;
    }

    private HealthStatus checkGraph() {
        if (tutorGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkCheckpointStore() {
        if (checkpointSaver == null) {
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "No checkpoint saver configured", Map.of());
        }
        String saverType = checkpointSaver.getClass().getSimpleName();
        if (dataSource == null) {
            return new HealthStatus("checkpoints", HealthStatus.Status.DEGRADED,
                    "In-memory checkpoints, sessions do not survive a restart", Map.of("saver", saverType));
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("checkpoints", HealthStatus.Status.UP,
                        "Database connection valid", Map.of("saver", saverType));
            }
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of("saver", saverType));
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of("saver", saverType));
        }
    }

    private HealthStatus checkRateLimitStore() {
        if (rateLimitStore == null) {
            return new HealthStatus("rate_limits", HealthStatus.Status.DOWN,
                    "No rate limit store configured", Map.of());
        }
        String storeType = rateLimitStore.getClass().getSimpleName();
        try {
            rateLimitStore.load(PROBE_IDENTITY);
            return new HealthStatus("rate_limits", HealthStatus.Status.UP,
                    "Rate limit store reachable", Map.of("store", storeType));
        } catch (RateLimiterUnavailableException e) {
            log.warn("Rate limit store health check failed: {}", e.getMessage());
            // Requests still pass while the store is down.
            return new HealthStatus("rate_limits", HealthStatus.Status.DEGRADED,
                    "Rate limit store unreachable, failing open", Map.of("store", storeType));
        }
    }
}
