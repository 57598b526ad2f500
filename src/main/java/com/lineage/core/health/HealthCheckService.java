package com.lineage.core.health;

import com.lineage.core.events.EventHub;
import com.lineage.core.persistence.DurableTimelineStore;
import com.lineage.core.persistence.DurableTimelineStore.TableFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final DurableTimelineStore store;
    private final EventHub eventHub;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) DurableTimelineStore store,
            @Autowired(required = false) EventHub eventHub) {
        this.dataSource = dataSource;
        this.store = store;
        this.eventHub = eventHub;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkStorage());
        results.add(checkEventHub());
        return results;
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    // A family stuck before READY means its migration failed and a restore may be needed.
    private HealthStatus checkStorage() {
        if (store == null) {
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Timeline store not configured", Map.of());
        }
        Map<String, String> states = new LinkedHashMap<>();
        for (TableFamily family : TableFamily.values()) {
            states.put(family.name().toLowerCase(), String.valueOf(store.getMigrationState(family)));
        }
        if (store.isReady()) {
            return new HealthStatus("storage", HealthStatus.Status.UP,
                    "All table families ready", states);
        }
        return new HealthStatus("storage", HealthStatus.Status.DEGRADED,
                "Table families not ready: " + states, states);
    }

    private HealthStatus checkEventHub() {
        if (eventHub == null) {
            return new HealthStatus("events", HealthStatus.Status.DOWN,
                    "Event hub not available", Map.of());
        }
        return new HealthStatus("events", HealthStatus.Status.UP,
                "Event hub available (" + eventHub.listenerCount() + " listeners)",
                Map.of("listeners", String.valueOf(eventHub.listenerCount())));
    }
}
