package com.example.kanban.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(prefix = "management.health.kanban-store", name = "enabled", havingValue = "true", matchIfMissing = false)
public class KanbanStoreHealthIndicator implements HealthIndicator {
    
    static final List<String> SCHEMA_TABLES =
        List.of("boards", "columns", "tasks", "task_dependencies", "notes", "tags", "task_tags");
    
    @Autowired
    private JdbcTemplate jdbcTemplate;
    
    @Override
    public Health health() {
        try {
            Integer probe = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            if (probe == null || probe != 1) {
                return Health.down()
                    .withDetail("status", "Store probe returned " + probe)
                    .build();
            }
            
            List<String> tables = jdbcTemplate.queryForList(
                "SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name", String.class);
            List<String> missing = SCHEMA_TABLES.stream()
                .filter(table -> !tables.contains(table))
                .toList();
            
            Health.Builder health = missing.isEmpty() ? Health.up() : Health.down();
            return health
                .withDetail("tables", tables)
                .withDetail("missingTables", missing)
                .build();
            
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .withException(e)
                .build();
        }
    }
}
