package com.cardvault.features.health.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint with a store ping.
 * The process answers "ok" as long as it can serve requests; the db field reports
 * whether the store connection is usable.
 */
@RestController
public class HealthController {
    
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    
    private final JdbcTemplate jdbcTemplate;
    
    public HealthController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }
    
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        String db = "ok";
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            log.warn("Store ping failed: {}", e.getMessage());
            db = "error";
        }
        return ResponseEntity.ok(new HealthResponse("ok", db));
    }
    
    public record HealthResponse(String status, String db) {}
}
