package com.studio45.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping({"/health", "/healthz"})
    public HealthResponse health() {
        return new HealthResponse("ok", Instant.now(clock).toString());
    }

    /**
     * Ready only when the database reports UP.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        try {
            HealthComponent component = healthEndpoint.health();
            String status = component.getStatus().getCode();
            if (component instanceof CompositeHealth composite
                    && composite.getComponents().get("db") instanceof Health dbHealth) {
                status = dbHealth.getStatus().getCode();
            }
            return new HealthResponse(status, Instant.now(clock).toString());
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed", ex);
            return new HealthResponse("DOWN", Instant.now(clock).toString());
        }
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
