package com.stresscast.scenario.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A stored simulation. Scenario and results are kept as JSON documents.
 */
@Entity
@Table(name = "runs")
public class SimulationRunEntity {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "domain", nullable = false, length = 16)
    private String domain;

    @Column(name = "scenario", nullable = false, columnDefinition = "text")
    private String scenario;

    @Column(name = "results", nullable = false, columnDefinition = "text")
    private String results;

    @Column(name = "execution_time_ms", nullable = false)
    private long executionTimeMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected SimulationRunEntity() {}

    public SimulationRunEntity(UUID id, String domain, String scenario, String results,
                               long executionTimeMs, Instant createdAt) {
        this.id = id;
        this.domain = domain;
        this.scenario = scenario;
        this.results = results;
        this.executionTimeMs = executionTimeMs;
        this.createdAt = createdAt;
    }

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (id == null) {
            id = UUID.randomUUID();
        }
    }

    public UUID getId() { return id; }
    public String getDomain() { return domain; }
    public String getScenario() { return scenario; }
    public String getResults() { return results; }
    public long getExecutionTimeMs() { return executionTimeMs; }
    public Instant getCreatedAt() { return createdAt; }
}
