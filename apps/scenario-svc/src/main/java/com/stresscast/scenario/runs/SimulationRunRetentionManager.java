package com.stresscast.scenario.runs;

import com.stresscast.scenario.repository.SimulationRunRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes stored simulation runs once they are older than the retention window and keeps the
 * outcome of the latest purge for the health endpoint.
 */
@Component
public class SimulationRunRetentionManager {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunRetentionManager.class);

    public enum Trigger { SCHEDULED, MANUAL }

    /**
     * @param removed {@code -1} when the store rejected the delete
     */
    public record PurgeReport(Trigger trigger, Instant cutoff, int removed, Instant completedAt) {
        public boolean failed() {
            return removed < 0;
        }
    }

    private final SimulationRunRepository repository;
    private final Duration retention;
    private final Clock clock;
    private final AtomicReference<PurgeReport> lastPurge = new AtomicReference<>();

    @Autowired
    public SimulationRunRetentionManager(SimulationRunRepository repository,
                                         @Value("${stresscast.runs.retention-days:30}") int retentionDays) {
        this(repository, retentionDays, Clock.systemUTC());
    }

    SimulationRunRetentionManager(SimulationRunRepository repository, int retentionDays, Clock clock) {
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
        this.repository = repository;
        this.retention = Duration.ofDays(retentionDays);
        this.clock = clock;
    }

    /**
     * A failing store is logged and reported; the next tick tries again.
     */
    @Scheduled(cron = "${stresscast.runs.purge-cron:0 15 4 * * *}")
    public void purgeOnSchedule() {
        try {
            purge(Trigger.SCHEDULED);
        } catch (DataAccessException ex) {
            Instant now = clock.instant();
            lastPurge.set(new PurgeReport(Trigger.SCHEDULED, now.minus(retention), -1, now));
            log.warn("Scheduled run purge failed: {}", ex.getMessage());
        }
    }

    public PurgeReport purgeNow() {
        return purge(Trigger.MANUAL);
    }

    public Optional<PurgeReport> lastPurge() {
        return Optional.ofNullable(lastPurge.get());
    }

    public Duration retentionPeriod() {
        return retention;
    }

    private PurgeReport purge(Trigger trigger) {
        Instant cutoff = currentCutoff();
        int removed = repository.deleteCreatedBefore(cutoff);
        PurgeReport report = new PurgeReport(trigger, cutoff, removed, clock.instant());
        lastPurge.set(report);
        if (removed > 0) {
            log.info("Purged {} simulation runs created before {} ({})", removed, cutoff, trigger);
        } else {
            log.debug("No simulation runs created before {} ({})", cutoff, trigger);
        }
        return report;
    }

    Instant currentCutoff() {
        return clock.instant().minus(retention);
    }
}
