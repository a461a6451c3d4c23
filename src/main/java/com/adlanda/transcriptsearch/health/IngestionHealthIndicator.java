package com.adlanda.transcriptsearch.health;

import com.adlanda.transcriptsearch.model.IngestionSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for transcript ingestion.
 *
 * Reports the outcome of the last ingestion run: segments read, chunks built,
 * entities stored and batches, or the error that stopped it.
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(false, null, "Ingestion not yet run", null)
    );

    public void markHealthy(IngestionSummary summary) {
        state.set(new HealthState(true, summary, null, Instant.now()));
    }

    public void markUnhealthy(String error) {
        state.set(new HealthState(false, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            Health.Builder builder = Health.up()
                    .withDetail("lastRun", current.timestamp() != null ? current.timestamp().toString() : "never");

            if (current.summary() != null) {
                builder.withDetail("segmentsRead", current.summary().segmentsRead())
                       .withDetail("chunksBuilt", current.summary().chunksBuilt())
                       .withDetail("entitiesStored", current.summary().entitiesStored())
                       .withDetail("batches", current.summary().batches())
                       .withDetail("durationMs", current.summary().durationMs());
            }

            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp() != null ? current.timestamp().toString() : "never")
                .build();
    }

    private record HealthState(
            boolean healthy,
            IngestionSummary summary,
            String error,
            Instant timestamp
    ) {}
}
