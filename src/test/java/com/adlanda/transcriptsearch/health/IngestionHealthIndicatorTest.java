package com.adlanda.transcriptsearch.health;

import com.adlanda.transcriptsearch.model.IngestionSummary;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionHealthIndicatorTest {

    private final IngestionHealthIndicator indicator = new IngestionHealthIndicator();

    @Test
    void health_beforeFirstRun_isDown() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "Ingestion not yet run");
    }

    @Test
    void health_afterSuccessfulRun_reportsSummary() {
        indicator.markHealthy(new IngestionSummary(1000, 250, 250, 4, 1234));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("segmentsRead", 1000)
                .containsEntry("chunksBuilt", 250)
                .containsEntry("entitiesStored", 250L)
                .containsEntry("batches", 4)
                .containsKey("lastRun");
    }

    @Test
    void health_afterFailure_reportsError() {
        indicator.markHealthy(new IngestionSummary(1, 1, 1, 1, 1));
        indicator.markUnhealthy("Batch 3: insert failed");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "Batch 3: insert failed");
    }
}
