package retrain.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import retrain.orchestrator.model.MetricSample;

import java.time.Instant;

/**
 * One entry of GET /api/v1/jobs/{jobId}/metrics
 */
public record MetricSampleResponse(
        @JsonProperty("name") String name,
        @JsonProperty("value") double value,
        @JsonProperty("recorded_at") Instant recordedAt) {

    public static MetricSampleResponse from(MetricSample sample) {
        return new MetricSampleResponse(sample.name(), sample.value(), sample.recordedAt());
    }
}
