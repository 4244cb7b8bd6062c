package retrain.orchestrator.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job counts by status at the moment of the read.
 */
public record JobStats(int total, Map<JobStatus, Integer> byStatus) {

    public JobStats {
        EnumMap<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, byStatus.getOrDefault(s, 0));
        }
        byStatus = Collections.unmodifiableMap(counts);
    }

    public int count(JobStatus status) {
        return byStatus.get(status);
    }
}
