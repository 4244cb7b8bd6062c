package retrain.orchestrator.model;

import java.util.List;

/**
 * Partial update of a job definition. Null fields are left unchanged.
 */
public record JobUpdate(
        String name,
        String image,
        List<String> command,
        String schedule,
        Integer maxRetries,
        String checkpointPath) {

    public boolean isEmpty() {
        return name == null && image == null && command == null && schedule == null
                && maxRetries == null && checkpointPath == null;
    }
}
