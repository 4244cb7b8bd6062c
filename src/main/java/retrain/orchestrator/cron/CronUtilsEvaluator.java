package retrain.orchestrator.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import retrain.orchestrator.error.ValidationException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CronEvaluator for standard 5-field UNIX expressions ("0 2 * * *"),
 * evaluated in a fixed zone.
 */
public final class CronUtilsEvaluator implements CronEvaluator {

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();
    private final ZoneId zone;

    public CronUtilsEvaluator(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public Instant nextFireTime(String schedule, Instant after) {
        ZonedDateTime reference = ZonedDateTime.ofInstant(after, zone);
        return executionTime(schedule).nextExecution(reference)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new ValidationException("Schedule never fires: " + schedule));
    }

    @Override
    public void validate(String schedule) {
        executionTime(schedule);
    }

    private ExecutionTime executionTime(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new ValidationException("schedule is required");
        }
        String expr = schedule.trim();
        ExecutionTime cached = cache.get(expr);
        if (cached != null) {
            return cached;
        }
        try {
            Cron cron = parser.parse(expr).validate();
            ExecutionTime executionTime = ExecutionTime.forCron(cron);
            cache.put(expr, executionTime);
            return executionTime;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid schedule '" + expr + "': " + e.getMessage(), e);
        }
    }
}
