package retrain.orchestrator.cron;

import org.junit.jupiter.api.Test;
import retrain.orchestrator.error.ValidationException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CronUtilsEvaluatorTest {

    private final CronUtilsEvaluator cron = new CronUtilsEvaluator(ZoneOffset.UTC);

    @Test
    void nextFireIsStrictlyAfterReference() {
        assertEquals(Instant.parse("2024-01-01T02:00:00Z"),
                cron.nextFireTime("0 2 * * *", Instant.parse("2024-01-01T00:00:00Z")));
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"),
                cron.nextFireTime("0 2 * * *", Instant.parse("2024-01-01T02:00:00Z")));
    }

    @Test
    void handlesRangesAndSteps() {
        // Monday 2024-01-01; weekdays every 15 minutes 9-17
        Instant saturday = Instant.parse("2024-01-06T10:00:00Z");
        assertEquals(Instant.parse("2024-01-08T09:00:00Z"), cron.nextFireTime("*/15 9-17 * * 1-5", saturday));
    }

    @Test
    void isDueOnceFireTimeReached() {
        Instant anchor = Instant.parse("2024-01-01T00:00:00Z");

        assertFalse(cron.isDue("0 * * * *", anchor, Instant.parse("2024-01-01T00:59:59Z")));
        assertTrue(cron.isDue("0 * * * *", anchor, Instant.parse("2024-01-01T01:00:00Z")));
        // missed fire times collapse into one due run
        assertTrue(cron.isDue("0 * * * *", anchor, Instant.parse("2024-01-03T00:00:00Z")));
    }

    @Test
    void evaluatesInConfiguredZone() {
        CronUtilsEvaluator tokyo = new CronUtilsEvaluator(ZoneId.of("Asia/Tokyo"));

        Instant next = tokyo.nextFireTime("0 2 * * *", Instant.parse("2024-01-01T00:00:00Z"));

        assertEquals(Instant.parse("2024-01-01T17:00:00Z"), next);
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThrows(ValidationException.class, () -> cron.validate("not a cron"));
        assertThrows(ValidationException.class, () -> cron.validate("61 * * * *"));
        assertThrows(ValidationException.class, () -> cron.validate("* * * *"));
        assertThrows(ValidationException.class, () -> cron.validate(" "));
        assertDoesNotThrow(() -> cron.validate("  0 2 * * *  "));
    }
}
