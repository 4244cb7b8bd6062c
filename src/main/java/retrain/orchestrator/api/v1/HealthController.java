package retrain.orchestrator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import retrain.orchestrator.api.Controller;
import retrain.orchestrator.api.v1.dto.HealthResponse;
import retrain.orchestrator.server.RouterHandler;
import retrain.orchestrator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final Database database;
    private final String backendName;
    private final BooleanSupplier schedulerRunning;
    private final Clock clock;

    public HealthController(Database database, String backendName, BooleanSupplier schedulerRunning, Clock clock) {
        this.database = database;
        this.backendName = backendName;
        this.schedulerRunning = schedulerRunning;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(clock.instant())));
            }

            HealthResponse response = HealthResponse.healthy(clock.instant(), backendName,
                    schedulerRunning.getAsBoolean(), formatUptime());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error(HttpResponseStatus.SERVICE_UNAVAILABLE, "UNHEALTHY", e.getMessage());
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
