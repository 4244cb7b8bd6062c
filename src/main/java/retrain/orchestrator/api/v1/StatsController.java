package retrain.orchestrator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import retrain.orchestrator.api.Controller;
import retrain.orchestrator.api.v1.dto.StatsResponse;
import retrain.orchestrator.server.RouterHandler;
import retrain.orchestrator.service.StatsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /api/v1/stats
 */
public class StatsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StatsController.class);

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/stats".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            StatsResponse response = StatsResponse.from(statsService.stats());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Stats failed", e);
            return ControllerResponse.internalError("stats unavailable");
        }
    }
}
