package retrain.orchestrator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import retrain.orchestrator.api.Controller;
import retrain.orchestrator.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /api/v1/metrics - Prometheus scrape endpoint
 */
public class MetricsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    static final String CONTENT_TYPE = "text/plain; version=0.0.4";

    private final OrchestratorMetrics metrics;

    public MetricsController(OrchestratorMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/metrics".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return new ControllerResponse(HttpResponseStatus.OK, CONTENT_TYPE, metrics.scrape());
        } catch (Exception e) {
            log.error("Metrics scrape failed", e);
            return ControllerResponse.internalError("metrics unavailable");
        }
    }
}
