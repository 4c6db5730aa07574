package in.greenhouse.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.greenhouse.application.service.IrrigationOrchestrator;
import in.greenhouse.infrastructure.json.IrrigationJson;
import in.greenhouse.infrastructure.metrics.IrrigationMetrics;
import in.greenhouse.infrastructure.metrics.PrometheusMetricsHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only monitoring endpoints:
 * <pre>
 * GET /metrics  Prometheus text format
 * GET /health   JSON system status
 * </pre>
 */
public final class MonitoringServer {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final IrrigationOrchestrator orchestrator;
    private final IrrigationMetrics metrics;
    private final int port;

    private Undertow server;

    public MonitoringServer(IrrigationOrchestrator orchestrator, IrrigationMetrics metrics, int port) {
        this.orchestrator = orchestrator;
        this.metrics = metrics;
        this.port = port;
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes())
            .build();
        server.start();
        log.info("[MONITORING] Listening on http://localhost:{}/ (/metrics, /health)", port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[MONITORING] Stopped");
        }
    }

    RoutingHandler routes() {
        return Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/health", this::health);
    }

    void health(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        try {
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(IrrigationJson.write(healthJson()));
        } catch (RuntimeException e) {
            log.error("[MONITORING] Health check failed: {}", e.getMessage(), e);
            ObjectNode error = IrrigationJson.mapper().createObjectNode();
            error.put("status", "error");
            error.put("error", e.getMessage());
            exchange.setStatusCode(500);
            exchange.getResponseSender().send(IrrigationJson.write(error));
        }
    }

    ObjectNode healthJson() {
        IrrigationOrchestrator.SystemStatus status = orchestrator.getSystemStatus();
        ObjectNode o = IrrigationJson.mapper().createObjectNode();
        o.put("status", status.running() ? "ok" : "stopped");
        o.put("timestamp", status.timestamp().toString());
        o.put("running", status.running());
        o.set("pump", IrrigationJson.toJson(status.pump()));

        ObjectNode scheduler = o.putObject("scheduler");
        scheduler.put("running", status.schedulerRunning());
        scheduler.put("schedules", status.scheduleCount());

        ObjectNode decision = o.putObject("decision_loop");
        decision.put("running", status.decisionLoopRunning());
        decision.set("config", IrrigationJson.toJson(status.decisionConfig()));
        if (status.lastDecision() != null) {
            decision.set("last_decision", IrrigationJson.toJson(status.lastDecision()));
        } else {
            decision.putNull("last_decision");
        }
        return o;
    }
}
