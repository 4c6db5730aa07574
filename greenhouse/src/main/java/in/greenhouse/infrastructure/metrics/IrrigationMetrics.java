package in.greenhouse.infrastructure.metrics;

import in.greenhouse.domain.common.ReasonCode;
import in.greenhouse.domain.feed.TransportKind;
import in.greenhouse.domain.pump.TriggerSource;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus metrics for the irrigation service.
 *
 * Key Metrics:
 * - greenhouse_pump_activations_total{source}
 * - greenhouse_pump_refusals_total{reason}
 * - greenhouse_pump_on - 1 while the pump runs
 * - greenhouse_water_used_liters_total
 * - greenhouse_gateway_publishes_total{transport, status}
 * - greenhouse_decisions_total{action}
 * - greenhouse_schedule_fires_total
 * - greenhouse_task_failures_total{task}
 */
public class IrrigationMetrics {

    private final CollectorRegistry registry;

    private final Counter pumpActivations;
    private final Counter pumpRefusals;
    private final Gauge pumpOn;
    private final Counter waterUsed;
    private final Counter gatewayPublishes;
    private final Counter decisions;
    private final Counter scheduleFires;
    private final Counter taskFailures;

    public IrrigationMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public IrrigationMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.pumpActivations = Counter.build()
            .name("greenhouse_pump_activations_total")
            .help("Pump ON transitions by trigger source")
            .labelNames("source")
            .register(registry);

        this.pumpRefusals = Counter.build()
            .name("greenhouse_pump_refusals_total")
            .help("Pump commands refused by policy or failed at the gateway")
            .labelNames("reason")
            .register(registry);

        this.pumpOn = Gauge.build()
            .name("greenhouse_pump_on")
            .help("1 while the pump is running, 0 otherwise")
            .register(registry);

        this.waterUsed = Counter.build()
            .name("greenhouse_water_used_liters_total")
            .help("Water delivered by completed runs")
            .register(registry);

        this.gatewayPublishes = Counter.build()
            .name("greenhouse_gateway_publishes_total")
            .help("Gateway publish attempts by transport and outcome")
            .labelNames("transport", "status")
            .register(registry);

        this.decisions = Counter.build()
            .name("greenhouse_decisions_total")
            .help("Decision loop outcomes")
            .labelNames("action")
            .register(registry);

        this.scheduleFires = Counter.build()
            .name("greenhouse_schedule_fires_total")
            .help("Schedules that started the pump")
            .register(registry);

        this.taskFailures = Counter.build()
            .name("greenhouse_task_failures_total")
            .help("Background ticks that ended with an exception")
            .labelNames("task")
            .register(registry);
    }

    public void recordActivation(TriggerSource source) {
        pumpActivations.labels(source.code()).inc();
        pumpOn.set(1);
    }

    public void recordStop(double waterLiters) {
        pumpOn.set(0);
        if (waterLiters > 0) {
            waterUsed.inc(waterLiters);
        }
    }

    public void recordRefusal(ReasonCode reason) {
        pumpRefusals.labels(reason.code()).inc();
    }

    public void recordPublish(TransportKind transport, boolean success) {
        gatewayPublishes.labels(transport.name().toLowerCase(), success ? "success" : "failure").inc();
    }

    public void recordDecision(String action) {
        decisions.labels(action).inc();
    }

    public void recordScheduleFire() {
        scheduleFires.inc();
    }

    public void recordTaskFailure(String task) {
        taskFailures.labels(task).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
