package in.greenhouse.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.greenhouse.application.service.IrrigationOrchestrator;
import in.greenhouse.config.GatewayConfig;
import in.greenhouse.config.IrrigationConfig;
import in.greenhouse.config.SensorThresholds;
import in.greenhouse.domain.feed.FeedBinding;
import in.greenhouse.domain.feed.FeedKeys;
import in.greenhouse.domain.sensor.SensorType;
import in.greenhouse.infrastructure.cache.RedisFastCache;
import in.greenhouse.infrastructure.gateway.GatewayClient;
import in.greenhouse.infrastructure.gateway.GatewayRestApi;
import in.greenhouse.infrastructure.gateway.MqttGatewayTransport;
import in.greenhouse.infrastructure.gateway.RetryPolicy;
import in.greenhouse.infrastructure.metrics.IrrigationMetrics;
import in.greenhouse.infrastructure.store.DurableStoreMigration;
import in.greenhouse.infrastructure.store.PostgresDurableStore;
import in.greenhouse.service.analysis.EnvironmentAnalyzer;
import in.greenhouse.service.analysis.HumidityAnalyzer;
import in.greenhouse.service.analysis.LightAnalyzer;
import in.greenhouse.service.analysis.SoilMoistureAnalyzer;
import in.greenhouse.service.analysis.TemperatureAnalyzer;
import in.greenhouse.service.decision.DecisionLoop;
import in.greenhouse.service.decision.RecommendationQueue;
import in.greenhouse.service.pump.PumpController;
import in.greenhouse.service.schedule.IrrigationScheduler;
import in.greenhouse.service.sensor.EnvironmentDataService;
import in.greenhouse.transport.http.MonitoringServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Composition root for the greenhouse irrigation service.
 *
 * Wires:
 * - PostgreSQL durable store (HikariCP) and Redis fast cache
 * - IoT gateway client (MQTT first, REST fallback)
 * - pump controller, scheduler, decision loop
 * - orchestrator and the monitoring endpoints
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Greenhouse Irrigation Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        IrrigationConfig config = IrrigationConfig.fromEnv();
        Clock clock = Clock.systemDefaultZone();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new DurableStoreMigration(dataSource).migrate();
        PostgresDurableStore store = new PostgresDurableStore(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Cache
        // ═══════════════════════════════════════════════════════════════
        RedisFastCache cache = new RedisFastCache(config.redisHost(), config.redisPort());
        log.info("✓ Redis cache at {}:{}", config.redisHost(), config.redisPort());

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        IrrigationMetrics metrics = new IrrigationMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Gateway
        // ═══════════════════════════════════════════════════════════════
        GatewayConfig gatewayConfig = config.gateway();
        MqttGatewayTransport mqtt = gatewayConfig.mqttServerUri().isBlank()
            ? null
            : new MqttGatewayTransport(gatewayConfig);
        GatewayClient gateway = new GatewayClient(
            new GatewayRestApi(gatewayConfig), mqtt, RetryPolicy.forGateway(gatewayConfig), metrics);
        gateway.connect();
        gateway.initializeFeeds(feedBindings(config));
        gateway.registerHandler(config.pump().feedKey(), (feedKey, payload) ->
            log.info("[GATEWAY] Pump feed {} reported {}", feedKey, payload));

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        EnvironmentAnalyzer analyzer = new EnvironmentAnalyzer(
            new SoilMoistureAnalyzer(SensorThresholds.fromEnv("SOIL", SensorThresholds.soilMoisture())),
            new TemperatureAnalyzer(SensorThresholds.fromEnv("TEMP", SensorThresholds.temperature())),
            new HumidityAnalyzer(SensorThresholds.fromEnv("HUMIDITY", SensorThresholds.humidity())),
            new LightAnalyzer(SensorThresholds.fromEnv("LIGHT", SensorThresholds.light()), ZoneId.systemDefault())
        );
        EnvironmentDataService environment = new EnvironmentDataService(
            gateway, cache, analyzer, clock, config.snapshotTtl(), config.staleThreshold());

        ScheduledExecutorService pumpStopTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pump-stop-timer");
            t.setDaemon(true);
            return t;
        });
        PumpController pump = new PumpController(
            gateway, cache, store, config.pump(), clock, environment, metrics, pumpStopTimer);
        IrrigationScheduler scheduler = new IrrigationScheduler(
            pump, cache, store, clock, config.scheduleCheckInterval(), metrics);
        RecommendationQueue recommendations = new RecommendationQueue(cache);
        DecisionLoop decisionLoop = new DecisionLoop(
            pump, environment, analyzer, recommendations, cache, store,
            config.decision(), clock, config.decisionInterval(), metrics);

        IrrigationOrchestrator orchestrator = new IrrigationOrchestrator(
            pump, scheduler, decisionLoop, recommendations, config, clock);

        // ═══════════════════════════════════════════════════════════════
        // Start
        // ═══════════════════════════════════════════════════════════════
        IrrigationOrchestrator.LifecycleResult started = orchestrator.start();
        log.info("✓ Scheduler running: {}, decision loop running: {}", started.scheduler(), started.decisionLoop());

        MonitoringServer monitoring = new MonitoringServer(orchestrator, metrics, config.monitoringPort());
        monitoring.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            monitoring.stop();
            IrrigationOrchestrator.LifecycleResult stopped = orchestrator.stop();
            if (!stopped.success()) {
                log.error("Shutdown incomplete: {}", stopped);
            }
            pumpStopTimer.shutdownNow();
            gateway.close();
            cache.close();
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown"));

        log.info("Greenhouse irrigation started (monitoring on port {})", config.monitoringPort());
    }

    private static List<FeedBinding> feedBindings(IrrigationConfig config) {
        String group = config.gateway().groupKey();
        List<FeedBinding> bindings = new ArrayList<>();
        for (SensorType type : SensorType.values()) {
            bindings.add(FeedBinding.inGroup(type.defaultFeedKey(), type.code(), group));
        }
        String pumpFeed = config.pump().feedKey();
        bindings.add(FeedBinding.inGroup(pumpFeed, FeedKeys.WATER_PUMP.equals(pumpFeed) ? "water_pump" : pumpFeed, group));
        return bindings;
    }

    private static HikariDataSource createDataSource(IrrigationConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("greenhouse-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }
}
