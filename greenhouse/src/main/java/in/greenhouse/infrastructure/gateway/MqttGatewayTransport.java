package in.greenhouse.infrastructure.gateway;

import in.greenhouse.config.GatewayConfig;
import in.greenhouse.domain.feed.FeedMessageHandler;
import in.greenhouse.domain.feed.TransportKind;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Low-latency publish/subscribe channel to the gateway over MQTT.
 *
 * Topics follow {username}/feeds/{feedKey}. Every registered handler is re-subscribed
 * after each (re)connect. An unexpected disconnect schedules a reconnect after the
 * configured retry delay; authentication failures stop reconnecting.
 *
 * Inbound messages are dispatched on Paho's receive thread. Handler exceptions are
 * logged and never reach the client.
 */
public class MqttGatewayTransport implements GatewayTransport, MqttCallbackExtended {
    private static final Logger log = LoggerFactory.getLogger(MqttGatewayTransport.class);

    private static final int QOS = 1;

    private final GatewayConfig config;
    private final IMqttClient client;
    private final Map<String, FeedMessageHandler> handlers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService reconnectExecutor;

    private volatile boolean stopped = false;

    public MqttGatewayTransport(GatewayConfig config) {
        this(config, createClient(config));
    }

    public MqttGatewayTransport(GatewayConfig config, IMqttClient client) {
        this.config = config;
        this.client = client;
        this.client.setCallback(this);
        this.reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mqtt-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    private static IMqttClient createClient(GatewayConfig config) {
        String clientId = "greenhouse-" + UUID.randomUUID().toString().substring(0, 8);
        try {
            return new MqttClient(config.mqttServerUri(), clientId, new MemoryPersistence());
        } catch (MqttException e) {
            throw new GatewayException(config.mqttServerUri(), "Cannot create MQTT client: " + e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    /**
     * Connect and subscribe registered handlers.
     *
     * @throws GatewayAuthenticationException when the broker rejects the credentials
     * @throws GatewayException for any other refusal
     */
    public synchronized void connect() {
        stopped = false;
        if (client.isConnected()) {
            return;
        }
        MqttConnectOptions options = new MqttConnectOptions();
        options.setUserName(config.username());
        options.setPassword(config.apiKey().toCharArray());
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setConnectionTimeout((int) config.requestTimeout().toSeconds());
        try {
            client.connect(options);
            log.info("[MQTT] Connected to {}", config.mqttServerUri());
        } catch (MqttException e) {
            throw translateConnectFailure(e);
        }
    }

    public synchronized void disconnect() {
        stopped = true;
        reconnectExecutor.shutdownNow();
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
            log.info("[MQTT] Disconnected");
        } catch (MqttException e) {
            log.warn("[MQTT] Error while disconnecting: {}", e.getMessage());
        }
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    /**
     * Map an MQTT CONNACK refusal to the gateway error taxonomy.
     */
    static GatewayException translateConnectFailure(MqttException e) {
        String broker = "mqtt";
        switch (e.getReasonCode()) {
            case MqttException.REASON_CODE_INVALID_PROTOCOL_VERSION:
                return new GatewayException(broker, "Connection refused: incorrect protocol version", e);
            case MqttException.REASON_CODE_INVALID_CLIENT_ID:
                return new GatewayException(broker, "Connection refused: client id rejected", e);
            case MqttException.REASON_CODE_BROKER_UNAVAILABLE:
                return new GatewayTransientException(broker, "Connection refused: server unavailable", e);
            case MqttException.REASON_CODE_FAILED_AUTHENTICATION:
                return new GatewayAuthenticationException(broker, "Connection refused: bad username or password", e);
            case MqttException.REASON_CODE_NOT_AUTHORIZED:
                return new GatewayAuthenticationException(broker, "Connection refused: not authorized", e);
            default:
                return new GatewayTransientException(broker, "Connection failed: " + e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Transport
    // ═══════════════════════════════════════════════════════════════

    @Override
    public TransportKind kind() {
        return TransportKind.PUBSUB;
    }

    @Override
    public boolean isAvailable() {
        return !stopped && client.isConnected();
    }

    @Override
    public void send(String feedKey, String value) {
        String topic = config.topicFor(feedKey);
        if (!client.isConnected()) {
            throw new GatewayTransientException(topic, "MQTT client not connected");
        }
        try {
            MqttMessage message = new MqttMessage(value.getBytes(StandardCharsets.UTF_8));
            message.setQos(QOS);
            client.publish(topic, message);
            log.debug("[MQTT] Published '{}' to {}", value, topic);
        } catch (MqttException e) {
            throw new GatewayTransientException(topic, "Publish failed: " + e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Subscriptions
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register a handler; subscribes now if connected, otherwise on the next connect.
     */
    public void subscribe(String feedKey, FeedMessageHandler handler) {
        handlers.put(feedKey, handler);
        if (client.isConnected()) {
            subscribeTopic(feedKey);
        }
    }

    public int handlerCount() {
        return handlers.size();
    }

    private void subscribeTopic(String feedKey) {
        String topic = config.topicFor(feedKey);
        try {
            client.subscribe(topic, QOS);
            log.info("[MQTT] Subscribed to {}", topic);
        } catch (MqttException e) {
            log.error("[MQTT] Subscribe to {} failed: {}", topic, e.getMessage());
        }
    }

    void dispatch(String topic, String payload) {
        String feedKey = feedKeyOf(topic);
        FeedMessageHandler handler = handlers.get(feedKey);
        if (handler == null) {
            log.debug("[MQTT] No handler for {}", topic);
            return;
        }
        try {
            handler.onMessage(feedKey, payload);
        } catch (Exception e) {
            log.error("[MQTT] Handler for feed {} failed: {}", feedKey, e.getMessage(), e);
        }
    }

    private static String feedKeyOf(String topic) {
        int idx = topic.lastIndexOf("/feeds/");
        return idx >= 0 ? topic.substring(idx + "/feeds/".length()) : topic;
    }

    // ═══════════════════════════════════════════════════════════════
    // Paho callbacks
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        log.info("[MQTT] {} to {}, re-subscribing {} feed(s)",
            reconnect ? "Reconnected" : "Connected", serverURI, handlers.size());
        for (String feedKey : handlers.keySet()) {
            subscribeTopic(feedKey);
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        if (stopped) {
            return;
        }
        log.warn("[MQTT] Connection lost: {}; reconnecting in {}ms",
            cause != null ? cause.getMessage() : "unknown", config.retryDelay().toMillis());
        scheduleReconnect();
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        dispatch(topic, new String(message.getPayload(), StandardCharsets.UTF_8));
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        log.trace("[MQTT] Delivery complete");
    }

    private void scheduleReconnect() {
        if (stopped || reconnectExecutor.isShutdown()) {
            return;
        }
        reconnectExecutor.schedule(this::reconnect, config.retryDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void reconnect() {
        if (stopped) {
            return;
        }
        try {
            connect();
        } catch (GatewayAuthenticationException e) {
            log.error("[MQTT] Reconnect rejected, giving up: {}", e.getMessage());
        } catch (GatewayException e) {
            log.warn("[MQTT] Reconnect failed: {}", e.getMessage());
            scheduleReconnect();
        }
    }
}
