package in.greenhouse.infrastructure.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.greenhouse.config.DecisionConfig;
import in.greenhouse.domain.decision.ActionTaken;
import in.greenhouse.domain.decision.AiRecommendation;
import in.greenhouse.domain.decision.Decision;
import in.greenhouse.domain.decision.Priority;
import in.greenhouse.domain.decision.Urgency;
import in.greenhouse.domain.decision.WaterAmount;
import in.greenhouse.domain.pump.IrrigationEvent;
import in.greenhouse.domain.pump.PumpState;
import in.greenhouse.domain.pump.PumpStatus;
import in.greenhouse.domain.pump.TriggerSource;
import in.greenhouse.domain.schedule.ScheduleEntry;
import in.greenhouse.domain.sensor.EnvironmentSnapshot;
import in.greenhouse.domain.sensor.SensorReading;
import in.greenhouse.domain.sensor.SensorStatus;
import in.greenhouse.domain.sensor.SensorType;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON mapping for everything written to the fast cache and the durable store.
 *
 * Field names are snake_case; instants are ISO-8601 strings.
 */
public final class IrrigationJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IrrigationJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    public static JsonNode read(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Pump
    // ═══════════════════════════════════════════════════════════════

    public static ObjectNode toJson(PumpState s) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("is_on", s.on());
        putInstant(o, "start_time", s.startTime());
        putInstant(o, "scheduled_stop_time", s.scheduledStopTime());
        putInstant(o, "last_on_time", s.lastOnTime());
        putInstant(o, "last_off_time", s.lastOffTime());
        o.put("total_runtime_seconds", s.totalRuntimeSeconds());
        o.put("total_water_used", s.totalWaterUsed());
        if (s.startedBy() != null) {
            o.put("started_by", s.startedBy().code());
        }
        return o;
    }

    public static PumpState pumpState(JsonNode o) {
        return new PumpState(
            o.path("is_on").asBoolean(false),
            instant(o, "start_time"),
            instant(o, "scheduled_stop_time"),
            instant(o, "last_on_time"),
            instant(o, "last_off_time"),
            o.path("total_runtime_seconds").asDouble(0.0),
            o.path("total_water_used").asDouble(0.0),
            o.hasNonNull("started_by") ? TriggerSource.fromCode(o.get("started_by").asText()) : null
        );
    }

    public static ObjectNode toJson(PumpStatus s) {
        ObjectNode o = toJson(s.state());
        o.put("current_runtime_seconds", s.currentRuntimeSeconds());
        o.put("current_water_used", s.currentWaterUsed());
        o.put("remaining_seconds", s.remainingSeconds());
        if (s.gatewayOn() != null) {
            o.put("gateway_on", s.gatewayOn());
        } else {
            o.putNull("gateway_on");
        }
        o.put("state_synced", s.stateSynced());
        return o;
    }

    public static ObjectNode toJson(IrrigationEvent e) {
        ObjectNode o = MAPPER.createObjectNode();
        putInstant(o, "timestamp", e.endTime());
        putInstant(o, "start_time", e.startTime());
        o.put("duration_seconds", e.durationSeconds());
        o.put("water_amount_liters", e.waterLiters());
        o.put("source", e.source().code());
        ObjectNode details = o.putObject("details");
        e.details().forEach(details::put);
        putDouble(o, "moisture_before", e.moistureBefore());
        putDouble(o, "moisture_after", e.moistureAfter());
        return o;
    }

    public static IrrigationEvent irrigationEvent(JsonNode o) {
        Map<String, String> details = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = o.path("details").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            details.put(entry.getKey(), entry.getValue().asText());
        }
        return new IrrigationEvent(
            instant(o, "start_time"),
            instant(o, "timestamp"),
            o.path("duration_seconds").asDouble(0.0),
            o.path("water_amount_liters").asDouble(0.0),
            TriggerSource.fromCode(o.path("source").asText(null)),
            details,
            doubleOrNull(o, "moisture_before"),
            doubleOrNull(o, "moisture_after")
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // Schedules
    // ═══════════════════════════════════════════════════════════════

    public static ObjectNode toJson(ScheduleEntry s) {
        ObjectNode o = toJsonWithoutId(s);
        o.put("id", s.id());
        return o;
    }

    /**
     * Durable store layout: entries keyed by id, id not repeated inside the value.
     */
    public static ObjectNode toJsonWithoutId(ScheduleEntry s) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("name", s.name());
        ArrayNode days = o.putArray("days");
        s.days().forEach(days::add);
        o.put("start_time", s.startTimeText());
        o.put("duration", s.durationSeconds());
        o.put("active", s.active());
        putInstant(o, "created_at", s.createdAt());
        putInstant(o, "updated_at", s.updatedAt());
        return o;
    }

    public static ScheduleEntry scheduleEntry(String id, JsonNode o) {
        List<String> days = new ArrayList<>();
        for (JsonNode d : o.path("days")) {
            days.add(d.asText().toLowerCase());
        }
        String start = o.path("start_time").asText(null);
        String entryId = id != null ? id : o.path("id").asText(null);
        return new ScheduleEntry(
            entryId,
            o.path("name").asText(entryId),
            days,
            start == null ? null : LocalTime.parse(start, ScheduleEntry.TIME_FORMAT),
            o.path("duration").asInt(0),
            o.path("active").asBoolean(true),
            instant(o, "created_at"),
            instant(o, "updated_at")
        );
    }

    public static ArrayNode schedulesToJson(List<ScheduleEntry> entries) {
        ArrayNode array = MAPPER.createArrayNode();
        entries.forEach(e -> array.add(toJson(e)));
        return array;
    }

    public static List<ScheduleEntry> schedulesFromArray(JsonNode array) {
        List<ScheduleEntry> entries = new ArrayList<>();
        for (JsonNode item : array) {
            entries.add(scheduleEntry(null, item));
        }
        return entries;
    }

    // ═══════════════════════════════════════════════════════════════
    // Decisions
    // ═══════════════════════════════════════════════════════════════

    public static ObjectNode toJson(Decision d) {
        ObjectNode o = MAPPER.createObjectNode();
        putInstant(o, "timestamp", d.timestamp());
        o.put("needs_water", d.needsWater());
        o.put("urgency", d.urgency().code());
        o.put("reason", d.reason());
        o.put("water_amount", d.waterAmount().code());
        o.put("ai_override", d.aiOverride());
        ObjectNode sensors = o.putObject("sensor_values");
        d.sensorValues().forEach(sensors::put);
        o.put("environment_status", d.environmentStatus());
        ActionTaken a = d.actionTaken();
        if (a != null) {
            ObjectNode action = o.putObject("action_taken");
            action.put("action", a.action());
            action.put("duration", a.durationSeconds());
            action.put("success", a.success());
            action.put("message", a.message());
        }
        return o;
    }

    public static Decision decision(JsonNode o) {
        Map<String, Double> sensors = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = o.path("sensor_values").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            sensors.put(entry.getKey(), entry.getValue().asDouble());
        }
        ActionTaken action = null;
        JsonNode a = o.path("action_taken");
        if (a.isObject()) {
            action = new ActionTaken(
                a.path("action").asText(ActionTaken.NO_ACTION),
                a.path("duration").asLong(0),
                a.path("success").asBoolean(false),
                a.path("message").asText(null));
        }
        return new Decision(
            instant(o, "timestamp"),
            o.path("needs_water").asBoolean(false),
            Urgency.fromCode(o.path("urgency").asText(null)),
            o.path("reason").asText(null),
            WaterAmount.fromCode(o.path("water_amount").asText(null)),
            o.path("ai_override").asBoolean(false),
            sensors,
            o.path("environment_status").asText(null),
            action
        );
    }

    public static ObjectNode toJson(AiRecommendation r) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("should_irrigate", r.shouldIrrigate());
        o.put("duration_minutes", r.durationMinutes());
        o.put("reason", r.reason());
        o.put("confidence", r.confidence());
        ArrayNode zones = o.putArray("zones");
        r.zones().forEach(zones::add);
        o.put("source", r.source());
        o.put("priority", r.priority().code());
        putInstant(o, "timestamp", r.timestamp());
        return o;
    }

    public static AiRecommendation aiRecommendation(JsonNode o) {
        List<String> zones = new ArrayList<>();
        for (JsonNode z : o.path("zones")) {
            zones.add(z.asText());
        }
        return new AiRecommendation(
            o.path("should_irrigate").asBoolean(false),
            o.path("duration_minutes").asDouble(0.0),
            o.path("reason").asText(null),
            o.path("confidence").asDouble(0.0),
            zones,
            o.path("source").asText(null),
            Priority.fromCode(o.path("priority").asText(null)),
            instant(o, "timestamp")
        );
    }

    public static ObjectNode toJson(DecisionConfig c) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("enabled", c.enabled());
        o.put("min_decision_interval", c.minDecisionIntervalSeconds());
        ObjectNode durations = o.putObject("irrigation_durations");
        durations.put("light", c.lightDurationSeconds());
        durations.put("normal", c.normalDurationSeconds());
        durations.put("heavy", c.heavyDurationSeconds());
        o.put("ai_min_confidence", c.aiMinConfidence());
        return o;
    }

    /**
     * Missing fields fall back to the given defaults.
     */
    public static DecisionConfig decisionConfig(JsonNode o, DecisionConfig defaults) {
        JsonNode durations = o.path("irrigation_durations");
        return new DecisionConfig(
            o.path("enabled").asBoolean(defaults.enabled()),
            o.path("min_decision_interval").asLong(defaults.minDecisionIntervalSeconds()),
            durations.path("light").asLong(defaults.lightDurationSeconds()),
            durations.path("normal").asLong(defaults.normalDurationSeconds()),
            durations.path("heavy").asLong(defaults.heavyDurationSeconds()),
            o.path("ai_min_confidence").asDouble(defaults.aiMinConfidence())
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // Environment
    // ═══════════════════════════════════════════════════════════════

    public static ObjectNode toJson(EnvironmentSnapshot s) {
        ObjectNode o = MAPPER.createObjectNode();
        putInstant(o, "timestamp", s.timestamp());
        ObjectNode readings = o.putObject("readings");
        for (SensorReading r : s.readings().values()) {
            ObjectNode n = readings.putObject(r.type().code());
            n.put("value", r.value());
            n.put("raw_value", r.rawValue());
            n.put("unit", r.unit());
            putInstant(n, "timestamp", r.timestamp());
            n.put("status", r.status().code());
            n.put("feed_id", r.feedKey());
        }
        o.put("overall_status", s.overallStatus().code());
        return o;
    }

    public static EnvironmentSnapshot environmentSnapshot(JsonNode o) {
        Map<SensorType, SensorReading> readings = new EnumMap<>(SensorType.class);
        Iterator<Map.Entry<String, JsonNode>> it = o.path("readings").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            SensorType type = SensorType.fromCode(entry.getKey());
            JsonNode n = entry.getValue();
            readings.put(type, new SensorReading(
                type,
                n.path("value").asDouble(),
                n.path("raw_value").asText(null),
                n.path("unit").asText(type.unit()),
                instant(n, "timestamp"),
                SensorStatus.valueOf(n.path("status").asText("unknown").toUpperCase()),
                n.path("feed_id").asText(type.defaultFeedKey())
            ));
        }
        return new EnvironmentSnapshot(instant(o, "timestamp"), readings);
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private static void putInstant(ObjectNode o, String field, Instant value) {
        if (value == null) {
            o.putNull(field);
        } else {
            o.put(field, value.toString());
        }
    }

    private static void putDouble(ObjectNode o, String field, Double value) {
        if (value == null) {
            o.putNull(field);
        } else {
            o.put(field, value);
        }
    }

    private static Instant instant(JsonNode o, String field) {
        JsonNode n = o.get(field);
        return n == null || n.isNull() ? null : Instant.parse(n.asText());
    }

    private static Double doubleOrNull(JsonNode o, String field) {
        JsonNode n = o.get(field);
        return n == null || n.isNull() ? null : n.asDouble();
    }
}
