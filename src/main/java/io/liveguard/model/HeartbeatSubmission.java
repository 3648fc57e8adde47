package io.liveguard.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Heartbeat exactly as an agent submitted it. Nothing here is trusted or normalized yet;
 * {@code timestamp} and {@code status} stay raw strings until the gate validates them.
 */
public record HeartbeatSubmission(
        String serverId,
        Integer keyVersion,
        String timestamp,
        String heartbeatId,
        String status,
        String mapName,
        Integer playersCurrent,
        Integer playersCapacity,
        String agentVersion,
        JsonNode payload,
        String signature,
        Set<String> unknownFields
) {
    private static final Set<String> KNOWN_FIELDS = Set.of(
            "server_id", "key_version", "timestamp", "heartbeat_id", "status", "map_name",
            "players_current", "players_capacity", "agent_version", "payload", "signature"
    );

    public HeartbeatSubmission {
        unknownFields = unknownFields == null ? Set.of() : Set.copyOf(unknownFields);
    }

    /**
     * Reads the wire contract. Absent or null fields become nulls for the gate to judge; a known
     * field carrying the wrong JSON type fails with {@link IllegalArgumentException} naming it.
     */
    public static HeartbeatSubmission fromJson(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("heartbeat body must be a JSON object");
        }
        Set<String> unknown = new LinkedHashSet<>();
        Iterator<String> names = body.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_FIELDS.contains(name)) {
                unknown.add(name);
            }
        }
        JsonNode payload = body.get("payload");
        return new HeartbeatSubmission(
                text(body, "server_id"),
                integer(body, "key_version"),
                text(body, "timestamp"),
                text(body, "heartbeat_id"),
                text(body, "status"),
                text(body, "map_name"),
                integer(body, "players_current"),
                integer(body, "players_capacity"),
                text(body, "agent_version"),
                payload == null || payload.isNull() ? null : payload,
                text(body, "signature"),
                unknown
        );
    }

    /**
     * Fields as they appear on the wire, signature and payload excluded, nulls kept.
     */
    public Map<String, Object> envelope() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("server_id", serverId);
        out.put("key_version", keyVersion);
        out.put("timestamp", timestamp);
        out.put("heartbeat_id", heartbeatId);
        out.put("status", status);
        out.put("map_name", mapName);
        out.put("players_current", playersCurrent);
        out.put("players_capacity", playersCapacity);
        out.put("agent_version", agentVersion);
        return out;
    }

    public HeartbeatSubmission withSignature(String newSignature) {
        return new HeartbeatSubmission(serverId, keyVersion, timestamp, heartbeatId, status, mapName,
                playersCurrent, playersCapacity, agentVersion, payload, newSignature, unknownFields);
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return node.asText();
    }

    private static Integer integer(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return node.intValue();
    }
}
