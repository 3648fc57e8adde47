package io.liveguard.security;

import io.liveguard.model.HeartbeatSubmission;
import io.liveguard.util.Jsons;
import io.liveguard.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the bytes an agent signs: the whitelisted envelope fields as compact JSON with
 * sorted keys, explicit nulls and the timestamp rewritten to {@code yyyy-MM-ddTHH:mm:ssZ}.
 */
public final class HeartbeatCanonicalizer {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatCanonicalizer.class);

    public static final List<String> SIGNED_FIELDS = List.of(
            "server_id", "key_version", "timestamp", "heartbeat_id", "status",
            "map_name", "players_current", "players_capacity", "agent_version"
    );
    private static final Set<String> NEVER_SIGNED = Set.of("signature", "payload");
    static final int MAX_REPORTED_UNKNOWN_FIELDS = 256;
    // field names come from callers; only the first MAX_REPORTED_UNKNOWN_FIELDS are remembered
    private static final Set<String> REPORTED_UNKNOWN = ConcurrentHashMap.newKeySet();

    private HeartbeatCanonicalizer() {
    }

    public static byte[] canonicalBytes(HeartbeatSubmission submission) {
        submission.unknownFields().forEach(HeartbeatCanonicalizer::reportUnknown);
        return canonicalBytes(submission.envelope());
    }

    public static byte[] canonicalBytes(Map<String, ?> envelope) {
        Map<String, Object> signed = new TreeMap<>();
        for (String field : SIGNED_FIELDS) {
            signed.put(field, envelope.get(field));
        }
        for (String key : envelope.keySet()) {
            if (!signed.containsKey(key) && !NEVER_SIGNED.contains(key)) {
                reportUnknown(key);
            }
        }
        signed.put("timestamp", normalizeTimestamp(envelope.get("timestamp")));
        return Jsons.toCompactJson(signed).getBytes(StandardCharsets.UTF_8);
    }

    public static String canonicalString(HeartbeatSubmission submission) {
        return new String(canonicalBytes(submission), StandardCharsets.UTF_8);
    }

    static Object normalizeTimestamp(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Instant) {
            return Timestamps.formatUtcSeconds((Instant) raw);
        }
        Instant parsed = Timestamps.parse(raw.toString());
        // unreadable values are signed as sent; the gate rejects them before verification
        return parsed == null ? raw.toString() : Timestamps.formatUtcSeconds(parsed);
    }

    static int reportedUnknownFieldCount() {
        return REPORTED_UNKNOWN.size();
    }

    private static void reportUnknown(String field) {
        if (REPORTED_UNKNOWN.contains(field)) {
            return;
        }
        if (REPORTED_UNKNOWN.size() >= MAX_REPORTED_UNKNOWN_FIELDS) {
            log.debug("Heartbeat field '{}' is not part of the signed envelope and was ignored", field);
            return;
        }
        if (REPORTED_UNKNOWN.add(field)) {
            log.info("Heartbeat field '{}' is not part of the signed envelope and was ignored", field);
        }
    }
}
