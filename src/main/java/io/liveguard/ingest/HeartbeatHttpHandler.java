package io.liveguard.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.liveguard.model.HeartbeatSubmission;
import io.liveguard.storage.HeartbeatIntegrityException;
import io.liveguard.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@code POST /v1/heartbeat}. Body and response follow the agent wire contract.
 */
public final class HeartbeatHttpHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatHttpHandler.class);
    static final int MAX_BODY_BYTES = 64 * 1024;

    private final IngestGate gate;

    public HeartbeatHttpHandler(IngestGate gate) {
        this.gate = gate;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "POST");
                writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                return;
            }
            byte[] raw = exchange.getRequestBody().readNBytes(MAX_BODY_BYTES + 1);
            if (raw.length > MAX_BODY_BYTES) {
                writeJson(exchange, gate.rejectUnparseable("body too large").toReceipt(), 413);
                return;
            }
            HeartbeatSubmission submission;
            try {
                JsonNode body = Jsons.mapper().readTree(new String(raw, StandardCharsets.UTF_8));
                submission = HeartbeatSubmission.fromJson(body);
            } catch (IOException e) {
                AdmissionResult result = gate.rejectUnparseable("body is not a JSON object");
                writeJson(exchange, result.toReceipt(), result.httpStatus());
                return;
            } catch (IllegalArgumentException e) {
                AdmissionResult result = gate.rejectUnparseable(e.getMessage());
                writeJson(exchange, result.toReceipt(), result.httpStatus());
                return;
            }
            AdmissionResult result = gate.ingest(submission);
            writeJson(exchange, result.toReceipt(), result.httpStatus());
        } catch (HeartbeatIntegrityException e) {
            writeJson(exchange, Map.of(
                    "error", "heartbeat_integrity_violation",
                    "heartbeat_id", e.heartbeatId()
            ), 422);
        } catch (RuntimeException e) {
            log.error("Heartbeat ingest failed", e);
            writeJson(exchange, Map.of("error", "internal_error"), 500);
        } finally {
            exchange.close();
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
