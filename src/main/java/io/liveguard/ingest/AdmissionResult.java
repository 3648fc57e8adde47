package io.liveguard.ingest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.liveguard.model.RejectionReason;
import io.liveguard.util.Jsons;

/**
 * Outcome of one heartbeat submission. Rejections are values here, not exceptions.
 *
 * @param processed false when the heartbeat was stored but the fast-path update failed
 */
public record AdmissionResult(
        String serverId,
        boolean accepted,
        boolean replay,
        boolean processed,
        RejectionReason reason
) {
    public static AdmissionResult accepted(String serverId, boolean processed) {
        return new AdmissionResult(serverId, true, false, processed, null);
    }

    public static AdmissionResult replay(String serverId) {
        return new AdmissionResult(serverId, true, true, true, null);
    }

    public static AdmissionResult rejected(String serverId, RejectionReason reason) {
        return new AdmissionResult(serverId, false, false, false, reason);
    }

    public int httpStatus() {
        return accepted ? 200 : reason.httpStatus();
    }

    /**
     * Response body of the wire contract: {@code received, server_id, processed, replay}, plus
     * {@code error} for rejections.
     */
    public ObjectNode toReceipt() {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("received", accepted);
        out.put("server_id", serverId);
        out.put("processed", processed);
        out.put("replay", replay);
        if (reason != null) {
            out.put("error", reason.code());
        }
        return out;
    }
}
