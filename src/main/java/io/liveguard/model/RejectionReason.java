package io.liveguard.model;

/**
 * Why the ingest gate refused a heartbeat, with the HTTP status the wire surface reports.
 */
public enum RejectionReason {
    MALFORMED_PAYLOAD("malformed_payload", 400),
    SERVER_NOT_FOUND("server_not_found", 404),
    MISSING_PUBLIC_KEY("missing_public_key", 401),
    CONSENT_DENIED("consent_denied", 403),
    KEY_VERSION_MISMATCH("key_version_mismatch", 409),
    INVALID_SIGNATURE("invalid_signature", 401),
    TIMESTAMP_STALE("timestamp_stale", 400),
    TIMESTAMP_FUTURE("timestamp_future", 400);

    private final String code;
    private final int httpStatus;

    RejectionReason(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Conflict-class reasons tell the agent to fix its configuration, not its credentials. */
    public boolean conflict() {
        return httpStatus == 409;
    }
}
