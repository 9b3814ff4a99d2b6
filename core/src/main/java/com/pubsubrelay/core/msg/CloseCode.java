package com.pubsubrelay.core.msg;

/**
 * WebSocket close codes used when a join is rejected before {@code ready}.
 * <p>
 * Clients distinguish rejection causes by code; the reason text is informational.
 * </p>
 */
public enum CloseCode {
    UNAUTHORIZED(4001, "unauthorized"),
    CHANNEL_REQUIRED(4002, "channel required"),
    INVALID_METADATA(4003, "invalid metadata format"),
    CONTEXT_ID_MISMATCH(4005, "contextId mismatch"),
    CHANNEL_HAS_NO_CONTEXT(4006, "channel has no contextId"),
    GOING_AWAY(1001, "server shutting down"),
    INTERNAL_ERROR(1011, "internal error");

    private final int code;
    private final String reason;

    CloseCode(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }
}
