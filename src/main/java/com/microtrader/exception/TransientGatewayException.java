package com.microtrader.exception;

import lombok.Getter;

/**
 * A gateway call that may succeed if repeated: timeouts and rate limiting.
 * Callers retry these with bounded backoff and skip the instrument/order once attempts run out.
 */
@Getter
public class TransientGatewayException extends BaseException {

    public enum Kind {
        TIMEOUT,
        RATE_LIMITED
    }

    private final Kind kind;

    public TransientGatewayException(Kind kind, String message) {
        super(ErrorCode.GATEWAY_TRANSIENT, message);
        this.kind = kind;
    }

    public TransientGatewayException(Kind kind, String message, Throwable cause) {
        super(ErrorCode.GATEWAY_TRANSIENT, message, cause);
        this.kind = kind;
    }
}
