package com.microtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    GATEWAY_TRANSIENT("GATEWAY_TRANSIENT", 503),
    VENUE_REJECTED("VENUE_REJECTED", 502);

    private final String code;
    private final int httpStatus;
}
