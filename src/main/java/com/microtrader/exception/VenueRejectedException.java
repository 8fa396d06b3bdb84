package com.microtrader.exception;

import lombok.Getter;

/**
 * The venue refused the request outright. Never retried: the opportunity (or close) is
 * dropped and logged.
 */
@Getter
public class VenueRejectedException extends BaseException {

    public enum Kind {
        REJECTED,
        INSUFFICIENT_FUNDS,
        NOT_FOUND,
        ALREADY_CLOSED
    }

    private final Kind kind;

    public VenueRejectedException(Kind kind, String message) {
        super(ErrorCode.VENUE_REJECTED, message);
        this.kind = kind;
    }
}
