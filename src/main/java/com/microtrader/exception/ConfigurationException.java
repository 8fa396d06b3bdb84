package com.microtrader.exception;

/**
 * Missing or invalid limits at startup. Fatal: thrown while the configuration beans are being
 * built, so the application context (and with it the trading scheduler) never starts.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
