package com.microtrader.execution;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks which instruments have an entry order in flight and derives the idempotency key sent
 * to the venue as client order id.
 *
 * <p>At most one submission per instrument is in flight at any time: {@link #tryAcquire} refuses
 * a second one until the first is released. The key is a SHA-256 hash of (instrumentId + cycle
 * timestamp), so every retry of the same submission carries the same key and the venue can
 * de-duplicate a retry whose first attempt actually filled.
 */
@Component
public class InFlightOrderRegistry {

    private static final Logger log = LoggerFactory.getLogger(InFlightOrderRegistry.class);

    /** instrumentId -> idempotency key of the in-flight submission. */
    private final Map<String, String> inFlight = new ConcurrentHashMap<>();

    /**
     * Idempotency key for one instrument in one scan cycle.
     * Format: first 16 hex chars of sha256(instrumentId|epochMillis).
     */
    public String keyFor(String instrumentId, Instant cycleTimestamp) {
        return sha256(instrumentId + "|" + cycleTimestamp.toEpochMilli());
    }

    /**
     * @return true if the slot was free and is now held under {@code key}
     */
    public boolean tryAcquire(String instrumentId, String key) {
        String existing = inFlight.putIfAbsent(instrumentId, key);
        if (existing != null) {
            log.debug("Order for {} already in flight (key={})", instrumentId, existing);
            return false;
        }
        return true;
    }

    /** Frees the slot if it is still held under {@code key}. */
    public void release(String instrumentId, String key) {
        inFlight.remove(instrumentId, key);
    }

    public boolean isInFlight(String instrumentId) {
        return inFlight.containsKey(instrumentId);
    }

    public int size() {
        return inFlight.size();
    }

    /**
     * Computes SHA-256 and returns first 16 hex characters.
     */
    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
