package io.factorialsystems.identityservice.support;

import java.time.Duration;

/**
 * Absolute point in time by which a request must have finished. Created once per request from
 * the configured timeout and passed down to every external call the request makes.
 */
public final class Deadline {

    private final Duration timeout;
    private final long expiresAtNanos;

    private Deadline(Duration timeout, long expiresAtNanos) {
        this.timeout = timeout;
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be zero or positive");
        }
        return new Deadline(timeout, System.nanoTime() + timeout.toNanos());
    }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }

    /**
     * The timeout this deadline was created with, used in error messages.
     */
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "Deadline{timeout=" + timeout + ", remaining=" + remaining() + "}";
    }
}
