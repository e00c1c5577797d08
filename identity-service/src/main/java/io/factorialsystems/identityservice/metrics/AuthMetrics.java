package io.factorialsystems.identityservice.metrics;

import java.time.Duration;

/**
 * Counters and timers recorded by the identity service. Injected rather than global so the
 * service can be exercised without a metrics backend.
 *
 * <p>Tags are given as alternating key/value pairs.
 */
public interface AuthMetrics {

    String REGISTRATIONS = "identity.registrations";
    String LOGINS = "identity.logins";
    String PROFILE_CACHE = "identity.profile.cache";
    String EVENT_PUBLISH_FAILURES = "identity.events.publish.failures";
    String STORE_QUERY = "identity.store.query";

    void increment(String name, String... tags);

    void record(String name, Duration duration, String... tags);
}
