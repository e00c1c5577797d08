package io.factorialsystems.identityservice.cache;

public enum CacheMode {
    /** Entries live in Redis and are shared by every instance. */
    SHARED,
    /** Redis was unreachable at start-up; entries live in this process only. */
    DEGRADED
}
