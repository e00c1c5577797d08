package io.factorialsystems.identityservice.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;

    @Override
    public void increment(String name, String... tags) {
        registry.counter(name, Tags.of(tags)).increment();
    }

    @Override
    public void record(String name, Duration duration, String... tags) {
        registry.timer(name, Tags.of(tags)).record(duration);
    }
}
