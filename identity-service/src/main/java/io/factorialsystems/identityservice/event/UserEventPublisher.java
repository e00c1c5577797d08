package io.factorialsystems.identityservice.event;

import io.factorialsystems.identityservice.exception.PublishFailureException;
import io.factorialsystems.identityservice.metrics.AuthMetrics;
import io.factorialsystems.identityservice.model.DomainEvent;
import io.factorialsystems.identityservice.model.UserIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Announces user lifecycle events on the bus, off the request thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserEventPublisher {

    private final EventNotifier eventNotifier;
    private final AuthMetrics metrics;

    /**
     * Publishes {@code user.registered} asynchronously. Failures are logged and counted, never
     * rethrown: registration has already succeeded when this runs.
     */
    @Async
    public void publishUserRegistered(UserIdentity user) {
        DomainEvent event = DomainEvent.userRegistered(user);
        try {
            eventNotifier.publish(event);
            if (eventNotifier.isEnabled()) {
                log.info("Published {} event for user: {}", event.topic(), user.getId());
            }
        } catch (PublishFailureException e) {
            metrics.increment(AuthMetrics.EVENT_PUBLISH_FAILURES, "topic", event.topic());
            log.error("Failed to publish {} event for user: {}", event.topic(), user.getId(), e);
        }
    }
}
