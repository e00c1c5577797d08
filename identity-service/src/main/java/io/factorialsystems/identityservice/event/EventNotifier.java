package io.factorialsystems.identityservice.event;

import io.factorialsystems.identityservice.exception.PublishFailureException;
import io.factorialsystems.identityservice.model.DomainEvent;

/**
 * Best-effort publication of domain events to the message bus.
 */
public interface EventNotifier {

    /**
     * @throws PublishFailureException if the event could not be handed to the bus
     */
    void publish(DomainEvent event);

    boolean isEnabled();
}
