package io.factorialsystems.identityservice.event;

import io.factorialsystems.identityservice.model.DomainEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stand-in used for the whole process lifetime when the bus was unreachable at start-up.
 * Drops every event; the first drop is logged as a warning.
 */
@Slf4j
public class DisabledEventNotifier implements EventNotifier {

    private final AtomicBoolean warned = new AtomicBoolean();

    @Override
    public void publish(DomainEvent event) {
        if (warned.compareAndSet(false, true)) {
            log.warn("Event bus unavailable, dropping {} event and all further events", event.topic());
        } else {
            log.debug("Event bus unavailable, dropping {} event", event.topic());
        }
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
