package io.factorialsystems.identityservice.event;

import io.factorialsystems.identityservice.exception.PublishFailureException;
import io.factorialsystems.identityservice.model.DomainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * Publishes events to a RabbitMQ topic exchange, using the event topic as routing key.
 */
@Slf4j
public class RabbitEventNotifier implements EventNotifier {

    private final RabbitTemplate rabbitTemplate;
    private final String exchange;

    public RabbitEventNotifier(RabbitTemplate rabbitTemplate, String exchange) {
        this.rabbitTemplate = rabbitTemplate;
        this.exchange = exchange;
    }

    @Override
    public void publish(DomainEvent event) {
        try {
            // Jackson2JsonMessageConverter serializes the payload map
            rabbitTemplate.convertAndSend(exchange, event.topic(), event.payload());
            log.debug("Published {} event to exchange: {}", event.topic(), exchange);
        } catch (AmqpException e) {
            throw new PublishFailureException("Failed to publish " + event.topic() + " event", e);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
