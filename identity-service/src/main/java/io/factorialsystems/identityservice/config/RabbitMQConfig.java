package io.factorialsystems.identityservice.config;

import io.factorialsystems.identityservice.event.DisabledEventNotifier;
import io.factorialsystems.identityservice.event.EventNotifier;
import io.factorialsystems.identityservice.event.RabbitEventNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Event bus wiring. The connection is probed once at start-up; if RabbitMQ cannot be reached
 * within the configured connection timeout, events are dropped for the process lifetime.
 */
@Slf4j
@Configuration
public class RabbitMQConfig {

    @Bean
    public TopicExchange identityEventsExchange(IdentityProperties properties) {
        return new TopicExchange(properties.getEvents().getExchange());
    }

    @Bean
    public MessageConverter converter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public EventNotifier eventNotifier(RabbitTemplate rabbitTemplate, IdentityProperties properties) {
        String exchange = properties.getEvents().getExchange();
        if (isRabbitMQHealthy(rabbitTemplate.getConnectionFactory())) {
            log.info("Publishing identity events to RabbitMQ exchange: {}", exchange);
            return new RabbitEventNotifier(rabbitTemplate, exchange);
        }

        log.warn("RabbitMQ unavailable, identity events will not be published");
        return new DisabledEventNotifier();
    }

    static boolean isRabbitMQHealthy(ConnectionFactory connectionFactory) {
        try (Connection connection = connectionFactory.createConnection()) {
            return connection.isOpen();
        } catch (Exception e) {
            log.warn("RabbitMQ health check failed: {}", e.getMessage());
            return false;
        }
    }
}
