package com.kabadi.pickupservice.config;

import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String PICKUP_EXCHANGE = "pickup_events_exchange";

    // Routing keys are "pickup." + lower-case status, e.g. pickup.assigned
    public static final String ROUTING_KEY_PREFIX = "pickup.";

    @Bean
    public TopicExchange pickupEventsExchange() {
        return new TopicExchange(PICKUP_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
