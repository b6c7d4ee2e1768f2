package com.livestockmart.marketplace.config;

import org.springframework.amqp.core.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String MARKETPLACE_EXCHANGE = "marketplace_events_exchange";

    // Audit queue: keeps a copy of every order event for downstream consumers
    public static final String Q_ORDER_AUDIT = "q.marketplace.order.audit";
    public static final String ROUTING_KEY_ORDER_ALL = "order.#";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange marketplaceEventsExchange() {
        return new TopicExchange(MARKETPLACE_EXCHANGE);
    }

    @Bean
    public Queue orderAuditQueue() {
        return createDurableQueue(Q_ORDER_AUDIT);
    }

    @Bean
    public Binding orderAuditBinding(Queue orderAuditQueue, TopicExchange marketplaceEventsExchange) {
        return BindingBuilder.bind(orderAuditQueue).to(marketplaceEventsExchange).with(ROUTING_KEY_ORDER_ALL);
    }

    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
