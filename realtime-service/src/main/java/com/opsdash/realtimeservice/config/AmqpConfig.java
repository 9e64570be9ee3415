package com.opsdash.realtimeservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for the realtime service.
 *
 * Two exchanges:
 * - row_changes_exchange carries row-level changes, routing key = table name.
 *   Change-feed channels bind their own exclusive queues to it at runtime.
 * - workflow_events_exchange carries approval workflow and project events
 *   that end up as notifications. One durable queue, several bindings.
 */
@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String ROW_CHANGES_EXCHANGE = "row_changes_exchange";

    public static final String WORKFLOW_EXCHANGE = "workflow_events_exchange";
    public static final String Q_WORKFLOW_EVENTS = "q.notification.workflow.events";

    public static final String ROUTING_KEY_APPROVAL_REQUESTED = "workflow.approval.requested";
    public static final String ROUTING_KEY_WORKFLOW_APPROVED = "workflow.approved";
    public static final String ROUTING_KEY_WORKFLOW_REJECTED = "workflow.rejected";
    public static final String ROUTING_KEY_PROJECT_UPDATED = "project.updated";

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
    public TopicExchange rowChangesExchange() {
        return new TopicExchange(ROW_CHANGES_EXCHANGE);
    }

    @Bean
    public TopicExchange workflowEventsExchange() {
        return new TopicExchange(WORKFLOW_EXCHANGE);
    }

    @Bean
    public Queue workflowEventsQueue() {
        return createDurableQueue(Q_WORKFLOW_EVENTS);
    }

    @Bean
    public Binding approvalRequestedBinding(Queue workflowEventsQueue, TopicExchange workflowEventsExchange) {
        return BindingBuilder.bind(workflowEventsQueue).to(workflowEventsExchange).with(ROUTING_KEY_APPROVAL_REQUESTED);
    }

    @Bean
    public Binding workflowApprovedBinding(Queue workflowEventsQueue, TopicExchange workflowEventsExchange) {
        return BindingBuilder.bind(workflowEventsQueue).to(workflowEventsExchange).with(ROUTING_KEY_WORKFLOW_APPROVED);
    }

    @Bean
    public Binding workflowRejectedBinding(Queue workflowEventsQueue, TopicExchange workflowEventsExchange) {
        return BindingBuilder.bind(workflowEventsQueue).to(workflowEventsExchange).with(ROUTING_KEY_WORKFLOW_REJECTED);
    }

    @Bean
    public Binding projectUpdatedBinding(Queue workflowEventsQueue, TopicExchange workflowEventsExchange) {
        return BindingBuilder.bind(workflowEventsQueue).to(workflowEventsExchange).with(ROUTING_KEY_PROJECT_UPDATED);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    // poison messages go to the DLQ instead of being redelivered forever
    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
