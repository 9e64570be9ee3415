package com.opsdash.realtimeservice.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.common.exception.ConnectionException;
import com.opsdash.realtimeservice.config.AmqpConfig;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.AnonymousQueue;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Change feed over RabbitMQ.
 *
 * Every channel gets an exclusive auto-delete queue bound to row_changes_exchange with the
 * table name as routing key, consumed by its own listener container. The channel is live
 * once the container's consumers are up. Row filters are applied on receipt. Consumer
 * failures and recoveries of a live channel are reported through
 * {@link ChannelHandle#onConnectivityChange}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AmqpChangeFeedClient implements ChangeFeedClient {

    private final ConnectionFactory connectionFactory;
    private final AmqpAdmin amqpAdmin;
    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;

    private final TaskExecutor startupExecutor = new SimpleAsyncTaskExecutor("change-feed-");
    private final Set<AmqpChannel> openChannels = ConcurrentHashMap.newKeySet();

    @Override
    public ChannelHandle subscribe(String table, RowFilter filter, Consumer<ChangeEvent> onEvent) {
        String name = ChangeFeedClient.channelName(table, filter);
        AnonymousQueue queue = new AnonymousQueue();

        try {
            TopicExchange exchange = new TopicExchange(AmqpConfig.ROW_CHANGES_EXCHANGE);
            amqpAdmin.declareExchange(exchange);
            amqpAdmin.declareQueue(queue);
            amqpAdmin.declareBinding(BindingBuilder.bind(queue).to(exchange).with(table));
        } catch (AmqpException e) {
            throw new ConnectionException("Could not open channel " + name, e);
        }

        ContainerHealthRelay health = new ContainerHealthRelay(name);
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(queue.getName());
        container.setMessageListener(message -> onMessage(name, table, filter, message, onEvent));
        container.setApplicationEventPublisher(health);
        container.afterPropertiesSet();

        AmqpChannel channel = new AmqpChannel(name, table, filter, queue.getName(), container, health);
        openChannels.add(channel);

        startupExecutor.execute(() -> {
            try {
                container.start();
                if (container.isRunning()) {
                    log.debug("Channel live: name={}, queue={}", name, queue.getName());
                    channel.live.complete(null);
                } else {
                    channel.live.completeExceptionally(
                            new ConnectionException("Listener container for " + name + " did not start"));
                }
            } catch (Exception e) {
                channel.live.completeExceptionally(new ConnectionException("Could not start channel " + name, e));
            }
        });

        return channel;
    }

    @Override
    public void unsubscribe(ChannelHandle handle) {
        if (!(handle instanceof AmqpChannel channel) || !openChannels.remove(channel)) {
            return;
        }
        close(channel);
    }

    @Override
    public void probe() {
        Boolean open;
        try {
            open = rabbitTemplate.execute(ch -> ch.isOpen());
        } catch (AmqpException e) {
            throw new ConnectionException("Change feed unreachable", e);
        }
        if (!Boolean.TRUE.equals(open)) {
            throw new ConnectionException("Change feed channel is closed");
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} change feed channel(s)", openChannels.size());
        openChannels.forEach(this::close);
        openChannels.clear();
    }

    private void onMessage(String name, String table, RowFilter filter, Message message,
                           Consumer<ChangeEvent> onEvent) {
        ChangeEvent event;
        try {
            RowChangeMessage payload = objectMapper.readValue(message.getBody(), RowChangeMessage.class);
            event = toChangeEvent(payload, table, Instant.now());
        } catch (IOException | RuntimeException e) {
            log.warn("Dropping unreadable row change on {}: {}", name, e.getMessage());
            return;
        }

        if (filter != null && !filter.matches(event)) {
            return;
        }
        onEvent.accept(event);
    }

    ChangeEvent toChangeEvent(RowChangeMessage payload, String table, Instant receivedAt) {
        if (payload.getEventType() == null) {
            throw new IllegalArgumentException("Row change without event type");
        }
        String topic = payload.getTable() != null ? payload.getTable() : table;
        return ChangeEvent.of(
                topic,
                payload.getEventType(),
                RowRecord.of(payload.getNewRecord()),
                payload.getOldRecord() != null ? RowRecord.of(payload.getOldRecord()) : null,
                receivedAt);
    }

    private void close(AmqpChannel channel) {
        try {
            channel.container.stop();
            channel.container.destroy();
            amqpAdmin.deleteQueue(channel.queueName);
            log.debug("Channel closed: name={}", channel.name);
        } catch (AmqpException e) {
            // auto-delete removes the queue once the broker notices the consumer is gone
            log.warn("Error closing channel {}: {}", channel.name, e.getMessage());
        }
    }

    private static final class AmqpChannel implements ChannelHandle {
        private final String name;
        private final String table;
        private final RowFilter filter;
        private final String queueName;
        private final SimpleMessageListenerContainer container;
        private final ContainerHealthRelay health;
        private final CompletableFuture<Void> live = new CompletableFuture<>();

        private AmqpChannel(String name, String table, RowFilter filter, String queueName,
                            SimpleMessageListenerContainer container, ContainerHealthRelay health) {
            this.name = name;
            this.table = table;
            this.filter = filter;
            this.queueName = queueName;
            this.container = container;
            this.health = health;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getTable() {
            return table;
        }

        @Override
        public RowFilter getFilter() {
            return filter;
        }

        @Override
        public CompletableFuture<Void> live() {
            return live;
        }

        @Override
        public void onConnectivityChange(Consumer<Boolean> listener) {
            health.addListener(listener);
        }
    }
}
