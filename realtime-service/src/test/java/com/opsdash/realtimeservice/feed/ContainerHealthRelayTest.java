package com.opsdash.realtimeservice.feed;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.rabbit.listener.AsyncConsumerStartedEvent;
import org.springframework.amqp.rabbit.listener.AsyncConsumerStoppedEvent;
import org.springframework.amqp.rabbit.listener.ListenerContainerConsumerFailedEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ContainerHealthRelayTest {

    private static final Object CONTAINER = "deliveries-container";

    private ContainerHealthRelay relay;
    private List<Boolean> changes;

    @BeforeEach
    void setUp() {
        relay = new ContainerHealthRelay("deliveries_changes");
        changes = new CopyOnWriteArrayList<>();
        relay.addListener(changes::add);
    }

    private static ListenerContainerConsumerFailedEvent consumerFailed() {
        return new ListenerContainerConsumerFailedEvent(CONTAINER, "Consumer raised exception, attempting restart",
                new IllegalStateException("connection reset"), false);
    }

    @Test
    void consumerFailure_ReportsDisconnected() {
        // Act
        relay.publishEvent(consumerFailed());

        // Assert
        assertThat(changes).containsExactly(false);
    }

    @Test
    void consumerRestartAfterFailure_ReportsConnectedAgain() {
        // Arrange
        relay.publishEvent(consumerFailed());

        // Act
        relay.publishEvent(new AsyncConsumerStartedEvent(CONTAINER, "consumer-2"));

        // Assert
        assertThat(changes).containsExactly(false, true);
    }

    @Test
    void initialConsumerStart_IsNotReported() {
        // Act
        relay.publishEvent(new AsyncConsumerStartedEvent(CONTAINER, "consumer-1"));

        // Assert
        assertThat(changes).isEmpty();
    }

    @Test
    void repeatedFailures_ReportedOnce() {
        // Act
        relay.publishEvent(consumerFailed());
        relay.publishEvent(consumerFailed());

        // Assert
        assertThat(changes).containsExactly(false);
    }

    @Test
    void unrelatedEvents_AreIgnored() {
        // Act
        relay.publishEvent(new AsyncConsumerStoppedEvent(CONTAINER, "consumer-1"));
        relay.publishEvent("not an event");

        // Assert
        assertThat(changes).isEmpty();
    }

    @Test
    void throwingListener_DoesNotStopOthers() {
        // Arrange
        List<Boolean> second = new CopyOnWriteArrayList<>();
        relay = new ContainerHealthRelay("deliveries_changes");
        relay.addListener(connected -> {
            throw new IllegalStateException("boom");
        });
        relay.addListener(second::add);

        // Act
        relay.publishEvent(consumerFailed());

        // Assert
        assertThat(second).containsExactly(false);
    }
}
