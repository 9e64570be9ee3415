package com.opsdash.realtimeservice.feed;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.listener.AsyncConsumerStartedEvent;
import org.springframework.amqp.rabbit.listener.ListenerContainerConsumerFailedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Event publisher of one listener container. Consumer failures and consumer (re)starts are
 * turned into connectivity changes of the channel; only transitions are reported.
 */
@Slf4j
final class ContainerHealthRelay implements ApplicationEventPublisher {

    private final String channelName;
    private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean connected = new AtomicBoolean(true);

    ContainerHealthRelay(String channelName) {
        this.channelName = channelName;
    }

    void addListener(Consumer<Boolean> listener) {
        listeners.add(listener);
    }

    @Override
    public void publishEvent(Object event) {
        if (event instanceof ListenerContainerConsumerFailedEvent failed) {
            if (connected.compareAndSet(true, false)) {
                log.warn("Channel lost: name={}, reason={}, fatal={}", channelName, failed.getReason(), failed.isFatal());
                notifyListeners(false);
            }
        } else if (event instanceof AsyncConsumerStartedEvent) {
            if (connected.compareAndSet(false, true)) {
                log.info("Channel restored: name={}", channelName);
                notifyListeners(true);
            }
        }
    }

    private void notifyListeners(boolean nowConnected) {
        for (Consumer<Boolean> listener : listeners) {
            try {
                listener.accept(nowConnected);
            } catch (RuntimeException e) {
                log.error("Connectivity listener failed: name={}", channelName, e);
            }
        }
    }
}
