package com.opsdash.realtimeservice.feed;

import com.opsdash.realtimeservice.config.AmqpConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;

/**
 * Publishes row changes to the change feed after the database write commits.
 * Writes made outside a transaction are published immediately.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RowChangePublisher {

    private final RabbitTemplate rabbitTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRowChanged(RowChangedEvent event) {
        RowChangeMessage message = RowChangeMessage.builder()
                .table(event.getTable())
                .eventType(event.getEventType())
                .newRecord(event.getNewRow())
                .oldRecord(event.getOldRow())
                .commitTimestamp(Instant.now())
                .build();

        try {
            rabbitTemplate.convertAndSend(AmqpConfig.ROW_CHANGES_EXCHANGE, event.getTable(), message);
            log.debug("Row change published: table={}, eventType={}", event.getTable(), event.getEventType());
        } catch (Exception e) {
            // the write is already committed; subscribers catch up on their next full reload
            log.error("Failed to publish row change: table={}, eventType={}, error={}",
                    event.getTable(), event.getEventType(), e.getMessage());
        }
    }
}
