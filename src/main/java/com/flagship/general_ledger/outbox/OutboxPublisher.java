package com.flagship.general_ledger.outbox;

import com.flagship.general_ledger.audit.OutboxAuditLogSink;
import com.flagship.general_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Polls the outbox and publishes pending rows to Kafka.
 *
 * Domain events go to the ledger events topic and audit records to the
 * audit topic. The aggregate ID is the record key, so all events of one
 * journal entry or period land on the same partition in order.
 * Rows that fail {@code outbox.publisher.max-retries} times stop being
 * polled and are counted as dead-lettered.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger.events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.audit:ledger.audit}")
    private String auditTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        String key = event.getAggregateId().toString();

        try {
            // Wait for the broker ack before marking the row published
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(topic, key, event.getPayload());
            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            int retries = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (retries >= maxRetries) {
                log.warn("Event {} exceeded max retries ({}), no longer polled. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        if (OutboxAuditLogSink.AGGREGATE_TYPE.equals(event.getAggregateType())) {
            return auditTopic;
        }
        return ledgerEventsTopic;
    }
}
