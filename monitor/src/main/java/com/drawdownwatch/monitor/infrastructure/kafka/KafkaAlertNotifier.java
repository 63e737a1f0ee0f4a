package com.drawdownwatch.monitor.infrastructure.kafka;

import com.drawdownwatch.common.event.DrawdownAlertEvent;
import com.drawdownwatch.common.event.RecoverySignalEvent;
import com.drawdownwatch.common.kafka.KafkaTopics;
import com.drawdownwatch.monitor.domain.alert.Alert;
import com.drawdownwatch.monitor.domain.alert.AlertNotifier;
import com.drawdownwatch.monitor.domain.recovery.RecoveryTrackingState;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Publishes drawdown alerts keyed by symbol and recovery signals keyed by alert id. Send failures
 * are logged; nothing is retried or rolled back here.
 */
@Slf4j
@Component
public class KafkaAlertNotifier implements AlertNotifier {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Counter recoverySignalsCounter;
    private final Clock clock;

    public KafkaAlertNotifier(
            KafkaTemplate<String, Object> kafkaTemplate,
            @Qualifier("recoverySignalsCounter") Counter recoverySignalsCounter,
            Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.recoverySignalsCounter = recoverySignalsCounter;
        this.clock = clock;
    }

    @Override
    public void notifyAlert(Alert alert) {
        var event = DrawdownAlertEvent.builder()
                .alertId(alert.id())
                .symbol(alert.symbol())
                .market(alert.market())
                .timeframe(alert.timeframe())
                .threshold(alert.threshold())
                .dropPercentage(alert.dropPercentage())
                .price(alert.price())
                .historicalPrice(alert.historicalPrice())
                .critical(alert.critical())
                .timestamp(alert.timestamp())
                .build();
        send(KafkaTopics.DRAWDOWN_ALERTS, alert.symbol(), event, "alert " + alert.id());
    }

    @Override
    public void notifyRecovery(RecoveryTrackingState recovery) {
        var event = RecoverySignalEvent.builder()
                .alertId(recovery.alertId())
                .symbol(recovery.symbol())
                .market(recovery.market())
                .bottomPrice(recovery.bottomPrice())
                .currentPrice(recovery.currentPrice())
                .recoveryPercentage(recovery.recoveryPercentage())
                .signalledAt(clock.instant())
                .build();
        recoverySignalsCounter.increment();
        send(KafkaTopics.RECOVERY_SIGNALS, recovery.alertId(), event, "recovery of alert " + recovery.alertId());
    }

    private void send(String topic, String key, Object event, String description) {
        try {
            kafkaTemplate.send(topic, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to produce {} to {}: {}", description, topic, ex.getMessage());
                        } else {
                            log.debug("Produced {} to {} partition {}",
                                    description, topic, result.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to hand {} to the Kafka producer: {}", description, e.getMessage());
        }
    }
}
