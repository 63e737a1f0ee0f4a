package com.drawdownwatch.common.kafka;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class KafkaTopics {

    public static final String DRAWDOWN_ALERTS = "drawdown-alerts";
    public static final String RECOVERY_SIGNALS = "recovery-signals";
}
