package com.drawdownwatch.monitor.infrastructure.db.alert;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.common.market.Timeframe;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "alerts")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertEntity {

    @Id
    @Column(length = 26)
    private String id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Market market;

    @Column(name = "drop_percentage", nullable = false, precision = 8, scale = 2)
    private BigDecimal dropPercentage;

    @Column(nullable = false)
    private int threshold;

    @Column(nullable = false, length = 4)
    private Timeframe timeframe;

    @Column(nullable = false, precision = 18, scale = 6)
    private BigDecimal price;

    @Column(name = "historical_price", nullable = false, precision = 18, scale = 6)
    private BigDecimal historicalPrice;

    @Column(name = "triggered_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private boolean critical;
}
