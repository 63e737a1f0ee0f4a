package com.drawdownwatch.monitor.infrastructure.db.recovery;

import com.drawdownwatch.common.market.Market;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "recovery_tracking")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryTrackingEntity {

    @Id
    @Column(name = "alert_id", length = 26)
    private String alertId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Market market;

    @Column(name = "bottom_price", nullable = false, precision = 18, scale = 6)
    private BigDecimal bottomPrice;

    @Column(name = "current_price", nullable = false, precision = 18, scale = 6)
    private BigDecimal currentPrice;

    @Column(name = "recovery_percentage", nullable = false, precision = 8, scale = 2)
    private BigDecimal recoveryPercentage;

    @Column(nullable = false)
    private boolean notified;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
