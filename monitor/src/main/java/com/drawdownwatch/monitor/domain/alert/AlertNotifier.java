package com.drawdownwatch.monitor.domain.alert;

import com.drawdownwatch.monitor.domain.recovery.RecoveryTrackingState;

/**
 * Outbound notification boundary. Calls are fire-and-forget: implementations log delivery
 * failures and never throw back into the pipeline.
 */
public interface AlertNotifier {

    void notifyAlert(Alert alert);

    void notifyRecovery(RecoveryTrackingState recovery);
}
