package com.drawdownwatch.monitor.domain.recovery;

public enum RecoveryStatus {
    TRACKING,
    RECOVERED
}
