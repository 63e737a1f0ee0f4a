package com.drawdownwatch.monitor.domain.refresh;

public enum RefreshOutcome {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
