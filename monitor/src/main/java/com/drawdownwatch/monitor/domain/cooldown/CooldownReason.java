package com.drawdownwatch.monitor.domain.cooldown;

public enum CooldownReason {
    FIRST_ALERT("first_alert"),
    NEW_DAY("new_day"),
    FURTHER_DROP("further_drop"),
    COOLDOWN_ACTIVE("cooldown_active"),
    TRACKING_STORE_UNAVAILABLE("tracking_store_unavailable");

    private final String code;

    CooldownReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
