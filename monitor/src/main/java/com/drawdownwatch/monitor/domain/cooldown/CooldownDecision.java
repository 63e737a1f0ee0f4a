package com.drawdownwatch.monitor.domain.cooldown;

public record CooldownDecision(boolean emit, CooldownReason reason) {

    public static CooldownDecision emit(CooldownReason reason) {
        return new CooldownDecision(true, reason);
    }

    public static CooldownDecision suppress() {
        return new CooldownDecision(false, CooldownReason.COOLDOWN_ACTIVE);
    }
}
