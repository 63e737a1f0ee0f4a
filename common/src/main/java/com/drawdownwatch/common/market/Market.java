package com.drawdownwatch.common.market;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Markets whose instruments are tracked. Each market owns the time zone that defines its
 * calendar day and its regular trading session.
 */
public enum Market {
    INDIA(ZoneId.of("Asia/Kolkata"), LocalTime.of(9, 15), LocalTime.of(15, 30)),
    USA(ZoneId.of("America/New_York"), LocalTime.of(9, 30), LocalTime.of(16, 0));

    private final ZoneId zone;
    private final LocalTime sessionOpen;
    private final LocalTime sessionClose;

    Market(ZoneId zone, LocalTime sessionOpen, LocalTime sessionClose) {
        this.zone = zone;
        this.sessionOpen = sessionOpen;
        this.sessionClose = sessionClose;
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalTime sessionOpen() {
        return sessionOpen;
    }

    public LocalTime sessionClose() {
        return sessionClose;
    }

    /** Calendar date of {@code instant} in this market's time zone. */
    public LocalDate localDate(Instant instant) {
        return LocalDate.ofInstant(instant, zone);
    }

    /** Monday to Friday, session open through session close inclusive. Holidays are not modelled. */
    public boolean isTradingHours(Instant instant) {
        var local = instant.atZone(zone);
        var day = local.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        var time = local.toLocalTime();
        return !time.isBefore(sessionOpen) && !time.isAfter(sessionClose);
    }
}
