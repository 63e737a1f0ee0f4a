package com.drawdownwatch.monitor.infrastructure.gateway;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailyClose(LocalDate date, BigDecimal close) {}
