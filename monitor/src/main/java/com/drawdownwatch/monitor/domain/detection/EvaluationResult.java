package com.drawdownwatch.monitor.domain.detection;

import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.alert.Alert;

import java.util.List;

public record EvaluationResult(Market market, List<Alert> emitted, int suppressed) {}
