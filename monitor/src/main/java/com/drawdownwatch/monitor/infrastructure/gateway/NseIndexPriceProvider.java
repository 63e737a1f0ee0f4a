package com.drawdownwatch.monitor.infrastructure.gateway;

import com.drawdownwatch.common.json.JacksonConfig;
import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.exceptions.UpstreamUnavailableException;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import com.drawdownwatch.monitor.infrastructure.gateway.dto.NseAllIndicesResponse;
import com.drawdownwatch.monitor.infrastructure.gateway.dto.NseGraphResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Levels of INDIA indices straight from the exchange. Only symbols with a known NSE index name are
 * supported; everything else is left to the providers behind it.
 */
@Slf4j
@RequiredArgsConstructor
public class NseIndexPriceProvider implements PriceProvider {

    static final String NAME = "NSE";

    private static final String HISTORY_FLAG = "1Y";

    private static final Map<String, String> INDEX_NAMES = Map.ofEntries(
            Map.entry("NIFTY50", "NIFTY 50"),
            Map.entry("NIFTYBANK", "NIFTY BANK"),
            Map.entry("NIFTYIT", "NIFTY IT"),
            Map.entry("NIFTYMIDCAP", "NIFTY MIDCAP 100"),
            Map.entry("NIFTYSMLCAP", "NIFTY SMALLCAP 100"),
            Map.entry("NIFTYSMALLCAP50", "NIFTY SMALLCAP 50"),
            Map.entry("NIFTYMICROCAP250", "NIFTY MICROCAP 250"),
            Map.entry("NIFTYAUTO", "NIFTY AUTO"),
            Map.entry("NIFTYFMCG", "NIFTY FMCG"),
            Map.entry("NIFTYMETAL", "NIFTY METAL"),
            Map.entry("NIFTYPHARMA", "NIFTY PHARMA"),
            Map.entry("NIFTYPSU", "NIFTY PSU BANK"),
            Map.entry("NIFTYREALTY", "NIFTY REALTY"));

    private final RestClient restClient;
    private final Clock clock;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    @Override
    public String providerName() {
        return NAME;
    }

    @Override
    public boolean supports(String symbol, Market market) {
        return market == Market.INDIA && INDEX_NAMES.containsKey(symbol);
    }

    @Override
    public Optional<PriceQuote> fetchCurrent(String symbol, Market market) {
        var indexName = INDEX_NAMES.get(symbol);
        var response = read(get(symbol, market, "/api/allIndices"), NseAllIndicesResponse.class, symbol, market);
        if (response.data() == null) {
            return Optional.empty();
        }
        return response.data().stream()
                .filter(level -> indexName.equalsIgnoreCase(level.index()))
                .map(NseAllIndicesResponse.IndexLevel::last)
                .filter(last -> last != null && last.signum() > 0)
                .findFirst()
                .map(last -> PriceQuote.builder()
                        .symbol(symbol)
                        .market(market)
                        .price(last)
                        .observedAt(clock.instant())
                        .sourceTag(NAME)
                        .build());
    }

    @Override
    public List<DailyClose> fetchDailyCloses(String symbol, Market market, LocalDate from, LocalDate to) {
        var body = get(symbol, market,
                "/api/NextApi/apiClient/historicalGraph?functionName=getGraphChart&type={type}&flag={flag}",
                INDEX_NAMES.get(symbol), HISTORY_FLAG);
        var response = read(body, NseGraphResponse.class, symbol, market);
        if (response.data() == null || response.data().graphData() == null) {
            return List.of();
        }
        var points = new ArrayList<List<Object>>();
        for (var point : response.data().graphData()) {
            if (point != null && point.size() >= 2 && point.get(0) instanceof Number && point.get(1) != null) {
                points.add(point);
            }
        }
        points.sort(Comparator.comparingLong(point -> ((Number) point.get(0)).longValue()));

        // last point of each market-local day is that day's close
        var closes = new TreeMap<LocalDate, BigDecimal>();
        for (var point : points) {
            var date = LocalDate.ofInstant(Instant.ofEpochMilli(((Number) point.get(0)).longValue()), market.zone());
            if (date.isBefore(from) || date.isAfter(to)) {
                continue;
            }
            try {
                var level = new BigDecimal(point.get(1).toString());
                if (level.signum() > 0) {
                    closes.put(date, level);
                }
            } catch (NumberFormatException e) {
                log.debug("Skipping malformed graph point {} for {}", point, symbol);
            }
        }
        return closes.entrySet().stream()
                .map(entry -> new DailyClose(entry.getKey(), entry.getValue()))
                .toList();
    }

    private String get(String symbol, Market market, String uri, Object... variables) {
        String body;
        try {
            body = restClient.get().uri(uri, variables).retrieve().body(String.class);
        } catch (RestClientException e) {
            throw UpstreamUnavailableException.of(NAME, symbol, market, e);
        }
        if (body == null || body.isBlank()) {
            throw UpstreamUnavailableException.emptyResponse(NAME, symbol, market);
        }
        return body;
    }

    private <T> T read(String body, Class<T> type, String symbol, Market market) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JacksonException e) {
            throw UpstreamUnavailableException.of(NAME, symbol, market, e);
        }
    }
}
