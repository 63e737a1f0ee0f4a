package com.drawdownwatch.monitor.infrastructure.gateway;

import com.drawdownwatch.common.json.JacksonConfig;
import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.exceptions.UpstreamUnavailableException;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import com.drawdownwatch.monitor.infrastructure.gateway.dto.YahooChartResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Quotes and daily closes from the chart endpoint of a Yahoo-style quote API. Covers USA symbols
 * as they are and INDIA equities and indices through exchange tickers. Sits behind the NSE
 * provider for the indices both know.
 */
@RequiredArgsConstructor
public class YahooChartPriceProvider implements PriceProvider {

    static final String NAME = "YAHOO";

    private static final Map<String, String> INDIA_INDEX_TICKERS = Map.ofEntries(
            Map.entry("NIFTY50", "^NSEI"),
            Map.entry("NIFTYBANK", "^NSEBANK"),
            Map.entry("NIFTYIT", "^CNXIT"),
            Map.entry("NIFTYMIDCAP", "^NSEMDCP50"),
            Map.entry("NIFTYSMLCAP", "^NSESMCP50"),
            Map.entry("NIFTYAUTO", "^CNXAUTO"),
            Map.entry("NIFTYFMCG", "^CNXFMCG"),
            Map.entry("NIFTYMETAL", "^CNXMETAL"),
            Map.entry("NIFTYPHARMA", "^CNXPHARMA"),
            Map.entry("NIFTYPSU", "^CNXPSUBANK"),
            Map.entry("NIFTYREALTY", "^CNXREALTY"),
            Map.entry("SENSEX", "^BSESN"));

    private final RestClient restClient;
    private final Clock clock;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    @Override
    public String providerName() {
        return NAME;
    }

    @Override
    public boolean supports(String symbol, Market market) {
        return !(market == Market.INDIA && MutualFundNavProvider.isSchemeCode(symbol));
    }

    @Override
    public Optional<PriceQuote> fetchCurrent(String symbol, Market market) {
        return chart(symbol, market, "/v8/finance/chart/{ticker}?range=5d&interval=1d", ticker(symbol, market))
                .map(YahooChartResponse.Result::meta)
                .filter(meta -> meta.regularMarketPrice() != null && meta.regularMarketPrice().signum() > 0)
                .map(meta -> PriceQuote.builder()
                        .symbol(symbol)
                        .market(market)
                        .price(meta.regularMarketPrice())
                        .observedAt(meta.regularMarketTime() != null
                                ? Instant.ofEpochSecond(meta.regularMarketTime())
                                : clock.instant())
                        .sourceTag(NAME)
                        .build());
    }

    @Override
    public List<DailyClose> fetchDailyCloses(String symbol, Market market, LocalDate from, LocalDate to) {
        var period1 = from.atStartOfDay(market.zone()).toEpochSecond();
        var period2 = to.plusDays(1).atStartOfDay(market.zone()).toEpochSecond();
        var result = chart(symbol, market, "/v8/finance/chart/{ticker}?period1={from}&period2={to}&interval=1d",
                ticker(symbol, market), period1, period2);
        if (result.isEmpty() || result.get().timestamp() == null || result.get().indicators() == null
                || result.get().indicators().quote() == null || result.get().indicators().quote().isEmpty()) {
            return List.of();
        }
        var timestamps = result.get().timestamp();
        var closes = result.get().indicators().quote().get(0).close();
        if (closes == null) {
            return List.of();
        }
        var series = new ArrayList<DailyClose>();
        for (int i = 0; i < Math.min(timestamps.size(), closes.size()); i++) {
            if (timestamps.get(i) == null || closes.get(i) == null) {
                continue;
            }
            var date = LocalDate.ofInstant(Instant.ofEpochSecond(timestamps.get(i)), market.zone());
            series.add(new DailyClose(date, closes.get(i)));
        }
        return series;
    }

    static String ticker(String symbol, Market market) {
        if (market == Market.USA || symbol.startsWith("^") || symbol.contains(".")) {
            return symbol;
        }
        return INDIA_INDEX_TICKERS.getOrDefault(symbol, symbol + ".NS");
    }

    private Optional<YahooChartResponse.Result> chart(String symbol, Market market, String uri, Object... variables) {
        String body;
        try {
            body = restClient.get().uri(uri, variables).retrieve().body(String.class);
        } catch (RestClientException e) {
            throw UpstreamUnavailableException.of(NAME, symbol, market, e);
        }
        if (body == null || body.isBlank()) {
            throw UpstreamUnavailableException.emptyResponse(NAME, symbol, market);
        }
        try {
            var response = objectMapper.readValue(body, YahooChartResponse.class);
            if (response.chart() == null || response.chart().result() == null || response.chart().result().isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(response.chart().result().get(0));
        } catch (JacksonException e) {
            throw UpstreamUnavailableException.of(NAME, symbol, market, e);
        }
    }
}
