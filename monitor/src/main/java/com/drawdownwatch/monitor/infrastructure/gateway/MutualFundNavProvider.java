package com.drawdownwatch.monitor.infrastructure.gateway;

import com.drawdownwatch.common.json.JacksonConfig;
import com.drawdownwatch.common.market.Market;
import com.drawdownwatch.monitor.domain.exceptions.UpstreamUnavailableException;
import com.drawdownwatch.monitor.domain.price.PriceQuote;
import com.drawdownwatch.monitor.infrastructure.gateway.dto.MutualFundNavResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Daily NAVs of Indian mutual fund schemes, addressed by numeric scheme code.
 */
@Slf4j
@RequiredArgsConstructor
public class MutualFundNavProvider implements PriceProvider {

    static final String NAME = "MFAPI";

    private static final String SUCCESS = "SUCCESS";
    private static final DateTimeFormatter NAV_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    private final RestClient restClient;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    static boolean isSchemeCode(String symbol) {
        return !symbol.isEmpty() && symbol.chars().allMatch(Character::isDigit);
    }

    @Override
    public String providerName() {
        return NAME;
    }

    @Override
    public boolean supports(String symbol, Market market) {
        return market == Market.INDIA && isSchemeCode(symbol);
    }

    @Override
    public Optional<PriceQuote> fetchCurrent(String symbol, Market market) {
        return navSeries(symbol, market, "/mf/{code}/latest").stream()
                .max(Comparator.comparing(DailyClose::date))
                .map(latest -> PriceQuote.builder()
                        .symbol(symbol)
                        .market(market)
                        .price(latest.close())
                        .observedAt(latest.date().atTime(market.sessionClose()).atZone(market.zone()).toInstant())
                        .sourceTag(NAME)
                        .build());
    }

    @Override
    public List<DailyClose> fetchDailyCloses(String symbol, Market market, LocalDate from, LocalDate to) {
        return navSeries(symbol, market, "/mf/{code}").stream()
                .filter(close -> !close.date().isBefore(from) && !close.date().isAfter(to))
                .sorted(Comparator.comparing(DailyClose::date))
                .toList();
    }

    private List<DailyClose> navSeries(String symbol, Market market, String uri) {
        String body;
        try {
            body = restClient.get().uri(uri, symbol).retrieve().body(String.class);
        } catch (RestClientException e) {
            throw UpstreamUnavailableException.of(NAME, symbol, market, e);
        }
        if (body == null || body.isBlank()) {
            throw UpstreamUnavailableException.emptyResponse(NAME, symbol, market);
        }
        MutualFundNavResponse response;
        try {
            response = objectMapper.readValue(body, MutualFundNavResponse.class);
        } catch (JacksonException e) {
            throw UpstreamUnavailableException.of(NAME, symbol, market, e);
        }
        if (!SUCCESS.equalsIgnoreCase(response.status()) || response.data() == null) {
            return List.of();
        }
        var series = new ArrayList<DailyClose>(response.data().size());
        for (var point : response.data()) {
            if (point.nav() == null || point.date() == null) {
                continue;
            }
            try {
                var nav = new BigDecimal(point.nav());
                if (nav.signum() > 0) {
                    series.add(new DailyClose(LocalDate.parse(point.date(), NAV_DATE), nav));
                }
            } catch (NumberFormatException | DateTimeParseException e) {
                log.debug("Skipping malformed NAV point {} for scheme {}", point, symbol);
            }
        }
        return series;
    }
}
