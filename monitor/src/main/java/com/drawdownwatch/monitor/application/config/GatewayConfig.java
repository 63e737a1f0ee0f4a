package com.drawdownwatch.monitor.application.config;

import com.drawdownwatch.monitor.domain.price.PriceSourceGateway;
import com.drawdownwatch.monitor.infrastructure.gateway.MutualFundNavProvider;
import com.drawdownwatch.monitor.infrastructure.gateway.NseIndexPriceProvider;
import com.drawdownwatch.monitor.infrastructure.gateway.PriceProvider;
import com.drawdownwatch.monitor.infrastructure.gateway.ProviderChainPriceGateway;
import com.drawdownwatch.monitor.infrastructure.gateway.YahooChartPriceProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Upstream providers, in the order the gateway tries them. Adding a source means adding it here.
 */
@Configuration
public class GatewayConfig {

    @Bean
    @Order(1)
    public PriceProvider mutualFundNavProvider(DrawdownProperties properties) {
        var gateway = properties.gateway();
        return new MutualFundNavProvider(restClient(gateway.mutualFundBaseUrl(), gateway));
    }

    @Bean
    @Order(2)
    public PriceProvider nseIndexPriceProvider(DrawdownProperties properties, Clock clock) {
        var gateway = properties.gateway();
        var restClient = restClient(gateway.nseBaseUrl(), gateway).mutate()
                .defaultHeader(HttpHeaders.REFERER, gateway.nseBaseUrl() + "/")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .build();
        return new NseIndexPriceProvider(restClient, clock);
    }

    @Bean
    @Order(3)
    public PriceProvider yahooChartPriceProvider(DrawdownProperties properties, Clock clock) {
        var gateway = properties.gateway();
        return new YahooChartPriceProvider(restClient(gateway.yahooBaseUrl(), gateway), clock);
    }

    @Bean
    public PriceSourceGateway priceSourceGateway(
            List<PriceProvider> priceProviders,
            DrawdownProperties properties,
            @Qualifier("gatewayExecutor") Executor gatewayExecutor,
            Clock clock) {
        var gateway = properties.gateway();
        return new ProviderChainPriceGateway(
                priceProviders, gatewayExecutor, gateway.fetchTimeout(), gateway.batchDeadline(), clock);
    }

    private static RestClient restClient(String baseUrl, DrawdownProperties.Gateway gateway) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(gateway.connectTimeout());
        requestFactory.setReadTimeout(gateway.fetchTimeout());
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, gateway.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
