package com.lottointel.activo.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Connect and read timeouts both come from {@code lotto-scraper.source.timeout}. */
    @Bean
    public RestTemplate drawPageRestTemplate(RestTemplateBuilder builder, LottoScraperProperties properties) {
        Duration timeout = properties.getSource().getTimeout() != null
                ? properties.getSource().getTimeout()
                : DEFAULT_TIMEOUT;
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
