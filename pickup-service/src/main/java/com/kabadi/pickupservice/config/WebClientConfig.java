package com.kabadi.pickupservice.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder();
    }

    // Vendor offer URLs are absolute, so no base URL here
    @Bean
    public WebClient vendorWebClient(WebClient.Builder builder, DispatchProperties properties) {
        int connectTimeoutMillis = (int) Math.min(properties.getSendTimeout().toMillis(), Integer.MAX_VALUE);
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(properties.getSendTimeout());
        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
