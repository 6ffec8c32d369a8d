package com.baykanat.energy.meter.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/** Sayaç kaynağı için RestClient; bağlantı ve okuma timeout'u app.source.timeout. */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient meterSourceRestClient(AppProperties appProperties) {
        var timeout = appProperties.getSource().getTimeout();
        log.info("Initializing meter source RestClient with timeout {}", timeout);

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
