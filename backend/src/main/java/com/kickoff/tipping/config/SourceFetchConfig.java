package com.kickoff.tipping.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class SourceFetchConfig {

    @Bean(name = "sourceRestTemplate")
    public RestTemplate sourceRestTemplate(RestTemplateBuilder builder,
                                           @Value("${tipping.http.connect-timeout-ms:10000}") long connectTimeoutMs,
                                           @Value("${tipping.http.read-timeout-ms:45000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .defaultHeader(HttpHeaders.USER_AGENT, "kickoff-tipping/1.0")
                .build();
    }

    // One thread per feed of a full sync
    @Bean(name = "sourceFetchExecutor")
    public ThreadPoolTaskExecutor sourceFetchExecutor() {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(3);
        exec.setMaxPoolSize(6);
        exec.setQueueCapacity(20);
        exec.setThreadNamePrefix("SourceFetch-");
        exec.initialize();
        return exec;
    }
}
