package com.prpilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prpilot.orchestrator.gateway.GitHubGateway;
import com.prpilot.orchestrator.gateway.RepositoryGateway;
import com.prpilot.orchestrator.gateway.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Wires the remote boundary: one shared HttpClient and credential, one
 * retry policy, one gateway.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${prflow.retry.max-attempts:4}") int maxAttempts,
                                   @Value("${prflow.retry.base-delay:1s}") Duration baseDelay,
                                   @Value("${prflow.retry.max-delay:30s}") Duration maxDelay,
                                   @Value("${prflow.retry.max-rate-limit-wait:60s}") Duration maxRateLimitWait,
                                   MeterRegistry meterRegistry) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, maxRateLimitWait,
                RetryPolicy.THREAD_SLEEPER, meterRegistry);
    }

    @Bean
    public RepositoryGateway repositoryGateway(
            @Value("${prflow.github.api-url:https://api.github.com}") String apiUrl,
            @Value("${prflow.github.web-host:github.com}") String webHost,
            @Value("${prflow.github.token:}") String token,
            @Value("${prflow.github.connect-timeout:10s}") Duration connectTimeout,
            @Value("${prflow.github.request-timeout:30s}") Duration requestTimeout,
            @Value("${prflow.github.commit-mode:tree}") String commitMode,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            MeterRegistry meterRegistry,
            Clock clock) {
        if (token.isBlank()) {
            log.warn("prflow.github.token is not set; only public repositories can be read and nothing can be written");
        }
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        GitHubGateway.CommitMode mode =
                GitHubGateway.CommitMode.valueOf(commitMode.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        log.info("GitHub gateway: api={} webHost={} commitMode={}", apiUrl, webHost, mode);
        return new GitHubGateway(http, objectMapper, retryPolicy, meterRegistry, clock,
                apiUrl, webHost, token, requestTimeout, mode);
    }
}
