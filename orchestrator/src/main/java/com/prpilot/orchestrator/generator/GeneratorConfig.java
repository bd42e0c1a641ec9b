package com.prpilot.orchestrator.generator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prpilot.orchestrator.gateway.RepositoryGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Selects the code generator. {@code prflow.generator.provider=claude} wires
 * the Anthropic-backed one; otherwise every generation fails fast.
 */
@Configuration
public class GeneratorConfig {

    @Bean
    @ConditionalOnProperty(name = "prflow.generator.provider", havingValue = "claude")
    public ChangeGenerator claudeChangeGenerator(
            @Value("${anthropic.api-url:https://api.anthropic.com/v1/messages}") String apiUrl,
            @Value("${anthropic.api-key:}") String apiKey,
            @Value("${anthropic.model:claude-sonnet-4-5}") String model,
            @Value("${anthropic.max-tokens:8192}") int maxTokens,
            @Value("${anthropic.timeout:120s}") Duration timeout,
            ObjectMapper objectMapper,
            RepositoryGateway gateway) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        ClaudeClient client = new ClaudeClient(http, objectMapper, apiUrl, apiKey, maxTokens, timeout);
        return new ClaudeChangeGenerator(client, gateway, model);
    }

    @Bean
    @ConditionalOnMissingBean(ChangeGenerator.class)
    public ChangeGenerator unconfiguredChangeGenerator() {
        return new UnconfiguredChangeGenerator();
    }
}
