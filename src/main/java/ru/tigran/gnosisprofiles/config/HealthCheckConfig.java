package ru.tigran.gnosisprofiles.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация health checks для внешних зависимостей
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Health check для AI провайдера.
     * Не делает запросов к API, смотрит на состояние circuit breaker:
     * открытый breaker значит, что провайдер недавно часто падал.
     */
    @Bean
    public HealthIndicator aiProviderHealthIndicator(CircuitBreaker aiProviderCircuitBreaker) {
        return () -> {
            CircuitBreaker.State state = aiProviderCircuitBreaker.getState();
            CircuitBreaker.Metrics metrics = aiProviderCircuitBreaker.getMetrics();

            Health.Builder builder = switch (state) {
                case OPEN, FORCED_OPEN -> {
                    log.warn("AI Provider health check: circuit breaker is {}", state);
                    yield Health.unknown();
                }
                default -> Health.up();
            };

            return builder
                    .withDetail("circuitBreaker", state.name())
                    .withDetail("failureRate", metrics.getFailureRate())
                    .withDetail("failedCalls", metrics.getNumberOfFailedCalls())
                    .build();
        };
    }
}
