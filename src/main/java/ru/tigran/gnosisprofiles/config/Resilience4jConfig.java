package ru.tigran.gnosisprofiles.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClientException;
import ru.tigran.gnosisprofiles.exception.AIGatewayException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для защиты от отказов AI провайдера
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    /**
     * CircuitBreaker для вызовов к AI API.
     * Открывается при 50% ошибок среди последних 10 вызовов (минимум 5),
     * остается открытым app.ai.circuit-breaker.open-duration (по умолчанию 30 секунд),
     * затем переходит в HALF_OPEN.
     * Медленным считается вызов дольше половины таймаута AI клиента.
     * Ошибкой считаются только AIGatewayException и сбои RestClient: так их бросает AIGatewayService.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${app.ai.timeout:120s}") Duration aiTimeout,
            @Value("${app.ai.circuit-breaker.open-duration:30s}") Duration openDuration
    ) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .slowCallRateThreshold(50.0f)
                .slowCallDurationThreshold(aiTimeout.dividedBy(2))
                .permittedNumberOfCallsInHalfOpenState(3)
                .minimumNumberOfCalls(5)
                .slidingWindowSize(10)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .waitDurationInOpenState(openDuration)
                .recordExceptions(AIGatewayException.class, RestClientException.class)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("CircuitBreaker created: {}", event.getAddedEntry().getName()));

        return registry;
    }

    /**
     * CircuitBreaker для AI провайдера
     */
    @Bean
    public CircuitBreaker aiProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker("aiProvider");

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("CircuitBreaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
                .onError(event -> log.error("CircuitBreaker recorded error: {}", event.getThrowable().getMessage()));

        return circuitBreaker;
    }
}
