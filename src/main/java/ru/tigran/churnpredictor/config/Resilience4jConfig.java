package ru.tigran.churnpredictor.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.churnpredictor.exception.EnrichmentException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для защиты от отказов inference сервиса.
 * Circuit breaker только пропускает вызовы при открытом состоянии, повторных попыток нет.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    /**
     * Открывается при 50% ошибок в окне из последних вызовов,
     * остается открытым заданное время, затем переходит в HALF_OPEN
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${app.inference.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.inference.circuit-breaker.sliding-window-size:10}") int slidingWindowSize,
            @Value("${app.inference.circuit-breaker.minimum-number-of-calls:5}") int minimumNumberOfCalls,
            @Value("${app.inference.circuit-breaker.wait-duration-in-open-state:20s}") Duration waitDurationInOpenState
    ) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slowCallRateThreshold(50.0f)
                .slowCallDurationThreshold(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .minimumNumberOfCalls(minimumNumberOfCalls)
                .slidingWindowSize(slidingWindowSize)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .waitDurationInOpenState(waitDurationInOpenState)
                .recordExceptions(EnrichmentException.class)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("CircuitBreaker created: {}", event.getAddedEntry().getName()));

        return registry;
    }

    @Bean
    public CircuitBreaker inferenceCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker("inference");

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Inference CircuitBreaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
                .onCallNotPermitted(event -> log.warn("Inference call rejected: circuit is open"));

        return circuitBreaker;
    }
}
