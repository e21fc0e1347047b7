package ru.tigran.churnpredictor.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация health checks для внешних зависимостей
 */
@Configuration
public class HealthCheckConfig {

    /**
     * Health check для inference сервиса по состоянию circuit breaker.
     * Сбой inference не ломает предсказания (обогащение деградирует), поэтому OPEN
     * отображается как OUT_OF_SERVICE, а не DOWN.
     */
    @Bean
    public HealthIndicator inferenceHealthIndicator(CircuitBreaker inferenceCircuitBreaker) {
        return () -> {
            CircuitBreaker.State state = inferenceCircuitBreaker.getState();
            CircuitBreaker.Metrics metrics = inferenceCircuitBreaker.getMetrics();
            Health.Builder builder = state == CircuitBreaker.State.OPEN
                    ? Health.outOfService()
                    : Health.up();
            return builder
                    .withDetail("circuitBreakerState", state.name())
                    .withDetail("failureRate", metrics.getFailureRate())
                    .withDetail("notPermittedCalls", metrics.getNumberOfNotPermittedCalls())
                    .build();
        };
    }
}
