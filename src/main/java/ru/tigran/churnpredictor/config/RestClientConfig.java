package ru.tigran.churnpredictor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Конфигурация HTTP клиента для сервиса text inference (sentiment и zero-shot модели)
 */
@Configuration
public class RestClientConfig {

    /**
     * Синхронный RestClient с отдельными connect/read timeouts.
     * Timeout - единственная граница времени ожидания для каждого вызова, повторов нет.
     */
    @Bean
    public RestClient inferenceRestClient(
            @Value("${app.inference.base-url}") String baseUrl,
            @Value("${app.inference.timeout:30s}") Duration timeout
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(factory)
                .build();
    }
}
