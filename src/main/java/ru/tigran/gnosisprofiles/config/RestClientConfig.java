package ru.tigran.gnosisprofiles.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Конфигурация HTTP клиентов: content service и AI провайдер.
 * У каждого свой base URL и свои timeouts.
 */
@Configuration
public class RestClientConfig {

    /**
     * RestClient для content service (GET /api/content/{id}).
     */
    @Bean
    public RestClient contentRestClient(
            RestClient.Builder builder,
            @Value("${app.content.base-url}") String baseUrl,
            @Value("${app.content.timeout:30s}") Duration timeout
    ) {
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeout))
                .build();
    }

    /**
     * RestClient для AI провайдера (POST /chat/completions).
     * Timeout больше, генерация профиля может идти долго.
     */
    @Bean
    public RestClient aiRestClient(
            RestClient.Builder builder,
            @Value("${app.ai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${app.ai.timeout:120s}") Duration timeout
    ) {
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeout))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }
}
