package ru.tigran.gnosisprofiles.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import ru.tigran.gnosisprofiles.exception.ErrorCode;
import ru.tigran.gnosisprofiles.exception.ErrorResponse;
import ru.tigran.gnosisprofiles.security.ApiKeyAuthenticationFilter;

import java.nio.charset.StandardCharsets;

/**
 * Spring Security configuration for shared API key authentication.
 * Uses stateless session management (no cookies/sessions).
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] DOCUMENTATION_PATHS = {
            "/docs", "/docs/**", "/swagger-ui.html", "/swagger-ui/**", "/v3/api-docs", "/v3/api-docs/**"
    };

    /**
     * Security filter chain configuration.
     * - Disables CSRF, form login and HTTP basic (API key only)
     * - Sets session creation policy to stateless
     * - Adds the X-API-KEY filter
     * - Leaves only the API documentation public
     *
     * @param http HTTP security configuration
     * @return Configured SecurityFilterChain
     */
    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            ObjectMapper objectMapper,
            @Value("${app.security.api-key}") String apiKey
    ) throws Exception {
        ApiKeyAuthenticationFilter apiKeyAuthenticationFilter = new ApiKeyAuthenticationFilter(apiKey, objectMapper);

        http
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(DOCUMENTATION_PATHS).permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint((request, response, authException) -> {
                            response.setStatus(401);
                            response.setContentType("application/json");
                            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
                            objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(ErrorCode.MISSING_API_KEY));
                        })
                )
                .addFilterBefore(apiKeyAuthenticationFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
