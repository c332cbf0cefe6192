package ru.tigran.gnosisprofiles.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required secret or upstream URL is not configured.
 */
@Slf4j
@Component
public class ApiKeyValidator implements ApplicationRunner {

    @Value("${app.security.api-key:}")
    private String apiKey;

    @Value("${app.ai.api-key:}")
    private String aiApiKey;

    @Value("${app.content.base-url:}")
    private String contentBaseUrl;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Validating API key configuration");

        validateSetting("API_KEY", apiKey);
        validateSetting("OPENAI_API_KEY", aiApiKey);
        validateSetting("QUERY_API_URL", contentBaseUrl);

        log.info("API key validation completed successfully");
    }

    void validateSetting(String envVarName, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(
                String.format(
                    "%s environment variable is not set! Please configure it before starting the application.",
                    envVarName
                )
            );
        }

        if (value.contains("YOUR_") || value.contains("PLACEHOLDER")) {
            throw new IllegalStateException(
                String.format(
                    "%s contains placeholder value! Please set a real value in environment variables.",
                    envVarName
                )
            );
        }

        log.debug("Configuration check passed for {}", envVarName);
    }
}
