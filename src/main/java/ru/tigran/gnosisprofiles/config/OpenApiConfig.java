package ru.tigran.gnosisprofiles.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.gnosisprofiles.security.ApiKeyAuthenticationFilter;

/**
 * OpenAPI 3.0 configuration for Swagger UI documentation (served at /docs).
 * Configures the X-API-KEY security scheme and API metadata.
 */
@Configuration
public class OpenApiConfig {

    public static final String API_KEY_SCHEME = "api-key";

    /**
     * Configures OpenAPI documentation with the API key security scheme.
     * The key entered in Swagger UI is sent with every "Try it out" request.
     *
     * @return OpenAPI configuration bean
     */
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .components(new Components()
                        .addSecuritySchemes(API_KEY_SCHEME,
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name(ApiKeyAuthenticationFilter.API_KEY_HEADER)
                                        .description("Shared API key")
                        )
                )
                .addSecurityItem(new SecurityRequirement().addList(API_KEY_SCHEME))
                .info(new Info()
                        .title("Gnosis Profiles API")
                        .description("Профили пользователей и AI персон. " +
                                "AI профиль генерируется LLM по метаданным контента из content service.")
                        .version("1.0.0")
                );
    }
}
