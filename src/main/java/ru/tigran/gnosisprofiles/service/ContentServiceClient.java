package ru.tigran.gnosisprofiles.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import ru.tigran.gnosisprofiles.dto.ContentMetadata;
import ru.tigran.gnosisprofiles.exception.ErrorCode;
import ru.tigran.gnosisprofiles.exception.ResourceNotFoundException;
import ru.tigran.gnosisprofiles.exception.UpstreamServiceException;
import ru.tigran.gnosisprofiles.security.ApiKeyAuthenticationFilter;

/**
 * Client for the content service ({@code GET /api/content/{content_id}}).
 * Authenticates with the shared API key and forwards the caller's correlation ID.
 */
@Slf4j
@Service
public class ContentServiceClient {

    private static final String CONTENT_PATH = "/api/content/{contentId}";

    private final RestClient restClient;
    private final String apiKey;

    public ContentServiceClient(
            @Qualifier("contentRestClient") RestClient restClient,
            @Value("${app.content.api-key:${app.security.api-key}}") String apiKey
    ) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    /**
     * Fetches content metadata.
     *
     * @param contentId     Content ID
     * @param correlationId Optional correlation ID, forwarded as X-Correlation-ID
     * @return content metadata
     * @throws ResourceNotFoundException if the content service answers with a non-2xx status
     * @throws UpstreamServiceException if the content service cannot be reached or its body cannot be read
     */
    public ContentMetadata fetchContent(Long contentId, String correlationId) {
        log.info("Fetching content {} from content service", contentId);

        ContentMetadata content;
        try {
            content = restClient.get()
                    .uri(CONTENT_PATH, contentId)
                    .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey)
                    .headers(headers -> {
                        if (correlationId != null && !correlationId.isBlank()) {
                            headers.set(AIGatewayService.CORRELATION_ID_HEADER, correlationId);
                        }
                    })
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (request, response) -> {
                        log.warn("Content service returned {} for content {}", response.getStatusCode().value(), contentId);
                        throw new ResourceNotFoundException(ErrorCode.CONTENT_NOT_FOUND);
                    })
                    .body(ContentMetadata.class);
        } catch (ResourceNotFoundException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("Content service call failed for content {}", contentId, e);
            throw new UpstreamServiceException(
                    "Content service call failed for content " + contentId + ": " + e.getMessage(),
                    ErrorCode.CONTENT_SERVICE_ERROR,
                    e
            );
        }

        if (content == null) {
            throw new UpstreamServiceException(
                    "Content service returned an empty body for content " + contentId,
                    ErrorCode.CONTENT_SERVICE_ERROR,
                    null
            );
        }

        log.debug("Fetched content {}: title='{}'", contentId, content.title());
        return content;
    }
}
