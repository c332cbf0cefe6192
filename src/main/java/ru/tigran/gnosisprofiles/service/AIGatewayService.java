package ru.tigran.gnosisprofiles.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import ru.tigran.gnosisprofiles.exception.AIGatewayException;
import ru.tigran.gnosisprofiles.exception.ErrorCode;

/**
 * Chat-completion client for the LLM provider (OpenAI-compatible API).
 * One call per request, no retries; calls go through the "aiProvider" circuit breaker.
 */
@Slf4j
@Service
public class AIGatewayService {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";
    // Maximum response size (1 MB) to prevent memory exhaustion
    private static final long MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String apiKey;
    private final String model;

    public AIGatewayService(
            @Qualifier("aiRestClient") RestClient restClient,
            ObjectMapper objectMapper,
            @Qualifier("aiProviderCircuitBreaker") CircuitBreaker circuitBreaker,
            @Value("${app.ai.api-key}") String apiKey,
            @Value("${app.ai.model:gpt-4o}") String model
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.apiKey = apiKey;
        this.model = model;
        log.info("AIGatewayService initialized with model={}, apiKey={}", model, maskApiKey(apiKey));
    }

    /**
     * Sends one system + user message pair to the provider and returns the assistant's answer
     * with any markdown code fences removed.
     *
     * @param systemPrompt  System prompt for AI
     * @param userMessage   User message for AI
     * @param correlationId Optional request correlation ID, forwarded as X-Correlation-ID
     * @return AI response content
     * @throws AIGatewayException on HTTP error, open circuit or unusable response
     */
    public String generateCompletion(String systemPrompt, String userMessage, String correlationId) {
        log.info("Calling AI provider, model={}, correlationId={}", model, correlationId);
        String requestBody = buildRequestBody(systemPrompt, userMessage);

        String response;
        try {
            response = circuitBreaker.executeSupplier(() -> restClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (correlationId != null && !correlationId.isBlank()) {
                            headers.set(CORRELATION_ID_HEADER, correlationId);
                        }
                    })
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                        int statusCode = errorResponse.getStatusCode().value();
                        log.error("AI provider API error: {} {}", statusCode, errorResponse.getStatusText());
                        throw new AIGatewayException(
                                "AI provider API error: " + statusCode,
                                ErrorCode.AI_SERVICE_ERROR
                        );
                    })
                    .body(String.class));
        } catch (CallNotPermittedException e) {
            log.warn("AI provider circuit breaker is open, call rejected");
            throw new AIGatewayException("AI provider circuit breaker is open", ErrorCode.AI_SERVICE_ERROR, e);
        } catch (AIGatewayException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error calling AI provider", e);
            throw new AIGatewayException(
                    "Failed to call AI provider: " + e.getMessage(),
                    ErrorCode.AI_SERVICE_ERROR,
                    e
            );
        }

        String content = extractMessageContent(response);
        log.debug("AI response (first 800 chars): {}",
                content.length() > 800 ? content.substring(0, 800) + "..." : content);
        return content;
    }

    /**
     * Builds the chat completion request body: model plus system and user messages.
     */
    private String buildRequestBody(String systemPrompt, String userMessage) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);

        ArrayNode messages = body.putArray("messages");
        messages.addObject()
                .put("role", "system")
                .put("content", systemPrompt);
        messages.addObject()
                .put("role", "user")
                .put("content", userMessage);

        try {
            return objectMapper.writeValueAsString(body);
        } catch (Exception e) {
            throw new AIGatewayException("Failed to build request body", ErrorCode.AI_SERVICE_ERROR, e);
        }
    }

    /**
     * Masks sensitive API credentials for safe logging.
     * Preserves first and last 3 characters of the key.
     *
     * @param apiKey The API key to mask
     * @return Masked API key (e.g., "sk-***xyz")
     */
    private String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.length() <= 6) {
            return "***MASKED***";
        }
        String prefix = apiKey.substring(0, 3);
        String suffix = apiKey.substring(apiKey.length() - 3);
        return prefix + "***" + suffix;
    }

    /**
     * Validates that API response size doesn't exceed maximum allowed size.
     *
     * @param responseBody API response as string
     * @throws AIGatewayException if response exceeds MAX_RESPONSE_SIZE_BYTES
     */
    private void validateResponseSize(String responseBody) {
        if (responseBody != null && responseBody.length() > MAX_RESPONSE_SIZE_BYTES) {
            String errorMsg = String.format(
                    "API response exceeds maximum allowed size. Response size: %d bytes, max allowed: %d bytes",
                    responseBody.length(),
                    MAX_RESPONSE_SIZE_BYTES
            );
            log.error(errorMsg);
            throw new AIGatewayException(errorMsg, ErrorCode.INVALID_AI_RESPONSE);
        }
    }

    /**
     * Extracts the message content from the chat completion response.
     */
    private String extractMessageContent(String response) {
        if (response == null || response.isBlank()) {
            throw new AIGatewayException("Empty response from AI provider", ErrorCode.INVALID_AI_RESPONSE);
        }
        validateResponseSize(response);

        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.at("/choices/0/message/content");

            if (content.isMissingNode() || content.isNull()) {
                log.error("Missing content in API response. Response preview: {}",
                        response.length() > 200 ? response.substring(0, 200) : response);
                throw new AIGatewayException("Missing content in API response", ErrorCode.INVALID_AI_RESPONSE);
            }

            // Models sometimes wrap JSON in markdown despite instructions
            return cleanMarkdownCodeBlocks(content.asText());
        } catch (AIGatewayException e) {
            throw e;
        } catch (Exception e) {
            throw new AIGatewayException(
                    "Failed to parse API response: " + e.getMessage(),
                    ErrorCode.INVALID_AI_RESPONSE,
                    e
            );
        }
    }

    /**
     * Removes markdown code block syntax from response if present.
     * Handles ```json ... ``` and ``` ... ```, with or without newlines around the payload.
     *
     * @param content Raw content from AI response
     * @return Cleaned content without markdown code blocks
     */
    static String cleanMarkdownCodeBlocks(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }

        String cleaned = content.trim();

        if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
            if (cleaned.regionMatches(true, 0, "json", 0, 4)) {
                cleaned = cleaned.substring(4);
            }
        }

        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }

        return cleaned.trim();
    }
}
