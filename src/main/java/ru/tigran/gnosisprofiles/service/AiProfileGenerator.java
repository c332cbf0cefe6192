package ru.tigran.gnosisprofiles.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.gnosisprofiles.dto.ContentMetadata;
import ru.tigran.gnosisprofiles.dto.GeneratedAiProfile;
import ru.tigran.gnosisprofiles.exception.AIGatewayException;
import ru.tigran.gnosisprofiles.exception.ErrorCode;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Generates AI profile fields from content metadata via the LLM.
 *
 * The answer must be a JSON object with exactly the keys display_name, name, bio,
 * location and systems_instructions, each a string. Anything else counts as a failed
 * generation. Failures never propagate: they are logged and reported as an empty result.
 */
@Slf4j
@Service
public class AiProfileGenerator {

    static final List<String> PROFILE_FIELDS = List.of(
            "display_name", "name", "bio", "location", "systems_instructions"
    );

    private final AIGatewayService aiGatewayService;
    private final ObjectMapper objectMapper;
    private final Timer generationTimer;
    private final Counter generationFailureCounter;

    public AiProfileGenerator(
            AIGatewayService aiGatewayService,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        this.aiGatewayService = aiGatewayService;
        this.objectMapper = objectMapper;
        this.generationTimer = Timer.builder("profiles.ai.generation.time")
                .description("Time to generate an AI profile with the LLM")
                .register(meterRegistry);
        this.generationFailureCounter = Counter.builder("profiles.ai.generation.failures")
                .description("AI profile generations that produced no usable result")
                .register(meterRegistry);
    }

    /**
     * Generates the five AI profile fields for the given content.
     *
     * @param content       Content metadata (any field may be missing)
     * @param correlationId Optional correlation ID forwarded to the provider
     * @return validated profile, or empty if the call or validation failed
     */
    public Optional<GeneratedAiProfile> generate(ContentMetadata content, String correlationId) {
        log.info("Generating AI profile for content: {}", AiProfilePromptBuilder.describe(content));
        return generationTimer.record(() -> generateInternal(content, correlationId));
    }

    private Optional<GeneratedAiProfile> generateInternal(ContentMetadata content, String correlationId) {
        try {
            String response = aiGatewayService.generateCompletion(
                    AiProfilePromptBuilder.buildSystemPrompt(),
                    AiProfilePromptBuilder.buildUserPrompt(content),
                    correlationId
            );
            log.debug("AI profile response: {}", response);

            GeneratedAiProfile profile = parseProfile(response);
            log.info("AI profile generated: display_name='{}'", profile.displayName());
            return Optional.of(profile);
        } catch (Exception e) {
            generationFailureCounter.increment();
            log.error("Error generating AI profile: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses and validates the LLM answer.
     *
     * @param json Fence-stripped response content
     * @return profile with all five fields
     * @throws AIGatewayException if the JSON is malformed or its shape is not exactly the five string fields
     */
    GeneratedAiProfile parseProfile(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new AIGatewayException("AI response is not valid JSON: " + e.getMessage(), ErrorCode.INVALID_AI_RESPONSE, e);
        }

        validateProfileObject(root);

        return new GeneratedAiProfile(
                root.get("display_name").asText(),
                root.get("name").asText(),
                root.get("bio").asText(),
                root.get("location").asText(),
                root.get("systems_instructions").asText()
        );
    }

    private void validateProfileObject(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new AIGatewayException("AI response is not a JSON object", ErrorCode.INVALID_AI_RESPONSE);
        }

        Set<String> actualFields = new HashSet<>();
        Iterator<String> names = root.fieldNames();
        names.forEachRemaining(actualFields::add);

        if (!actualFields.equals(new HashSet<>(PROFILE_FIELDS))) {
            throw new AIGatewayException(
                    "AI profile must contain exactly " + PROFILE_FIELDS + ", got " + actualFields,
                    ErrorCode.INVALID_AI_RESPONSE
            );
        }

        for (String field : PROFILE_FIELDS) {
            if (!root.get(field).isTextual()) {
                throw new AIGatewayException(
                        "AI profile field '" + field + "' must be a string",
                        ErrorCode.INVALID_AI_RESPONSE
                );
            }
        }
    }
}
