package ru.tigran.gnosisprofiles.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.gnosisprofiles.dto.AiProfileRequest;
import ru.tigran.gnosisprofiles.dto.AiProfileResponse;
import ru.tigran.gnosisprofiles.dto.AiUpsertResponse;
import ru.tigran.gnosisprofiles.dto.ContentMetadata;
import ru.tigran.gnosisprofiles.dto.GeneratedAiProfile;
import ru.tigran.gnosisprofiles.dto.UpsertAction;
import ru.tigran.gnosisprofiles.exception.AIGatewayException;
import ru.tigran.gnosisprofiles.exception.ErrorCode;
import ru.tigran.gnosisprofiles.exception.ResourceNotFoundException;
import ru.tigran.gnosisprofiles.exception.ValidationException;
import ru.tigran.gnosisprofiles.model.AiProfile;
import ru.tigran.gnosisprofiles.repository.AiProfileRepository;

import java.util.Optional;

import static ru.tigran.gnosisprofiles.util.FieldMergeUtils.mergeIfPresent;

/**
 * Service for AI persona profiles.
 *
 * Upsert workflow:
 * 1. Fetch content metadata from the content service
 * 2. Generate the five profile fields with the LLM
 * 3. Insert or update the row keyed by content_id in one short transaction
 *
 * No transaction is open during steps 1 and 2, and a failure in either writes nothing.
 */
@Slf4j
@Service
public class AiProfileService {

    private final AiProfileRepository aiProfileRepository;
    private final ContentServiceClient contentServiceClient;
    private final AiProfileGenerator aiProfileGenerator;
    private final ProfileUpsertExecutor upsertExecutor;
    private final MeterRegistry meterRegistry;

    public AiProfileService(
            AiProfileRepository aiProfileRepository,
            ContentServiceClient contentServiceClient,
            AiProfileGenerator aiProfileGenerator,
            ProfileUpsertExecutor upsertExecutor,
            MeterRegistry meterRegistry
    ) {
        this.aiProfileRepository = aiProfileRepository;
        this.contentServiceClient = contentServiceClient;
        this.aiProfileGenerator = aiProfileGenerator;
        this.upsertExecutor = upsertExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Generates the AI profile for a piece of content and stores it.
     *
     * @param request       content_id (required) and optional profile_pic_url
     * @param correlationId Optional correlation ID forwarded to the content service and the LLM
     * @return result with action = created or updated
     * @throws ValidationException if content_id is missing
     * @throws ResourceNotFoundException if the content service does not know the content
     * @throws AIGatewayException if no usable profile could be generated
     */
    public AiUpsertResponse createOrUpdateAi(AiProfileRequest request, String correlationId) {
        if (request == null || request.contentId() == null) {
            throw new ValidationException(ErrorCode.CONTENT_ID_REQUIRED);
        }

        Long contentId = request.contentId();
        log.info("Upserting AI profile for content {}, correlationId={}", contentId, correlationId);

        ContentMetadata content = contentServiceClient.fetchContent(contentId, correlationId);

        GeneratedAiProfile generated = aiProfileGenerator.generate(content, correlationId)
                .orElseThrow(() -> new AIGatewayException(
                        "AI profile generation produced no result for content " + contentId,
                        ErrorCode.PROFILE_GENERATION_FAILED
                ));

        AiUpsertResponse response = upsertExecutor.upsert(
                "AI profile of content " + contentId,
                () -> writeAiProfile(contentId, generated, request.profilePicUrl())
        );

        meterRegistry.counter("profiles.ai.upsert", "action", response.action().getValue()).increment();
        log.info("AI profile {} for content {} {}", response.aiId(), contentId, response.action().getValue());
        return response;
    }

    /**
     * Returns the AI profile generated for a piece of content.
     *
     * @param contentId Content ID
     * @return AiProfileResponse
     */
    @Transactional(readOnly = true)
    public AiProfileResponse getAiByContent(Long contentId) {
        log.debug("Getting AI profile for content {}", contentId);

        AiProfile aiProfile = aiProfileRepository.findByContentId(contentId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.AI_PROFILE_NOT_FOUND));

        return mapToResponse(aiProfile);
    }

    private AiUpsertResponse writeAiProfile(Long contentId, GeneratedAiProfile generated, String profilePicUrl) {
        Optional<AiProfile> existing = aiProfileRepository.findByContentId(contentId);
        boolean isUpdate = existing.isPresent();
        AiProfile aiProfile = existing.orElseGet(() -> new AiProfile(contentId));

        mergeIfPresent(generated.displayName(), aiProfile::setDisplayName);
        mergeIfPresent(generated.name(), aiProfile::setName);
        mergeIfPresent(generated.bio(), aiProfile::setBio);
        mergeIfPresent(generated.location(), aiProfile::setLocation);
        mergeIfPresent(generated.systemsInstructions(), aiProfile::setSystemsInstructions);
        mergeIfPresent(profilePicUrl, aiProfile::setProfilePicUrl);

        AiProfile saved = aiProfileRepository.saveAndFlush(aiProfile);
        return AiUpsertResponse.of(saved.getAiId(), saved.getContentId(), UpsertAction.of(isUpdate));
    }

    private AiProfileResponse mapToResponse(AiProfile aiProfile) {
        return new AiProfileResponse(
                aiProfile.getAiId(),
                aiProfile.getContentId(),
                aiProfile.getDisplayName(),
                aiProfile.getName(),
                aiProfile.getBio(),
                aiProfile.getLocation(),
                aiProfile.getProfilePicUrl(),
                aiProfile.getSystemsInstructions(),
                aiProfile.getCreatedAt()
        );
    }
}
