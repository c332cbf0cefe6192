package ru.tigran.gnosisprofiles.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.gnosisprofiles.dto.AiProfileRequest;
import ru.tigran.gnosisprofiles.dto.AiProfileResponse;
import ru.tigran.gnosisprofiles.dto.AiUpsertResponse;
import ru.tigran.gnosisprofiles.dto.UpsertAction;
import ru.tigran.gnosisprofiles.exception.ErrorResponse;
import ru.tigran.gnosisprofiles.service.AIGatewayService;
import ru.tigran.gnosisprofiles.service.AiProfileService;

@Slf4j
@RestController
@RequestMapping("/api/ais")
@Tag(name = "AI profiles", description = "Генерация AI персон по контенту")
@SecurityRequirement(name = "api-key")
public class AiProfileController {

    private final AiProfileService aiProfileService;

    public AiProfileController(AiProfileService aiProfileService) {
        this.aiProfileService = aiProfileService;
    }

    /**
     * Generates the AI profile of a piece of content and stores it.
     * Blocks until the content service and the LLM have answered.
     *
     * @param request       content_id (required) and optional profile_pic_url
     * @param correlationId optional correlation ID, forwarded downstream
     * @return 201 on create, 200 on update
     */
    @PostMapping
    @Operation(
            summary = "Create or update an AI profile",
            description = "Fetches the content metadata, generates display name, name, bio, location and " +
                    "system instructions with the LLM and stores them under content_id."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "AI profile created",
                    content = @Content(schema = @Schema(implementation = AiUpsertResponse.class))),
            @ApiResponse(responseCode = "200", description = "AI profile regenerated",
                    content = @Content(schema = @Schema(implementation = AiUpsertResponse.class))),
            @ApiResponse(responseCode = "400", description = "content_id is missing or the body is malformed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-API-KEY",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "Content not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "Generation or storage failure",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<AiUpsertResponse> createOrUpdateAi(
            @Valid @RequestBody AiProfileRequest request,
            @Parameter(description = "Correlation ID forwarded to the content service and the LLM")
            @RequestHeader(value = AIGatewayService.CORRELATION_ID_HEADER, required = false) String correlationId
    ) {
        log.info("POST /api/ais - content_id: {}", request.contentId());

        AiUpsertResponse response = aiProfileService.createOrUpdateAi(request, correlationId);

        HttpStatus status = response.action() == UpsertAction.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Returns the AI profile generated for a piece of content.
     *
     * @param contentId content ID
     * @return AiProfileResponse
     */
    @GetMapping("/content/{contentId}")
    @Operation(summary = "Get the AI profile of a piece of content")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "AI profile",
                    content = @Content(schema = @Schema(implementation = AiProfileResponse.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-API-KEY",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "AI profile not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<AiProfileResponse> getAiByContent(
            @Parameter(description = "Content ID", example = "12") @PathVariable("contentId") Long contentId
    ) {
        log.info("GET /api/ais/content/{}", contentId);
        return ResponseEntity.ok(aiProfileService.getAiByContent(contentId));
    }
}
