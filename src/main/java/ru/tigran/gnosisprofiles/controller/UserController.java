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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.gnosisprofiles.dto.UpsertAction;
import ru.tigran.gnosisprofiles.dto.UserProfileRequest;
import ru.tigran.gnosisprofiles.dto.UserProfileResponse;
import ru.tigran.gnosisprofiles.dto.UserUpsertResponse;
import ru.tigran.gnosisprofiles.exception.ErrorResponse;
import ru.tigran.gnosisprofiles.service.UserProfileService;

@Slf4j
@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "Профили пользователей")
@SecurityRequirement(name = "api-key")
public class UserController {

    private final UserProfileService userProfileService;

    public UserController(UserProfileService userProfileService) {
        this.userProfileService = userProfileService;
    }

    /**
     * Creates a user profile or updates the existing one with the same user_id.
     *
     * @param request user profile fields, user_id is required
     * @return 201 on create, 200 on update
     */
    @PostMapping
    @Operation(
            summary = "Create or update a user profile",
            description = "Inserts the user if user_id is new, otherwise updates the fields present in the body. " +
                    "Fields left out keep their stored values."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "User profile created",
                    content = @Content(schema = @Schema(implementation = UserUpsertResponse.class))),
            @ApiResponse(responseCode = "200", description = "User profile updated",
                    content = @Content(schema = @Schema(implementation = UserUpsertResponse.class))),
            @ApiResponse(responseCode = "400", description = "user_id is missing or the body is malformed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-API-KEY",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "Storage failure",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<UserUpsertResponse> createOrUpdateUser(
            @Valid @RequestBody UserProfileRequest request
    ) {
        log.info("POST /api/users - user_id: {}", request.userId());

        UserUpsertResponse response = userProfileService.createOrUpdateUser(request);

        HttpStatus status = response.action() == UpsertAction.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Returns the stored user profile.
     *
     * @param userId user ID
     * @return UserProfileResponse
     */
    @GetMapping("/{userId}")
    @Operation(summary = "Get a user profile")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "User profile",
                    content = @Content(schema = @Schema(implementation = UserProfileResponse.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-API-KEY",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "User not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<UserProfileResponse> getUser(
            @Parameter(description = "User ID", example = "1") @PathVariable("userId") Long userId
    ) {
        log.info("GET /api/users/{}", userId);
        return ResponseEntity.ok(userProfileService.getUser(userId));
    }
}
