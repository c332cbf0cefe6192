package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating or updating a user profile.
 *
 * Only user_id is required. Any other field left out (or sent as null)
 * keeps the value already stored for that user.
 */
@Schema(description = "User profile upsert request")
public record UserProfileRequest(
        @Schema(description = "Externally assigned user ID", example = "1", requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("user_id")
        @NotNull(message = "User ID is required")
        Long userId,

        @Schema(example = "ada")
        @JsonProperty("display_name")
        @Size(max = 255, message = "display_name must not exceed 255 characters")
        String displayName,

        @Schema(example = "Ada Lovelace")
        @JsonProperty("name")
        @Size(max = 255, message = "name must not exceed 255 characters")
        String name,

        @Schema(example = "mathematician")
        @JsonProperty("bio")
        String bio,

        @Schema(example = "London")
        @JsonProperty("location")
        @Size(max = 255, message = "location must not exceed 255 characters")
        String location,

        @Schema(example = "https://example.com/ada.jpg")
        @JsonProperty("profile_pic_url")
        @Size(max = 512, message = "profile_pic_url must not exceed 512 characters")
        String profilePicUrl
) {
}
