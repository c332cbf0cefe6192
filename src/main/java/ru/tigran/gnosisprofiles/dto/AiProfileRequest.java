package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for generating (or regenerating) the AI profile of a piece of content.
 */
@Schema(description = "AI profile upsert request")
public record AiProfileRequest(
        @Schema(description = "ID of the content the persona is generated from", example = "12",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("content_id")
        @NotNull(message = "Content ID is required")
        Long contentId,

        @Schema(example = "https://example.com/caesar.jpg")
        @JsonProperty("profile_pic_url")
        @Size(max = 512, message = "profile_pic_url must not exceed 512 characters")
        String profilePicUrl
) {
}
