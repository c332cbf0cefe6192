package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of an AI profile upsert")
public record AiUpsertResponse(
        @Schema(example = "AI profile created successfully")
        @JsonProperty("message")
        String message,

        @Schema(example = "7")
        @JsonProperty("ai_id")
        Long aiId,

        @Schema(example = "12")
        @JsonProperty("content_id")
        Long contentId,

        @Schema(example = "created", allowableValues = {"created", "updated"})
        @JsonProperty("action")
        UpsertAction action
) {
    public static AiUpsertResponse of(Long aiId, Long contentId, UpsertAction action) {
        return new AiUpsertResponse("AI profile " + action.getValue() + " successfully", aiId, contentId, action);
    }
}
