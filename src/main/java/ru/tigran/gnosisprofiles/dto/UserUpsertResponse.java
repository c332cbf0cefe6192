package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of a user profile upsert")
public record UserUpsertResponse(
        @Schema(example = "User profile created successfully")
        @JsonProperty("message")
        String message,

        @Schema(example = "1")
        @JsonProperty("user_id")
        Long userId,

        @Schema(example = "created", allowableValues = {"created", "updated"})
        @JsonProperty("action")
        UpsertAction action
) {
    public static UserUpsertResponse of(Long userId, UpsertAction action) {
        return new UserUpsertResponse("User profile " + action.getValue() + " successfully", userId, action);
    }
}
