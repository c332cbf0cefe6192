package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Full AI profile as returned by GET /api/ais/content/{content_id}.
 */
public record AiProfileResponse(
        @JsonProperty("ai_id") Long aiId,
        @JsonProperty("content_id") Long contentId,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("name") String name,
        @JsonProperty("bio") String bio,
        @JsonProperty("location") String location,
        @JsonProperty("profile_pic_url") String profilePicUrl,
        @JsonProperty("systems_instructions") String systemsInstructions,
        @JsonProperty("created_at") LocalDateTime createdAt
) {
}
