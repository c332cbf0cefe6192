package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Full user profile as returned by GET /api/users/{user_id}.
 */
public record UserProfileResponse(
        @JsonProperty("user_id") Long userId,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("name") String name,
        @JsonProperty("bio") String bio,
        @JsonProperty("location") String location,
        @JsonProperty("profile_pic_url") String profilePicUrl,
        @JsonProperty("created_at") LocalDateTime createdAt
) {
}
