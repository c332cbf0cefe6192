package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata of a piece of content as served by the content service
 * ({@code GET /api/content/{content_id}}). Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentMetadata(
        @JsonProperty("title") String title,
        @JsonProperty("author") String author,
        @JsonProperty("topic") String topic,
        @JsonProperty("genre") String genre,
        @JsonProperty("custom_prompt") String customPrompt
) {
}
