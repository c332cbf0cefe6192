package ru.tigran.gnosisprofiles.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Error body returned for every failed request.
 */
@Schema(description = "Error response")
public record ErrorResponse(
        @Schema(description = "Human readable, generic error message", example = "User not found")
        @JsonProperty("error")
        String error,

        @Schema(description = "Machine readable error code", example = "USER_NOT_FOUND")
        @JsonProperty("error_code")
        String errorCode
) {
    public static ErrorResponse of(ErrorCode code) {
        return new ErrorResponse(code.getDefaultMessage(), code.getCode());
    }
}
