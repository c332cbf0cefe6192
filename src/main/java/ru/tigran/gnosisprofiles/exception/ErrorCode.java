package ru.tigran.gnosisprofiles.exception;

/**
 * Enum for application error codes.
 * Each code carries the generic message returned to API callers.
 */
public enum ErrorCode {
    // Resource not found errors
    USER_NOT_FOUND("USER_NOT_FOUND", "User not found"),
    AI_PROFILE_NOT_FOUND("AI_PROFILE_NOT_FOUND", "AI profile not found"),
    CONTENT_NOT_FOUND("CONTENT_NOT_FOUND", "Content not found"),

    // Authentication errors
    MISSING_API_KEY("MISSING_API_KEY", "No X-API-KEY"),
    INVALID_API_KEY("INVALID_API_KEY", "Invalid X-API-KEY"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    USER_ID_REQUIRED("USER_ID_REQUIRED", "User ID is required"),
    CONTENT_ID_REQUIRED("CONTENT_ID_REQUIRED", "Content ID is required"),
    MALFORMED_REQUEST("MALFORMED_REQUEST", "Malformed request body"),
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", "Method not allowed"),
    UNSUPPORTED_MEDIA_TYPE("UNSUPPORTED_MEDIA_TYPE", "Unsupported media type"),

    // Upstream errors
    CONTENT_SERVICE_ERROR("CONTENT_SERVICE_ERROR", "Internal server error"),
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "Failed to generate AI profile"),
    INVALID_AI_RESPONSE("INVALID_AI_RESPONSE", "Failed to generate AI profile"),
    PROFILE_GENERATION_FAILED("PROFILE_GENERATION_FAILED", "Failed to generate AI profile"),

    // Internal server errors
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "Internal server error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
