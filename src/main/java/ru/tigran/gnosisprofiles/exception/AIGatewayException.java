package ru.tigran.gnosisprofiles.exception;

/**
 * Thrown when the LLM provider call fails or its answer cannot be used
 * (HTTP error, missing message content, malformed or mistyped profile JSON).
 * HTTP status: 500 Internal Server Error
 */
public class AIGatewayException extends ApplicationException {
    public AIGatewayException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public AIGatewayException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
