package ru.tigran.gnosisprofiles.exception;

/**
 * Thrown for request validation failures, e.g. a missing user_id or content_id.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ValidationException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }
}
