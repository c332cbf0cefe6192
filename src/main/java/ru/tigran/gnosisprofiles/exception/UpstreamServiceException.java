package ru.tigran.gnosisprofiles.exception;

/**
 * Thrown when the content service cannot be reached or answers with an unreadable body.
 * A non-success HTTP status is not this exception: it is reported as content not found.
 * HTTP status: 500 Internal Server Error
 */
public class UpstreamServiceException extends ApplicationException {
    public UpstreamServiceException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
