package ru.tigran.gnosisprofiles.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an {@link ErrorCode} that decides both the error code and the
 * public message of the error response.
 */
public abstract class ApplicationException extends RuntimeException {
    private final ErrorCode errorCode;

    public ApplicationException(ErrorCode errorCode) {
        this(errorCode.getDefaultMessage(), errorCode);
    }

    public ApplicationException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApplicationException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
