package com.jobkeeper.core;

/**
 * Uniform success/message/data envelope returned by every orchestrator operation.
 */
public final class OperationResult<T> {

    /** Why an operation failed. */
    public enum ErrorCode {
        VALIDATION,
        DUPLICATE,
        NOT_FOUND,
        STORE,
        ENGINE
    }

    private final boolean success;
    private final String message;
    private final T data;
    private final ErrorCode errorCode;

    private OperationResult(boolean success, String message, T data, ErrorCode errorCode) {
        this.success = success;
        this.message = message;
        this.data = data;
        this.errorCode = errorCode;
    }

    public static <T> OperationResult<T> ok(T data) {
        return new OperationResult<>(true, "OK", data, null);
    }

    public static <T> OperationResult<T> ok(String message, T data) {
        return new OperationResult<>(true, message, data, null);
    }

    public static <T> OperationResult<T> fail(ErrorCode code, String message) {
        return new OperationResult<>(false, message, null, code);
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public T getData() { return data; }
    public ErrorCode getErrorCode() { return errorCode; }

    @Override
    public String toString() {
        return success ? "OK(" + message + ")" : errorCode + "(" + message + ")";
    }
}
