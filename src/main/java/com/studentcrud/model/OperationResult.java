package com.studentcrud.model;

/**
 * Result of a student operation: the value on success, or the failure kind and a
 * one-line message.
 */
public record OperationResult<T>(
    OperationOutcome outcome,
    T value,
    String message
) {

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(OperationOutcome.SUCCESS, value, null);
    }

    public static <T> OperationResult<T> notFound(T value) {
        return new OperationResult<>(OperationOutcome.NOT_FOUND, value, null);
    }

    public static <T> OperationResult<T> failure(OperationOutcome outcome, String message) {
        if (!outcome.isFailure()) {
            throw new IllegalArgumentException("Not a failure outcome: " + outcome);
        }
        return new OperationResult<>(outcome, null, message);
    }

    public boolean isFailure() {
        return outcome.isFailure();
    }
}
