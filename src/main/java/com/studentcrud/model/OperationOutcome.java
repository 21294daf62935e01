package com.studentcrud.model;

/**
 * How a single student operation ended.
 */
public enum OperationOutcome {
    SUCCESS,
    /** Update or delete matched no row; not an error. */
    NOT_FOUND,
    DUPLICATE_EMAIL,
    CONSTRAINT_VIOLATION,
    CONNECTION_FAILURE,
    FAILURE;

    public boolean isFailure() {
        return this != SUCCESS && this != NOT_FOUND;
    }
}
