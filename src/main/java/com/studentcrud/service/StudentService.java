package com.studentcrud.service;

import com.studentcrud.model.OperationOutcome;
import com.studentcrud.model.OperationResult;
import com.studentcrud.model.Student;
import com.studentcrud.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Student operations for the shell.
 *
 * Turns repository exceptions into {@link OperationResult}s so callers can tell apart:
 * - SUCCESS / NOT_FOUND (update or delete matched no row)
 * - DUPLICATE_EMAIL and other CONSTRAINT_VIOLATIONs
 * - CONNECTION_FAILURE and any other FAILURE
 *
 * Any other unchecked exception becomes FAILURE. Nothing is retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudentService {

    static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final StudentRepository studentRepository;

    public OperationResult<Integer> create(String name, String email) {
        return execute("create", () -> OperationResult.success(studentRepository.create(name, email)));
    }

    public OperationResult<List<Student>> list() {
        return execute("list", () -> OperationResult.success(studentRepository.findAll()));
    }

    public OperationResult<Integer> update(int id, @Nullable String name, @Nullable String email) {
        return execute("update", () -> rowsAffected(studentRepository.update(id, name, email)));
    }

    public OperationResult<Integer> delete(int id) {
        return execute("delete", () -> rowsAffected(studentRepository.delete(id)));
    }

    private static OperationResult<Integer> rowsAffected(int rows) {
        return rows == 0 ? OperationResult.notFound(0) : OperationResult.success(rows);
    }

    private <T> OperationResult<T> execute(String operationName, Supplier<OperationResult<T>> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            OperationOutcome outcome = classify(e);
            String message = describe(NestedExceptionUtils.getMostSpecificCause(e));
            log.warn("Operation '{}' failed with {}: {}", operationName, outcome, message, e);
            return OperationResult.failure(outcome, message);
        } catch (RuntimeException e) {
            String message = describe(e);
            log.error("Operation '{}' failed unexpectedly: {}", operationName, message, e);
            return OperationResult.failure(OperationOutcome.FAILURE, message);
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return (message == null || message.isBlank()) ? failure.getClass().getSimpleName() : message;
    }

    static OperationOutcome classify(DataAccessException e) {
        if (e instanceof DuplicateKeyException) {
            return OperationOutcome.DUPLICATE_EMAIL;
        }
        if (e instanceof DataIntegrityViolationException) {
            return hasSqlState(e, UNIQUE_VIOLATION_SQL_STATE)
                    ? OperationOutcome.DUPLICATE_EMAIL
                    : OperationOutcome.CONSTRAINT_VIOLATION;
        }
        if (e instanceof DataAccessResourceFailureException) {
            return OperationOutcome.CONNECTION_FAILURE;
        }
        return OperationOutcome.FAILURE;
    }

    private static boolean hasSqlState(Throwable e, String sqlState) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sqlState.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
