package br.gov.controleprocessos.aggregates.process.exceptions;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;

import java.util.ArrayList;
import java.util.List;

/**
 * Base type for every guard violation raised by the process lifecycle.
 * Thrown inside the transactional layer so the transaction rolls back, and turned into a
 * typed rejection at the service boundary.
 */
public abstract class ProcessRejectedException extends RuntimeException {

    private final RejectionReason reason;
    private final List<Department> conflictingDepartments = new ArrayList<>();

    protected ProcessRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected ProcessRejectedException(RejectionReason reason, String message, List<Department> conflictingDepartments) {
        super(message);
        this.reason = reason;
        this.conflictingDepartments.addAll(conflictingDepartments);
    }

    public RejectionReason getReason() {
        return reason;
    }

    public List<Department> getConflictingDepartments() {
        return new ArrayList<>(conflictingDepartments);
    }

    /**
     * Error family as surfaced to callers (validation, conflict, not-found, illegal-transition).
     */
    public abstract ErrorType getErrorType();

    public enum ErrorType {
        VALIDATION,
        CONFLICT,
        NOT_FOUND,
        ILLEGAL_TRANSITION
    }

    @Override
    public String toString() {
        return String.format("%s[%s]: %s", getClass().getSimpleName(), reason, getMessage());
    }
}
