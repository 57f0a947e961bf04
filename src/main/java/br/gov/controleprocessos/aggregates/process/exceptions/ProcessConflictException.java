package br.gov.controleprocessos.aggregates.process.exceptions;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;

import java.util.List;

public class ProcessConflictException extends ProcessRejectedException {

    public ProcessConflictException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public ProcessConflictException(RejectionReason reason, String message, List<Department> conflictingDepartments) {
        super(reason, message, conflictingDepartments);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.CONFLICT;
    }
}
