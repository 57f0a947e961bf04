package br.gov.controleprocessos.aggregates.process.services.dto;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessRejectedException;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;

import java.util.List;

public record Rejection(
        ProcessRejectedException.ErrorType errorType,
        RejectionReason reason,
        String message,
        List<Department> conflictingDepartments
) {
    public static Rejection of(ProcessRejectedException exception) {
        return new Rejection(exception.getErrorType(), exception.getReason(), exception.getMessage(),
                exception.getConflictingDepartments());
    }
}
