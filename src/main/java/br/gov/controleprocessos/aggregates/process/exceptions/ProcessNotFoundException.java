package br.gov.controleprocessos.aggregates.process.exceptions;

import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;

public class ProcessNotFoundException extends ProcessRejectedException {

    public ProcessNotFoundException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public static ProcessNotFoundException instance(String instanceId) {
        return new ProcessNotFoundException(RejectionReason.INSTANCE_NOT_FOUND,
                "Process instance not found: " + instanceId);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.NOT_FOUND;
    }
}
