package br.gov.controleprocessos.aggregates.process.exceptions;

import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;

public class IllegalTransitionException extends ProcessRejectedException {

    public IllegalTransitionException(RejectionReason reason, String message) {
        super(reason, message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.ILLEGAL_TRANSITION;
    }
}
