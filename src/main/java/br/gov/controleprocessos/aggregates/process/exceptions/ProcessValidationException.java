package br.gov.controleprocessos.aggregates.process.exceptions;

import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;

import java.util.ArrayList;
import java.util.List;

/**
 * Missing mandatory fields, unknown departments or statuses, malformed attributes and
 * assignees without the required grant.
 */
public class ProcessValidationException extends ProcessRejectedException {

    private final List<String> fields = new ArrayList<>();

    public ProcessValidationException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public ProcessValidationException(RejectionReason reason, List<String> fields) {
        super(reason, buildMessage(reason, fields));
        this.fields.addAll(fields);
    }

    public List<String> getFields() {
        return new ArrayList<>(fields);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.VALIDATION;
    }

    private static String buildMessage(RejectionReason reason, List<String> fields) {
        if (fields.isEmpty()) {
            return reason.getDescription();
        }
        return reason.getDescription() + ": " + String.join(", ", fields);
    }
}
