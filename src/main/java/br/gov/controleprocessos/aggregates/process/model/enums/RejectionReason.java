package br.gov.controleprocessos.aggregates.process.model.enums;

/**
 * Specific reason attached to every rejected operation.
 */
public enum RejectionReason {
    MISSING_MANDATORY_FIELD("Missing mandatory field"),
    INVALID_DEPARTMENT("Invalid department"),
    INVALID_STATUS("Invalid status for department"),
    INVALID_ATTRIBUTE("Invalid department attribute"),
    INVALID_CASE_NUMBER("Invalid case number"),
    UNAUTHORIZED_ASSIGNEE("Assignee lacks the required grant"),
    NO_RETURN_TARGET("No department to return to"),

    DUPLICATE_ACTIVE_DEPARTMENT("Group already has an active process in the department"),
    AMBIGUOUS_RELATIONAL_KEY("Active processes disagree on the relational key"),
    DUPLICATE_FIELD_DEFINITION("Field already defined for department"),
    CONCURRENT_MODIFICATION("Process was changed by a concurrent operation"),

    INSTANCE_NOT_FOUND("Process instance not found"),
    FIELD_DEFINITION_NOT_FOUND("Field definition not found"),

    ILLEGAL_TRANSITION("Transition not allowed from current department"),
    ALREADY_CLOSED("Process is already closed");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
