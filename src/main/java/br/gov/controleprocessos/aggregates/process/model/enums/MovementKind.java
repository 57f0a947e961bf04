package br.gov.controleprocessos.aggregates.process.model.enums;

/**
 * Discriminates how a movement event's reason and snapshot are read.
 */
public enum MovementKind {
    CREATION,
    TRANSFER,
    DEPARTMENT_FINALIZATION,
    GLOBAL_FINALIZATION,
    RETURN_TO_INTAKE,
    REASSIGNMENT,
    EDIT,
    STATUS_CHANGE;

    /**
     * Hand-off kinds capture a snapshot of the department being left.
     */
    public boolean capturesSnapshot() {
        return this == TRANSFER || this == DEPARTMENT_FINALIZATION;
    }

    public boolean isTerminal() {
        return this == GLOBAL_FINALIZATION;
    }
}
