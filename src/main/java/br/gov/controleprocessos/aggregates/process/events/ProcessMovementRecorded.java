package br.gov.controleprocessos.aggregates.process.events;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;

import java.time.LocalDateTime;

/**
 * Event fired by the movement state machine for every ledger entry it writes.
 *
 * Observers run synchronously inside the writing transaction, so a failing observer rolls
 * the movement back with it.
 *
 * @param processInstanceId instance the movement belongs to
 * @param caseNumberDisplay department-prefixed case number at the time of the movement
 * @param kind              movement kind
 * @param fromDepartment    department left, or INTAKE for creations
 * @param toDepartment      department entered, CLOSED for global finalizations
 * @param actor             person who performed the movement
 * @param timestamp         when the movement occurred
 */
public record ProcessMovementRecorded(
    String processInstanceId,
    String caseNumberDisplay,
    MovementKind kind,
    Department fromDepartment,
    Department toDepartment,
    String actor,
    LocalDateTime timestamp
) {
    public ProcessMovementRecorded {
        if (processInstanceId == null || processInstanceId.isBlank()) {
            throw new IllegalArgumentException("processInstanceId cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (timestamp == null) {
            timestamp = LocalDateTime.now();
        }
    }

    /**
     * @return true if the movement closed the instance
     */
    public boolean isTerminalTransition() {
        return kind.isTerminal();
    }

    /**
     * @return true if the instance changed department
     */
    public boolean isDepartmentChange() {
        return fromDepartment != toDepartment;
    }
}
