package br.gov.controleprocessos.aggregates.process.services.dto;

import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Parameters of a state-machine transition. Which parameters are read depends on
 * {@code kind}.
 *
 * @param kind             transition to perform
 * @param actor            person performing it
 * @param targetDepartment transfer target, or the department to return to
 * @param nextDepartment   downstream department requested on department finalization
 * @param status           status for status changes, or the initial status in a transfer target
 * @param assignee         new assignee for reassignments
 * @param reason           free text stored on the movement event
 * @param changes          field changes for edits
 * @param propagate        copy descriptive edits to the open siblings of the group
 */
@Builder
public record TransitionCommand(
        @NotNull MovementKind kind,
        @NotBlank String actor,
        String targetDepartment,
        String nextDepartment,
        String status,
        String assignee,
        String reason,
        ProcessFields changes,
        boolean propagate
) {}
