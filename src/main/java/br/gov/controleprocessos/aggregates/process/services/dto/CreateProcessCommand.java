package br.gov.controleprocessos.aggregates.process.services.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

/**
 * Request to open a process instance.
 *
 * @param caseNumber    case number, with or without a department prefix
 * @param department    free-form department; blank or an intake synonym means the default department
 * @param relationalKey explicit group key linking to an existing demand cycle, optional
 * @param actor         person performing the creation
 * @param fields        initial field values, optional
 */
@Builder
public record CreateProcessCommand(
        @NotBlank String caseNumber,
        String department,
        String relationalKey,
        @NotBlank String actor,
        ProcessFields fields
) {}
