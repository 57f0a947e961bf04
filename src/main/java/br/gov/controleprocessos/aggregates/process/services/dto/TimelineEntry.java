package br.gov.controleprocessos.aggregates.process.services.dto;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One human-readable line of a process history.
 *
 * @param eventId       ledger id, {@code null} for synthesized entries
 * @param synthetic     entry reconstructed from the instance row because the ledger lacks it
 * @param snapshot      display values of the department being left, for hand-off entries
 */
public record TimelineEntry(
        Long eventId,
        String processInstanceId,
        String caseNumberDisplay,
        MovementKind kind,
        Department fromDepartment,
        Department toDepartment,
        String actor,
        LocalDateTime occurredAt,
        String description,
        String reason,
        boolean synthetic,
        Map<String, String> snapshot
) {}
