package br.gov.controleprocessos.aggregates.process.services.dto;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * How a group looked in one department: the hand-off snapshot when it has moved on,
 * the live record otherwise.
 */
public record DepartmentLeg(
        Department department,
        String processInstanceId,
        LocalDateTime leftAt,
        boolean fromSnapshot,
        Map<String, String> values
) {}
