package br.gov.controleprocessos.aggregates.process.model;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.TreeMap;

/**
 * Frozen copy of the department-scoped fields of a process instance, taken when the
 * instance leaves {@code department}.
 */
public record DepartmentSnapshot(
        Department department,
        String caseNumberDisplay,
        String subject,
        String stakeholder,
        String externalParty,
        String coordination,
        String team,
        String status,
        String assignedUserRef,
        LocalDate dueDate,
        LocalDate departmentDeadline,
        String notes,
        Map<String, AttributeValue> attributes,
        LocalDateTime capturedAt
) {
    public DepartmentSnapshot {
        if (department == null) {
            throw new IllegalArgumentException("department cannot be null");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(new TreeMap<>(attributes));
        if (capturedAt == null) {
            capturedAt = LocalDateTime.now();
        }
    }
}
