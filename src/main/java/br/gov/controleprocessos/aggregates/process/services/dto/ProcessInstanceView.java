package br.gov.controleprocessos.aggregates.process.services.dto;

import br.gov.controleprocessos.aggregates.process.model.AttributeValue;
import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Detached, read-only copy of a process instance handed to callers.
 */
public record ProcessInstanceView(
        String id,
        String caseNumberDisplay,
        String caseNumberBase,
        String relationalKey,
        Department currentDepartment,
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
        boolean returnedForTriage,
        LocalDateTime closedAt,
        String closedBy,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ProcessInstanceView from(ProcessInstance instance) {
        return new ProcessInstanceView(
                instance.getId(),
                instance.getCaseNumberDisplay(),
                instance.getCaseNumberBase(),
                instance.getRelationalKey(),
                instance.getCurrentDepartment(),
                instance.getSubject(),
                instance.getStakeholder(),
                instance.getExternalParty(),
                instance.getCoordination(),
                instance.getTeam(),
                instance.getStatus(),
                instance.getAssignedUserRef(),
                instance.getDueDate(),
                instance.getDepartmentDeadline(),
                instance.getNotes(),
                instance.getAttributes(),
                instance.isReturnedForTriage(),
                instance.getClosedAt(),
                instance.getClosedBy(),
                instance.getCreatedAt(),
                instance.getUpdatedAt()
        );
    }

    public boolean closed() {
        return closedAt != null;
    }
}
