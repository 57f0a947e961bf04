package br.gov.controleprocessos.aggregates.process.services.dto;

import lombok.Builder;

import java.util.Map;

/**
 * Free fields supplied on creation and edit.
 * <p>
 * On edit a {@code null} value leaves the field untouched and an empty string clears it.
 * Dates are ISO ({@code yyyy-MM-dd}); attribute values are raw strings validated against
 * the department's field definitions.
 * </p>
 */
@Builder(toBuilder = true)
public record ProcessFields(
        String subject,
        String stakeholder,
        String externalParty,
        String coordination,
        String team,
        String status,
        String assignedUserRef,
        String dueDate,
        String departmentDeadline,
        String notes,
        Map<String, String> attributes
) {
    public static ProcessFields empty() {
        return ProcessFields.builder().build();
    }
}
