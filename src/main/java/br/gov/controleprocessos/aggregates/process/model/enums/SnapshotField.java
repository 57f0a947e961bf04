package br.gov.controleprocessos.aggregates.process.model.enums;

/**
 * Department-scoped fields that history views display from a snapshot.
 */
public enum SnapshotField {
    SUBJECT("subject"),
    STAKEHOLDER("stakeholder"),
    EXTERNAL_PARTY("externalParty"),
    COORDINATION("coordination"),
    TEAM("team"),
    STATUS("status"),
    ASSIGNEE("assignedUserRef"),
    DUE_DATE("dueDate"),
    DEPARTMENT_DEADLINE("departmentDeadline"),
    NOTES("notes");

    private final String label;

    SnapshotField(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
