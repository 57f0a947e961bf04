package br.gov.controleprocessos.aggregates.process.model;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One branch of a process lineage as it moves between departments.
 *
 * Several instances may share a {@code caseNumberBase}; those that also share the
 * {@code relationalKey} (or all lack one, the legacy bucket) form one demand cycle.
 * The movement ledger is owned by the instance and removed with it.
 */
@Getter
@Setter
@Entity
@Table(
    name = "process_instances",
    indexes = {
        @Index(name = "idx_process_case_base", columnList = "case_number_base"),
        @Index(name = "idx_process_group", columnList = "case_number_base, relational_key"),
        @Index(name = "idx_process_department", columnList = "current_department, closed_at")
    }
)
public class ProcessInstance extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String id;

    // Identification
    @Column(name = "case_number_display", nullable = false, length = 80)
    private String caseNumberDisplay;

    @Column(name = "case_number_base", nullable = false, length = 64)
    private String caseNumberBase;

    @Column(name = "relational_key", length = 100)
    private String relationalKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_department", nullable = false, length = 20)
    private Department currentDepartment;

    // Descriptive fields, shared across the lineage
    @Column(name = "subject", length = 500)
    private String subject;

    @Column(name = "stakeholder", length = 200)
    private String stakeholder;

    @Column(name = "external_party", length = 200)
    private String externalParty;

    // Department-scoped workflow fields
    @Column(name = "coordination", length = 100)
    private String coordination;

    @Column(name = "team", length = 100)
    private String team;

    @Column(name = "status", length = 60)
    private String status;

    @Column(name = "assigned_user_ref", length = 100)
    private String assignedUserRef;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "department_deadline")
    private LocalDate departmentDeadline;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "attributes", length = 4000)
    private String attributesJson;

    @Column(name = "returned_for_triage", nullable = false)
    private boolean returnedForTriage = false;

    // Terminal
    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "closed_by", length = 100)
    private String closedBy;

    // Audit timestamps
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "processInstance", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("occurredAt ASC, id ASC")
    private List<MovementEvent> movements = new ArrayList<>();

    public ProcessInstance() {
        this.id = UUID.randomUUID().toString();
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isClosed() {
        return closedAt != null;
    }

    public Map<String, AttributeValue> getAttributes() {
        return AttributeBag.read(attributesJson);
    }

    public void setAttributes(Map<String, AttributeValue> attributes) {
        this.attributesJson = AttributeBag.write(attributes);
    }

    /**
     * Sets the terminal fields. Only ever called once per instance.
     */
    public void close(LocalDateTime at, String by) {
        if (closedAt != null) {
            throw new IllegalStateException("Process " + id + " already closed at " + closedAt);
        }
        this.closedAt = at;
        this.closedBy = by;
        this.updatedAt = at;
    }

    @Override
    public String toString() {
        return String.format("ProcessInstance[%s %s in %s%s]", id, caseNumberDisplay, currentDepartment,
                isClosed() ? ", closed" : "");
    }
}
