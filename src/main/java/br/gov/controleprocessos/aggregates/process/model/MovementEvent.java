package br.gov.controleprocessos.aggregates.process.model;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

/**
 * Append-only ledger entry of a process instance.
 * <p>
 * Rows are never updated. They disappear only when the owning instance is deleted.
 * Hand-off kinds (transfer, department finalization) carry the JSON snapshot of the
 * department being left together with its SHA-256 checksum.
 * </p>
 */
@Getter
@Entity
@Immutable
@Table(
    name = "movement_events",
    indexes = {
        @Index(name = "idx_movement_process", columnList = "process_instance_id, occurred_at")
    }
)
public class MovementEvent extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "process_instance_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ProcessInstance processInstance;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_department", length = 20)
    private Department fromDepartment;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_department", length = 20)
    private Department toDepartment;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private MovementKind kind;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "actor", nullable = false, length = 100)
    private String actor;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @Column(name = "snapshot_data", columnDefinition = "TEXT")
    private String snapshotData;

    @Column(name = "snapshot_checksum", length = 64)
    private String snapshotChecksum;

    protected MovementEvent() {
        // JPA
    }

    public MovementEvent(ProcessInstance processInstance, MovementKind kind, Department fromDepartment,
                         Department toDepartment, String reason, String actor, LocalDateTime occurredAt) {
        this.processInstance = processInstance;
        this.kind = kind;
        this.fromDepartment = fromDepartment;
        this.toDepartment = toDepartment;
        this.reason = reason;
        this.actor = actor;
        this.occurredAt = occurredAt != null ? occurredAt : LocalDateTime.now();
    }

    /**
     * Attaches the serialized snapshot. Only valid before the event is persisted.
     */
    public void attachSnapshot(String snapshotData, String snapshotChecksum) {
        if (id != null) {
            throw new IllegalStateException("Movement event " + id + " is already recorded");
        }
        this.snapshotData = snapshotData;
        this.snapshotChecksum = snapshotChecksum;
    }

    public boolean hasSnapshot() {
        return snapshotData != null;
    }

    public String getProcessInstanceId() {
        return processInstance.getId();
    }
}
