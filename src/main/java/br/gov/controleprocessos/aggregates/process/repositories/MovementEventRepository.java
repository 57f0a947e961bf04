package br.gov.controleprocessos.aggregates.process.repositories;

import br.gov.controleprocessos.aggregates.process.model.MovementEvent;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the movement ledger. Writes go through the owning
 * {@link br.gov.controleprocessos.aggregates.process.model.ProcessInstance}.
 */
@ApplicationScoped
public class MovementEventRepository implements PanacheRepositoryBase<MovementEvent, Long> {

    /**
     * Ledger of one instance in replay order.
     */
    public List<MovementEvent> findByProcessInstance(String processInstanceId) {
        return find("processInstance.id = ?1 ORDER BY occurredAt ASC, id ASC", processInstanceId).list();
    }

    /**
     * Merged ledger of several instances in replay order.
     */
    public List<MovementEvent> findByProcessInstances(Collection<String> processInstanceIds) {
        if (processInstanceIds.isEmpty()) {
            return List.of();
        }
        return find("processInstance.id IN ?1 ORDER BY occurredAt ASC, id ASC", processInstanceIds).list();
    }

    /**
     * Most recent event of an instance that arrived in {@code toDepartment}.
     */
    public Optional<MovementEvent> findLatestArrival(String processInstanceId, Department toDepartment) {
        return find("processInstance.id = ?1 AND toDepartment = ?2 ORDER BY occurredAt DESC, id DESC",
                processInstanceId, toDepartment).firstResultOptional();
    }

    /**
     * Whether any of the instances ever left or entered the department.
     */
    public boolean existsTouchingDepartment(Collection<String> processInstanceIds, Department department) {
        if (processInstanceIds.isEmpty()) {
            return false;
        }
        return count("processInstance.id IN ?1 AND (fromDepartment = ?2 OR toDepartment = ?2)",
                processInstanceIds, department) > 0;
    }
}
