package br.gov.controleprocessos.aggregates.process.repositories;

import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Panache repository for {@link ProcessInstance}.
 * Group queries take the relational key as-is: a {@code null} key selects the legacy
 * bucket of instances that carry no key.
 */
@ApplicationScoped
public class ProcessInstanceRepository implements PanacheRepositoryBase<ProcessInstance, String> {

    /**
     * Re-reads an instance under a write lock for the duration of the transaction.
     */
    public Optional<ProcessInstance> findByIdForUpdate(String id) {
        return Optional.ofNullable(findById(id, LockModeType.PESSIMISTIC_WRITE));
    }

    /**
     * All instances sharing a base case number, oldest first.
     */
    public List<ProcessInstance> findByCaseNumberBase(String caseNumberBase) {
        return find("caseNumberBase = ?1 ORDER BY createdAt ASC, id ASC", caseNumberBase).list();
    }

    public List<ProcessInstance> findGroupMembers(String caseNumberBase, String relationalKey) {
        if (relationalKey == null) {
            return find("caseNumberBase = ?1 AND relationalKey IS NULL ORDER BY createdAt ASC, id ASC",
                    caseNumberBase).list();
        }
        return find("caseNumberBase = ?1 AND relationalKey = ?2 ORDER BY createdAt ASC, id ASC",
                caseNumberBase, relationalKey).list();
    }

    /**
     * Locks every instance sharing a base case number, in id order.
     */
    public List<ProcessInstance> lockByCaseNumberBase(String caseNumberBase) {
        return find("caseNumberBase = ?1 ORDER BY id ASC", caseNumberBase)
                .withLock(LockModeType.PESSIMISTIC_WRITE)
                .list();
    }

    /**
     * Locks every member of a group, in id order. Writers that touch several members of one
     * group all lock through here, so they acquire row locks in the same order.
     */
    public List<ProcessInstance> lockGroupMembers(String caseNumberBase, String relationalKey) {
        if (relationalKey == null) {
            return find("caseNumberBase = ?1 AND relationalKey IS NULL ORDER BY id ASC", caseNumberBase)
                    .withLock(LockModeType.PESSIMISTIC_WRITE)
                    .list();
        }
        return find("caseNumberBase = ?1 AND relationalKey = ?2 ORDER BY id ASC", caseNumberBase, relationalKey)
                .withLock(LockModeType.PESSIMISTIC_WRITE)
                .list();
    }

    /**
     * Base number and relational key of an instance, read without loading the entity.
     */
    public Optional<GroupRef> findGroupRef(String id) {
        return getEntityManager()
                .createQuery("SELECT p.caseNumberBase, p.relationalKey FROM ProcessInstance p WHERE p.id = :id",
                        Object[].class)
                .setParameter("id", id)
                .getResultStream()
                .findFirst()
                .map(row -> new GroupRef((String) row[0], (String) row[1]));
    }

    public record GroupRef(String caseNumberBase, String relationalKey) {}

    /**
     * Instances whose attribute bag mentions the given key.
     */
    public List<ProcessInstance> findWithAttributeKey(String fieldKey) {
        return find("attributesJson LIKE ?1", "%\"" + fieldKey + "\"%").list();
    }

    /**
     * Active instances per department, leaving out those returned for intake re-triage.
     */
    public Map<Department, Long> countActiveByDepartment() {
        List<Object[]> rows = getEntityManager()
                .createQuery("SELECT p.currentDepartment, COUNT(p) FROM ProcessInstance p "
                        + "WHERE p.closedAt IS NULL AND p.returnedForTriage = false "
                        + "GROUP BY p.currentDepartment", Object[].class)
                .getResultList();
        Map<Department, Long> counts = new EnumMap<>(Department.class);
        for (Object[] row : rows) {
            counts.put((Department) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
