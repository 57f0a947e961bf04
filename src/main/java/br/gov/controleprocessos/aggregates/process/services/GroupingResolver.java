package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessConflictException;
import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;
import br.gov.controleprocessos.aggregates.process.repositories.MovementEventRepository;
import br.gov.controleprocessos.aggregates.process.repositories.ProcessInstanceRepository;
import br.gov.controleprocessos.aggregates.process.services.dto.GroupAnalysis;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Decides which process instances belong to the same demand cycle.
 *
 * A group is {@code (caseNumberBase, relationalKey)}. Instances without a key form the
 * legacy bucket of their base number: they only group with other keyless instances.
 * The legacy bucket is handled here and nowhere else, so it can be dropped once every
 * historical row carries an explicit key.
 */
@ApplicationScoped
public class GroupingResolver {

    private static final DateTimeFormatter KEY_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    @Inject
    ProcessInstanceRepository processRepository;

    @Inject
    MovementEventRepository movementRepository;

    /**
     * Summarizes active and finalized instances sharing a base number and resolves the
     * canonical relational key.
     */
    public GroupAnalysis analyze(String caseNumberBase) {
        return analyze(caseNumberBase, processRepository.findByCaseNumberBase(caseNumberBase));
    }

    /**
     * Same as {@link #analyze(String)} over instances the caller already holds, typically
     * the rows returned by {@link #lockCaseNumber(String)}.
     */
    public GroupAnalysis analyze(String caseNumberBase, List<ProcessInstance> instances) {
        List<ProcessInstance> active = instances.stream().filter(i -> !i.isClosed()).toList();
        List<ProcessInstance> finalized = instances.stream().filter(ProcessInstance::isClosed).toList();

        List<Department> activeDepartments = active.stream()
                .map(ProcessInstance::getCurrentDepartment)
                .distinct()
                .sorted()
                .toList();

        Set<String> activeKeys = distinctKeys(active);
        String key = null;
        boolean conflict = false;
        List<String> conflictingKeys = List.of();

        if (activeKeys.size() == 1) {
            key = activeKeys.iterator().next();
        } else if (activeKeys.size() > 1) {
            conflict = true;
            conflictingKeys = List.copyOf(activeKeys);
        } else if (active.isEmpty()) {
            Set<String> finalizedKeys = distinctKeys(finalized);
            if (finalizedKeys.size() == 1) {
                key = finalizedKeys.iterator().next();
            }
        }

        return new GroupAnalysis(caseNumberBase, active.size(), finalized.size(), activeDepartments,
                key, conflict, conflictingKeys);
    }

    /**
     * Key a new instance of {@code analysis.caseNumberBase()} is filed under.
     * <p>
     * An explicit key always wins. Otherwise an active cycle is joined, and a base number
     * with only closed history, or none, starts a new cycle under a freshly minted key so
     * that closed audit trails never absorb a later filing of the same number.
     * </p>
     *
     * @return the key, or {@code null} to join an active legacy (keyless) cycle
     * @throws ProcessConflictException if active instances disagree on the key
     */
    public String resolveKeyForCreation(GroupAnalysis analysis, String requestedKey) {
        if (requestedKey != null && !requestedKey.isBlank()) {
            return requestedKey.trim();
        }
        if (analysis.keyConflict()) {
            throw new ProcessConflictException(RejectionReason.AMBIGUOUS_RELATIONAL_KEY,
                    String.format("Active processes for %s carry different relational keys %s; supply one explicitly",
                            analysis.caseNumberBase(), analysis.conflictingKeys()),
                    analysis.activeDepartments());
        }
        if (analysis.activeCount() > 0) {
            return analysis.relationalKey();
        }
        String minted = mintRelationalKey(analysis.caseNumberBase());
        if (analysis.onlyFinalizedHistory()) {
            Log.infof("Case %s has only closed history; starting new cycle %s", analysis.caseNumberBase(), minted);
        }
        return minted;
    }

    public String mintRelationalKey(String caseNumberBase) {
        return caseNumberBase + "#" + LocalDateTime.now().format(KEY_SUFFIX);
    }

    /**
     * Membership test. With a key the instance must carry the same key; without one the
     * instance must itself be keyless.
     */
    public boolean belongsToSameGroup(ProcessInstance instance, String caseNumberBase, String relationalKey) {
        if (!Objects.equals(instance.getCaseNumberBase(), caseNumberBase)) {
            return false;
        }
        if (relationalKey != null) {
            return relationalKey.equals(instance.getRelationalKey());
        }
        return instance.getRelationalKey() == null;
    }

    public List<ProcessInstance> groupMembers(ProcessInstance instance) {
        return groupMembers(instance.getCaseNumberBase(), instance.getRelationalKey());
    }

    public List<ProcessInstance> groupMembers(String caseNumberBase, String relationalKey) {
        return processRepository.findGroupMembers(caseNumberBase, relationalKey).stream()
                .filter(i -> belongsToSameGroup(i, caseNumberBase, relationalKey))
                .toList();
    }

    /**
     * Write-locks every member of a group, in id order, for the rest of the transaction.
     * The returned rows are read after the locks are granted, so guards evaluated against
     * them see every move committed by an earlier writer of the same group.
     */
    public List<ProcessInstance> lockGroup(String caseNumberBase, String relationalKey) {
        return processRepository.lockGroupMembers(caseNumberBase, relationalKey).stream()
                .filter(i -> belongsToSameGroup(i, caseNumberBase, relationalKey))
                .toList();
    }

    /**
     * Write-locks every instance of a base number, in id order. Used on creation, before the
     * group the new instance joins is known.
     */
    public List<ProcessInstance> lockCaseNumber(String caseNumberBase) {
        return processRepository.lockByCaseNumberBase(caseNumberBase);
    }

    /**
     * Duplicate-active guard: a concrete department may hold at most one active instance
     * of a group. Pseudo-departments are exempt.
     *
     * @param members     locked members of the group
     * @param excludingId instance being moved, ignored when found in the target
     */
    public void assertNoActiveInDepartment(Collection<ProcessInstance> members, Department department,
                                           String excludingId) {
        if (!department.isConcrete()) {
            return;
        }
        List<ProcessInstance> occupants = members.stream()
                .filter(i -> !i.isClosed() && i.getCurrentDepartment() == department)
                .filter(i -> !i.getId().equals(excludingId))
                .toList();
        if (!occupants.isEmpty()) {
            ProcessInstance occupant = occupants.get(0);
            Log.warnf("Rejecting move of %s into %s: active instance %s already there",
                    occupant.getCaseNumberBase(), department, occupant.getCaseNumberDisplay());
            throw new ProcessConflictException(RejectionReason.DUPLICATE_ACTIVE_DEPARTMENT,
                    String.format("Case %s already has an active process in %s", occupant.getCaseNumberBase(), department),
                    List.of(department));
        }
    }

    /**
     * Whether the group has ever been in the department: a member sits there now, or a
     * member's ledger shows a movement from or to it.
     */
    public boolean hasGroupHistoryIn(Collection<ProcessInstance> members, Department department) {
        if (members.stream().anyMatch(i -> i.getCurrentDepartment() == department)) {
            return true;
        }
        List<String> ids = members.stream().map(ProcessInstance::getId).toList();
        return !ids.isEmpty() && movementRepository.existsTouchingDepartment(ids, department);
    }

    private static Set<String> distinctKeys(Collection<ProcessInstance> instances) {
        return instances.stream()
                .map(ProcessInstance::getRelationalKey)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
