package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessConflictException;
import br.gov.controleprocessos.aggregates.process.exceptions.ProcessNotFoundException;
import br.gov.controleprocessos.aggregates.process.exceptions.ProcessRejectedException;
import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;
import br.gov.controleprocessos.aggregates.process.repositories.ProcessInstanceRepository;
import br.gov.controleprocessos.aggregates.process.services.dto.*;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import jakarta.transaction.Transactional;
import org.hibernate.StaleStateException;
import org.hibernate.exception.LockAcquisitionException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the request layer.
 * <p>
 * Creation and transitions run in their own transaction inside {@link MovementStateMachine};
 * this class sits outside it, so a rejected operation has already been rolled back when its
 * {@link ProcessRejectedException} arrives here and is turned into a typed rejection. A lock
 * conflict reported by the database (timeout, deadlock victim, stale row) is rolled back the
 * same way and becomes a {@link RejectionReason#CONCURRENT_MODIFICATION} conflict.
 * </p>
 */
@ApplicationScoped
public class ProcessTrackingService {

    @Inject
    MovementStateMachine stateMachine;

    @Inject
    GroupingResolver groupingResolver;

    @Inject
    IdentifierNormalizer normalizer;

    @Inject
    HistoryProjector historyProjector;

    @Inject
    ProcessInstanceRepository processRepository;

    public TransitionResult createInstance(CreateProcessCommand command) {
        try {
            return stateMachine.create(command);
        } catch (ProcessRejectedException e) {
            Log.warnf("Rejected creation of %s in %s: %s", command.caseNumber(), command.department(), e);
            return TransitionResult.rejected(Rejection.of(e));
        } catch (RuntimeException e) {
            if (!isLockConflict(e)) {
                throw e;
            }
            Log.warnf(e, "Lock conflict creating %s in %s", command.caseNumber(), command.department());
            return TransitionResult.rejected(Rejection.of(concurrentModification("case " + command.caseNumber())));
        }
    }

    public TransitionResult transition(String instanceId, TransitionCommand command) {
        try {
            return stateMachine.transition(instanceId, command);
        } catch (ProcessRejectedException e) {
            Log.warnf("Rejected %s on process %s: %s", command.kind(), instanceId, e);
            return TransitionResult.rejected(Rejection.of(e));
        } catch (RuntimeException e) {
            if (!isLockConflict(e)) {
                throw e;
            }
            Log.warnf(e, "Lock conflict applying %s to process %s", command.kind(), instanceId);
            return TransitionResult.rejected(Rejection.of(concurrentModification("process " + instanceId)));
        }
    }

    private static ProcessConflictException concurrentModification(String subject) {
        return new ProcessConflictException(RejectionReason.CONCURRENT_MODIFICATION,
                "Could not lock " + subject + " for update; retry the operation");
    }

    /**
     * Whether the failure, or anything in its cause chain, is a lock conflict reported by the
     * persistence layer.
     */
    static boolean isLockConflict(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof PessimisticLockException
                    || t instanceof LockTimeoutException
                    || t instanceof OptimisticLockException
                    || t instanceof LockAcquisitionException
                    || t instanceof org.hibernate.PessimisticLockException
                    || t instanceof StaleStateException) {
                return true;
            }
        }
        return false;
    }

    /**
     * What already exists for a case number, plus descriptive fields to prefill a new
     * submission with, taken from the most recently updated instance of that number.
     */
    @Transactional
    public GroupInspection inspect(String caseNumber) {
        String base = normalizer.extractBaseCaseNumber(caseNumber);
        GroupAnalysis analysis = groupingResolver.analyze(base);
        ProcessPrefill prefill = processRepository.findByCaseNumberBase(base).stream()
                .max(Comparator.comparing(ProcessInstance::getUpdatedAt).thenComparing(ProcessInstance::getId))
                .map(i -> new ProcessPrefill(i.getId(), i.getCaseNumberDisplay(), i.getSubject(),
                        i.getStakeholder(), i.getExternalParty()))
                .orElse(null);
        return new GroupInspection(analysis, prefill);
    }

    public List<TimelineEntry> timeline(String instanceId) {
        return historyProjector.buildTimeline(instanceId);
    }

    public List<DepartmentLeg> departmentLegs(String instanceId) {
        return historyProjector.departmentLegs(instanceId);
    }

    public Map<Department, Long> occupancyByDepartment() {
        return historyProjector.departmentOccupancySnapshot();
    }

    @Transactional
    public Optional<ProcessInstanceView> findInstance(String instanceId) {
        return processRepository.findByIdOptional(instanceId).map(ProcessInstanceView::from);
    }

    /**
     * Removes an instance together with its movement ledger.
     *
     * @throws ProcessNotFoundException if the instance does not exist
     */
    @Transactional
    public void deleteInstance(String instanceId) {
        ProcessInstance instance = processRepository.findByIdForUpdate(instanceId)
                .orElseThrow(() -> ProcessNotFoundException.instance(instanceId));
        processRepository.delete(instance);
        Log.infof("Deleted process %s (%s) and its movement ledger", instance.getCaseNumberDisplay(), instanceId);
    }
}
