package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.events.ProcessMovementRecorded;
import br.gov.controleprocessos.aggregates.process.exceptions.IllegalTransitionException;
import br.gov.controleprocessos.aggregates.process.exceptions.ProcessNotFoundException;
import br.gov.controleprocessos.aggregates.process.exceptions.ProcessValidationException;
import br.gov.controleprocessos.aggregates.process.model.AssigneeGrant;
import br.gov.controleprocessos.aggregates.process.model.AttributeValue;
import br.gov.controleprocessos.aggregates.process.model.DepartmentSnapshot;
import br.gov.controleprocessos.aggregates.process.model.MovementEvent;
import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;
import br.gov.controleprocessos.aggregates.process.repositories.MovementEventRepository;
import br.gov.controleprocessos.aggregates.process.repositories.ProcessInstanceRepository;
import br.gov.controleprocessos.aggregates.process.services.dto.CreateProcessCommand;
import br.gov.controleprocessos.aggregates.process.services.dto.GroupAnalysis;
import br.gov.controleprocessos.aggregates.process.services.dto.ProcessFields;
import br.gov.controleprocessos.aggregates.process.services.dto.ProcessInstanceView;
import br.gov.controleprocessos.aggregates.process.services.dto.TransitionCommand;
import br.gov.controleprocessos.aggregates.process.services.dto.TransitionResult;
import br.gov.controleprocessos.config.ProcessTrackingConfig;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Consumer;

/**
 * State machine governing how a process instance moves between departments.
 *
 * <pre>
 *   (new) --creation--> DEPARTMENT --transfer--> any other department
 *                       DEPARTMENT --department_finalization--> OUTBOUND_REVIEW
 *   OUTBOUND_REVIEW --return_to_intake--> DEPARTMENT (in place, or a new instance)
 *   OUTBOUND_REVIEW --global_finalization--> CLOSED (every open sibling in review)
 * </pre>
 *
 * Reassignment, edit and status change keep the instance where it is. Closed instances
 * accept nothing.
 * <p>
 * Every operation runs in one transaction that first write-locks every member of the group,
 * in id order, and then evaluates the duplicate-active guard against the locked rows. Two
 * writers of one group therefore run one after the other and take their locks in the same
 * order. Guard violations are thrown as {@link br.gov.controleprocessos.aggregates.process.exceptions.ProcessRejectedException}
 * subclasses, which roll the whole transaction back.
 * </p>
 */
@ApplicationScoped
public class MovementStateMachine {

    static final String DIFF_SEPARATOR = "; ";

    @Inject
    ProcessTrackingConfig config;

    @Inject
    IdentifierNormalizer normalizer;

    @Inject
    GroupingResolver groupingResolver;

    @Inject
    SnapshotEngine snapshotEngine;

    @Inject
    DepartmentFieldService fieldService;

    @Inject
    AssigneeDirectory assigneeDirectory;

    @Inject
    ProcessInstanceRepository processRepository;

    @Inject
    MovementEventRepository movementRepository;

    @Inject
    Event<ProcessMovementRecorded> movementRecorded;

    /**
     * Whether a movement kind may be applied to an instance in the given state.
     *
     * @param current department the instance sits in
     * @param closed  whether the instance is closed
     * @param kind    movement requested
     * @return true if the transition table allows it
     */
    public boolean canTransition(Department current, boolean closed, MovementKind kind) {
        if (closed || current == null || !current.isOccupiable()) {
            return false;
        }
        return switch (kind) {
            case CREATION -> false;
            case TRANSFER, REASSIGNMENT, EDIT, STATUS_CHANGE -> true;
            case DEPARTMENT_FINALIZATION -> current.isConcrete();
            case GLOBAL_FINALIZATION, RETURN_TO_INTAKE -> current == Department.OUTBOUND_REVIEW;
        };
    }

    /**
     * Movement kinds currently available for an instance, in declaration order.
     */
    public Set<MovementKind> allowedTransitions(ProcessInstance instance) {
        Set<MovementKind> allowed = EnumSet.noneOf(MovementKind.class);
        for (MovementKind kind : MovementKind.values()) {
            if (canTransition(instance.getCurrentDepartment(), instance.isClosed(), kind)) {
                allowed.add(kind);
            }
        }
        return allowed;
    }

    /**
     * Opens a process instance.
     * <p>
     * The department defaults to the configured one and an INTAKE synonym resolves to it.
     * The instance joins the active cycle of its base number, or starts a new one under a
     * freshly minted relational key.
     * </p>
     */
    @Transactional
    public TransitionResult create(CreateProcessCommand command) {
        requireActor(command.actor());
        String base = normalizer.extractBaseCaseNumber(command.caseNumber());

        Department department = isBlank(command.department())
                ? config.defaultDepartment()
                : normalizer.normalizeDepartment(command.department());
        if (department == null || !department.isConcrete()) {
            throw new ProcessValidationException(RejectionReason.INVALID_DEPARTMENT,
                    "Processes can only be created in a department, got: " + command.department());
        }

        List<ProcessInstance> existing = groupingResolver.lockCaseNumber(base);
        GroupAnalysis analysis = groupingResolver.analyze(base, existing);
        String relationalKey = groupingResolver.resolveKeyForCreation(analysis, command.relationalKey());
        List<ProcessInstance> group = existing.stream()
                .filter(i -> groupingResolver.belongsToSameGroup(i, base, relationalKey))
                .toList();
        groupingResolver.assertNoActiveInDepartment(group, department, null);

        LocalDateTime now = LocalDateTime.now();
        ProcessInstance instance = new ProcessInstance();
        instance.setCaseNumberBase(base);
        instance.setCaseNumberDisplay(normalizer.displayCaseNumber(department, base));
        instance.setRelationalKey(relationalKey);
        instance.setCurrentDepartment(department);
        instance.setCreatedAt(now);
        instance.setUpdatedAt(now);
        instance.setCreatedBy(command.actor());

        ProcessFields fields = command.fields() != null ? command.fields() : ProcessFields.empty();
        applyEdit(instance, fields);
        if (!isBlank(fields.assignedUserRef())) {
            String assignee = fields.assignedUserRef().trim();
            assertAssigneeAllowed(instance, assignee);
            instance.setAssignedUserRef(assignee);
        }
        processRepository.persist(instance);

        record(instance, MovementKind.CREATION, Department.INTAKE, department,
                "Created in " + department.getDisplayName(), command.actor(), now, null);
        return TransitionResult.accepted(ProcessInstanceView.from(instance));
    }

    /**
     * Applies a movement to an existing instance.
     *
     * @return every instance the movement touched, the addressed one first, plus warnings
     * @throws ProcessNotFoundException   if the instance does not exist
     * @throws IllegalTransitionException if the instance is closed or the kind is not allowed
     *                                    from its department
     */
    @Transactional
    public TransitionResult transition(String instanceId, TransitionCommand command) {
        if (command.kind() == null) {
            throw new ProcessValidationException(RejectionReason.MISSING_MANDATORY_FIELD, List.of("kind"));
        }
        requireActor(command.actor());

        // the key never changes after creation, so it is safe to read before locking
        ProcessInstanceRepository.GroupRef ref = processRepository.findGroupRef(instanceId)
                .orElseThrow(() -> ProcessNotFoundException.instance(instanceId));
        List<ProcessInstance> group = groupingResolver.lockGroup(ref.caseNumberBase(), ref.relationalKey());
        ProcessInstance instance = group.stream()
                .filter(i -> i.getId().equals(instanceId))
                .findFirst()
                .orElseThrow(() -> ProcessNotFoundException.instance(instanceId));

        if (instance.isClosed()) {
            throw new IllegalTransitionException(RejectionReason.ALREADY_CLOSED,
                    String.format("Process %s was closed at %s by %s",
                            instance.getCaseNumberDisplay(), instance.getClosedAt(), instance.getClosedBy()));
        }
        if (!canTransition(instance.getCurrentDepartment(), false, command.kind())) {
            throw new IllegalTransitionException(RejectionReason.ILLEGAL_TRANSITION,
                    String.format("%s is not allowed for process %s in %s (allowed: %s)", command.kind(),
                            instance.getCaseNumberDisplay(), instance.getCurrentDepartment(),
                            allowedTransitions(instance)));
        }

        LocalDateTime now = LocalDateTime.now();
        return switch (command.kind()) {
            case TRANSFER -> transfer(instance, group, command, now);
            case DEPARTMENT_FINALIZATION -> finalizeDepartment(instance, group, command, now);
            case GLOBAL_FINALIZATION -> finalizeGlobally(instance, group, command, now);
            case RETURN_TO_INTAKE -> returnToIntake(instance, group, command, now);
            case REASSIGNMENT -> reassign(instance, command, now);
            case EDIT -> edit(instance, group, command, now);
            case STATUS_CHANGE -> changeStatus(instance, command, now);
            case CREATION -> throw new IllegalStateException("creation is handled by create()");
        };
    }

    private TransitionResult transfer(ProcessInstance instance, List<ProcessInstance> group, TransitionCommand command,
                                      LocalDateTime now) {
        Department from = instance.getCurrentDepartment();
        Department target = requireDepartment(command.targetDepartment());
        if (!target.isOccupiable()) {
            throw new IllegalTransitionException(RejectionReason.ILLEGAL_TRANSITION,
                    "Processes are closed through global finalization, not by transfer to " + target);
        }
        if (target == from) {
            throw new IllegalTransitionException(RejectionReason.ILLEGAL_TRANSITION,
                    String.format("Process %s is already in %s", instance.getCaseNumberDisplay(), target));
        }

        groupingResolver.assertNoActiveInDepartment(group, target, instance.getId());
        boolean freshCycle = target.isConcrete() && groupingResolver.hasGroupHistoryIn(group, target);
        String targetStatus = isBlank(command.status()) ? null : normalizer.normalizeStatus(target, command.status());

        DepartmentSnapshot snapshot = snapshotEngine.captureSnapshot(instance);

        StringBuilder reason = new StringBuilder(isBlank(command.reason())
                ? "Transferred to " + target.getDisplayName()
                : command.reason().trim());
        // review keeps the working fields of the department being left
        if (target != Department.OUTBOUND_REVIEW && freshCycle) {
            instance.setCoordination(null);
            instance.setTeam(null);
            instance.setStatus(null);
            instance.setAssignedUserRef(null);
            instance.setDepartmentDeadline(null);
            instance.setNotes(null);
            reason.append(" (new cycle in ").append(target).append(")");
        } else if (target != Department.OUTBOUND_REVIEW) {
            instance.setStatus(null);
            instance.setAssignedUserRef(null);
        }
        if (targetStatus != null) {
            instance.setStatus(targetStatus);
        }
        moveTo(instance, target);
        instance.setReturnedForTriage(false);

        record(instance, MovementKind.TRANSFER, from, target, reason.toString(), command.actor(), now, snapshot);
        return TransitionResult.accepted(ProcessInstanceView.from(instance));
    }

    private TransitionResult finalizeDepartment(ProcessInstance instance, List<ProcessInstance> group,
                                                TransitionCommand command, LocalDateTime now) {
        Department from = instance.getCurrentDepartment();
        List<String> missing = new ArrayList<>();
        if (isBlank(instance.getCoordination())) missing.add("coordination");
        if (isBlank(instance.getTeam())) missing.add("team");
        if (isBlank(instance.getAssignedUserRef())) missing.add("assignedUserRef");
        if (isBlank(instance.getStatus())) missing.add("status");
        if (!missing.isEmpty()) {
            throw new ProcessValidationException(RejectionReason.MISSING_MANDATORY_FIELD, missing);
        }

        Department next = null;
        if (!isBlank(command.nextDepartment())) {
            next = requireDepartment(command.nextDepartment());
            if (!next.isConcrete()) {
                throw new ProcessValidationException(RejectionReason.INVALID_DEPARTMENT,
                        "Next department must be a department, got: " + next);
            }
        }

        DepartmentSnapshot snapshot = snapshotEngine.captureSnapshot(instance);
        moveTo(instance, Department.OUTBOUND_REVIEW);
        String reason = isBlank(command.reason())
                ? "Finalized in " + from.getDisplayName()
                : command.reason().trim();
        record(instance, MovementKind.DEPARTMENT_FINALIZATION, from, Department.OUTBOUND_REVIEW,
                reason, command.actor(), now, snapshot);

        List<ProcessInstanceView> touched = new ArrayList<>();
        touched.add(ProcessInstanceView.from(instance));
        List<String> warnings = new ArrayList<>();

        if (next != null) {
            if (groupingResolver.hasGroupHistoryIn(group, next)) {
                String warning = String.format("Case %s already has history in %s; no new process was created there",
                        instance.getCaseNumberBase(), next);
                Log.warnf("Finalization of %s: %s", instance.getCaseNumberDisplay(), warning);
                warnings.add(warning);
            } else {
                ProcessInstance sibling = spawnSibling(instance, next, command.actor(), now);
                record(sibling, MovementKind.CREATION, from, next,
                        "Opened on finalization of " + instance.getCaseNumberDisplay(), command.actor(), now, null);
                touched.add(ProcessInstanceView.from(sibling));
            }
        }
        return TransitionResult.accepted(touched, warnings);
    }

    private TransitionResult finalizeGlobally(ProcessInstance instance, List<ProcessInstance> group,
                                              TransitionCommand command, LocalDateTime now) {
        List<ProcessInstance> toClose = new ArrayList<>();
        toClose.add(instance);
        inCreationOrder(group).stream()
                .filter(i -> !i.getId().equals(instance.getId()))
                .filter(i -> !i.isClosed() && i.getCurrentDepartment() == Department.OUTBOUND_REVIEW)
                .forEach(toClose::add);

        String reason = isBlank(command.reason()) ? "Closed" : command.reason().trim();
        List<ProcessInstanceView> closed = new ArrayList<>();
        for (ProcessInstance member : toClose) {
            member.close(now, command.actor());
            record(member, MovementKind.GLOBAL_FINALIZATION, Department.OUTBOUND_REVIEW, Department.CLOSED,
                    reason, command.actor(), now, null);
            closed.add(ProcessInstanceView.from(member));
        }
        Log.infof("Closed %d process(es) of case %s", toClose.size(), instance.getCaseNumberBase());
        return TransitionResult.accepted(closed, List.of());
    }

    private TransitionResult returnToIntake(ProcessInstance instance, List<ProcessInstance> group,
                                            TransitionCommand command, LocalDateTime now) {
        Department origin = movementRepository.findLatestArrival(instance.getId(), Department.OUTBOUND_REVIEW)
                .map(MovementEvent::getFromDepartment)
                .filter(Department::isConcrete)
                .orElse(null);

        Department target;
        if (!isBlank(command.targetDepartment())) {
            target = requireDepartment(command.targetDepartment());
            if (!target.isConcrete()) {
                throw new ProcessValidationException(RejectionReason.INVALID_DEPARTMENT,
                        "Processes can only be returned to a department, got: " + target);
            }
        } else if (origin != null) {
            target = origin;
        } else {
            throw new ProcessValidationException(RejectionReason.NO_RETURN_TARGET,
                    String.format("Process %s has no department that sent it to review; choose one",
                            instance.getCaseNumberDisplay()));
        }

        groupingResolver.assertNoActiveInDepartment(group, target, instance.getId());

        if (target == origin) {
            moveTo(instance, target);
            instance.setReturnedForTriage(true);
            String reason = isBlank(command.reason())
                    ? "Returned to " + target.getDisplayName()
                    : command.reason().trim();
            record(instance, MovementKind.RETURN_TO_INTAKE, Department.OUTBOUND_REVIEW, target,
                    reason, command.actor(), now, null);
            return TransitionResult.accepted(ProcessInstanceView.from(instance));
        }

        ProcessInstance spawned = spawnSibling(instance, target, command.actor(), now);
        spawned.setReturnedForTriage(true);
        String reason = isBlank(command.reason()) ? "" : ": " + command.reason().trim();
        record(instance, MovementKind.RETURN_TO_INTAKE, Department.OUTBOUND_REVIEW, target,
                "Returned to " + target.getDisplayName() + " as " + spawned.getCaseNumberDisplay() + reason,
                command.actor(), now, null);
        record(spawned, MovementKind.CREATION, Department.OUTBOUND_REVIEW, target,
                "Opened on return of " + instance.getCaseNumberDisplay() + " from review", command.actor(), now, null);
        return TransitionResult.accepted(
                List.of(ProcessInstanceView.from(instance), ProcessInstanceView.from(spawned)), List.of());
    }

    private TransitionResult reassign(ProcessInstance instance, TransitionCommand command, LocalDateTime now) {
        if (isBlank(command.assignee())) {
            throw new ProcessValidationException(RejectionReason.MISSING_MANDATORY_FIELD, List.of("assignee"));
        }
        String assignee = command.assignee().trim();
        String previous = instance.getAssignedUserRef();
        if (assignee.equals(previous)) {
            Log.debugf("Process %s already assigned to %s, no reassignment needed",
                    instance.getCaseNumberDisplay(), assignee);
            return TransitionResult.accepted(ProcessInstanceView.from(instance));
        }
        assertAssigneeAllowed(instance, assignee);

        instance.setAssignedUserRef(assignee);
        instance.setReturnedForTriage(false);
        String reason = change("assignedUserRef", previous, assignee)
                + (isBlank(command.reason()) ? "" : DIFF_SEPARATOR + command.reason().trim());
        Department department = instance.getCurrentDepartment();
        record(instance, MovementKind.REASSIGNMENT, department, department, reason, command.actor(), now, null);
        return TransitionResult.accepted(ProcessInstanceView.from(instance));
    }

    private TransitionResult edit(ProcessInstance instance, List<ProcessInstance> group, TransitionCommand command,
                                  LocalDateTime now) {
        ProcessFields changes = command.changes() != null ? command.changes() : ProcessFields.empty();
        Department department = instance.getCurrentDepartment();

        String previousStatus = instance.getStatus();
        List<String> diff = applyEdit(instance, changes);
        if (!isBlank(changes.assignedUserRef()) && !changes.assignedUserRef().trim().equals(instance.getAssignedUserRef())) {
            String assignee = changes.assignedUserRef().trim();
            assertAssigneeAllowed(instance, assignee);
            diff.add(change("assignedUserRef", instance.getAssignedUserRef(), assignee));
            instance.setAssignedUserRef(assignee);
            instance.setReturnedForTriage(false);
        }
        boolean statusChanged = !Objects.equals(previousStatus, instance.getStatus());

        if (!diff.isEmpty()) {
            record(instance, MovementKind.EDIT, department, department, String.join(DIFF_SEPARATOR, diff),
                    command.actor(), now, null);
        }
        if (statusChanged) {
            instance.setReturnedForTriage(false);
            record(instance, MovementKind.STATUS_CHANGE, department, department,
                    change("status", previousStatus, instance.getStatus()), command.actor(), now, null);
        }
        if (diff.isEmpty() && !statusChanged) {
            Log.debugf("Edit of %s changed nothing", instance.getCaseNumberDisplay());
        }

        List<ProcessInstanceView> touched = new ArrayList<>();
        touched.add(ProcessInstanceView.from(instance));
        if (command.propagate()) {
            ProcessFields descriptive = ProcessFields.builder()
                    .subject(changes.subject())
                    .stakeholder(changes.stakeholder())
                    .externalParty(changes.externalParty())
                    .build();
            for (ProcessInstance sibling : inCreationOrder(group)) {
                if (sibling.isClosed() || sibling.getId().equals(instance.getId())) {
                    continue;
                }
                List<String> siblingDiff = applyEdit(sibling, descriptive);
                if (!siblingDiff.isEmpty()) {
                    record(sibling, MovementKind.EDIT, sibling.getCurrentDepartment(), sibling.getCurrentDepartment(),
                            String.join(DIFF_SEPARATOR, siblingDiff) + " (propagated from " + instance.getCaseNumberDisplay() + ")",
                            command.actor(), now, null);
                    touched.add(ProcessInstanceView.from(sibling));
                }
            }
        }
        return TransitionResult.accepted(touched, List.of());
    }

    private TransitionResult changeStatus(ProcessInstance instance, TransitionCommand command, LocalDateTime now) {
        Department department = instance.getCurrentDepartment();
        String status = normalizer.normalizeStatus(department, command.status());
        if (status == null) {
            throw new ProcessValidationException(RejectionReason.MISSING_MANDATORY_FIELD, List.of("status"));
        }
        String previous = instance.getStatus();
        if (status.equals(previous)) {
            Log.debugf("Process %s already in status %s, no change needed", instance.getCaseNumberDisplay(), status);
            return TransitionResult.accepted(ProcessInstanceView.from(instance));
        }
        instance.setStatus(status);
        instance.setReturnedForTriage(false);
        String reason = change("status", previous, status)
                + (isBlank(command.reason()) ? "" : DIFF_SEPARATOR + command.reason().trim());
        record(instance, MovementKind.STATUS_CHANGE, department, department, reason, command.actor(), now, null);
        return TransitionResult.accepted(ProcessInstanceView.from(instance));
    }

    /**
     * Applies every non-null field of {@code changes} except the assignee. An empty string
     * clears the field.
     *
     * @return one {@code field: old -> new} line per changed field, status excluded
     */
    private List<String> applyEdit(ProcessInstance instance, ProcessFields changes) {
        List<String> diff = new ArrayList<>();
        Department department = instance.getCurrentDepartment();

        if (changes.status() != null) {
            instance.setStatus(normalizer.normalizeStatus(department, changes.status()));
        }
        editText(diff, "subject", instance.getSubject(), changes.subject(), instance::setSubject);
        editText(diff, "stakeholder", instance.getStakeholder(), changes.stakeholder(), instance::setStakeholder);
        editText(diff, "externalParty", instance.getExternalParty(), changes.externalParty(), instance::setExternalParty);
        editText(diff, "coordination", instance.getCoordination(), changes.coordination(), instance::setCoordination);
        editText(diff, "team", instance.getTeam(), changes.team(), instance::setTeam);
        editText(diff, "notes", instance.getNotes(), changes.notes(), instance::setNotes);

        if (changes.dueDate() != null) {
            LocalDate dueDate = parseDate("dueDate", changes.dueDate());
            if (!Objects.equals(dueDate, instance.getDueDate())) {
                diff.add(change("dueDate", instance.getDueDate(), dueDate));
                instance.setDueDate(dueDate);
            }
        }
        if (changes.departmentDeadline() != null) {
            LocalDate deadline = parseDate("departmentDeadline", changes.departmentDeadline());
            if (!Objects.equals(deadline, instance.getDepartmentDeadline())) {
                diff.add(change("departmentDeadline", instance.getDepartmentDeadline(), deadline));
                instance.setDepartmentDeadline(deadline);
            }
        }

        if (changes.attributes() != null && !changes.attributes().isEmpty()) {
            Map<String, AttributeValue> typed = fieldService.validateAttributes(department, changes.attributes());
            Map<String, AttributeValue> attributes = instance.getAttributes();
            typed.forEach((key, value) -> {
                AttributeValue previous = attributes.get(key);
                if (!Objects.equals(previous, value)) {
                    diff.add(change("attributes." + key, previous, value));
                    if (value == null) {
                        attributes.remove(key);
                    } else {
                        attributes.put(key, value);
                    }
                }
            });
            instance.setAttributes(attributes);
        }
        return diff;
    }

    private static void editText(List<String> diff, String field, String current, String requested,
                                 Consumer<String> setter) {
        if (requested == null) {
            return;
        }
        String value = requested.isBlank() ? null : requested.trim();
        if (!Objects.equals(current, value)) {
            diff.add(change(field, current, value));
            setter.accept(value);
        }
    }

    private void assertAssigneeAllowed(ProcessInstance instance, String assignee) {
        List<AssigneeGrant> grants = assigneeDirectory.findGrants(assignee);
        boolean allowed = grants.stream().anyMatch(grant ->
                grant.getDepartment() == instance.getCurrentDepartment()
                        && scopeMatches(instance.getCoordination(), grant.getCoordination())
                        && scopeMatches(instance.getTeam(), grant.getTeam()));
        if (!allowed) {
            Log.warnf("Rejecting assignee %s for %s: no grant for %s/%s/%s", assignee,
                    instance.getCaseNumberDisplay(), instance.getCurrentDepartment(),
                    instance.getCoordination(), instance.getTeam());
            throw new ProcessValidationException(RejectionReason.UNAUTHORIZED_ASSIGNEE,
                    String.format("%s holds no grant for %s%s%s", assignee, instance.getCurrentDepartment(),
                            instance.getCoordination() == null ? "" : " / " + instance.getCoordination(),
                            instance.getTeam() == null ? "" : " / " + instance.getTeam()));
        }
    }

    // an unscoped instance accepts any grant of the department; a scoped one needs the same scope
    private static boolean scopeMatches(String instanceScope, String grantScope) {
        return isBlank(instanceScope) || instanceScope.equalsIgnoreCase(grantScope == null ? "" : grantScope.trim());
    }

    // locks are taken in id order; results are reported oldest first
    private static List<ProcessInstance> inCreationOrder(List<ProcessInstance> group) {
        return group.stream()
                .sorted(Comparator.comparing(ProcessInstance::getCreatedAt).thenComparing(ProcessInstance::getId))
                .toList();
    }

    private ProcessInstance spawnSibling(ProcessInstance source, Department department, String actor, LocalDateTime now) {
        ProcessInstance sibling = new ProcessInstance();
        sibling.setCaseNumberBase(source.getCaseNumberBase());
        sibling.setRelationalKey(source.getRelationalKey());
        sibling.setCaseNumberDisplay(normalizer.displayCaseNumber(department, source.getCaseNumberBase()));
        sibling.setCurrentDepartment(department);
        sibling.setSubject(source.getSubject());
        sibling.setStakeholder(source.getStakeholder());
        sibling.setExternalParty(source.getExternalParty());
        sibling.setDueDate(source.getDueDate());
        sibling.setCreatedAt(now);
        sibling.setUpdatedAt(now);
        sibling.setCreatedBy(actor);
        processRepository.persist(sibling);
        return sibling;
    }

    /**
     * Moves the department pointer. The display number follows concrete departments only, so
     * siblings waiting in review keep the number of the department they came from.
     */
    private void moveTo(ProcessInstance instance, Department target) {
        instance.setCurrentDepartment(target);
        if (target.isConcrete()) {
            instance.setCaseNumberDisplay(normalizer.displayCaseNumber(target, instance.getCaseNumberBase()));
        }
    }

    private void record(ProcessInstance instance, MovementKind kind, Department from, Department to, String reason,
                        String actor, LocalDateTime at, DepartmentSnapshot snapshot) {
        MovementEvent event = new MovementEvent(instance, kind, from, to, reason, actor, at);
        if (snapshot != null) {
            snapshotEngine.attach(event, snapshot);
        }
        instance.getMovements().add(event);
        movementRepository.persist(event);

        Log.infof("Process %s: %s %s -> %s by %s", instance.getCaseNumberDisplay(), kind, from, to, actor);
        movementRecorded.fire(new ProcessMovementRecorded(instance.getId(), instance.getCaseNumberDisplay(),
                kind, from, to, actor, at));
    }

    private Department requireDepartment(String raw) {
        Department department = normalizer.normalizeDepartment(raw);
        if (department == null) {
            throw new ProcessValidationException(RejectionReason.INVALID_DEPARTMENT, "Unknown department: " + raw);
        }
        return department;
    }

    private static void requireActor(String actor) {
        if (isBlank(actor)) {
            throw new ProcessValidationException(RejectionReason.MISSING_MANDATORY_FIELD, List.of("actor"));
        }
    }

    private static LocalDate parseDate(String field, String raw) {
        if (raw.isBlank()) {
            return null;
        }
        try {
            return DepartmentFieldService.parseDate(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ProcessValidationException(RejectionReason.INVALID_ATTRIBUTE,
                    List.of(field + " (not a valid date: " + raw + ")"));
        }
    }

    static String change(String field, Object previous, Object current) {
        return field + ": " + (previous == null ? "" : previous) + " -> " + (current == null ? "" : current);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
