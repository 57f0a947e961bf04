package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessNotFoundException;
import br.gov.controleprocessos.aggregates.process.model.DepartmentSnapshot;
import br.gov.controleprocessos.aggregates.process.model.MovementEvent;
import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;
import br.gov.controleprocessos.aggregates.process.repositories.MovementEventRepository;
import br.gov.controleprocessos.aggregates.process.repositories.ProcessInstanceRepository;
import br.gov.controleprocessos.aggregates.process.services.dto.DepartmentLeg;
import br.gov.controleprocessos.aggregates.process.services.dto.TimelineEntry;
import br.gov.controleprocessos.config.ProcessTrackingConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Replays the movement ledger into readable timelines and department metrics.
 * Read only: nothing here writes to the ledger or the instances.
 */
@JBossLog
@ApplicationScoped
public class HistoryProjector {

    private static final Comparator<MovementEvent> LEDGER_ORDER = Comparator
            .comparing(MovementEvent::getOccurredAt)
            .thenComparing(MovementEvent::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Inject
    ProcessInstanceRepository processRepository;

    @Inject
    MovementEventRepository movementRepository;

    @Inject
    GroupingResolver groupingResolver;

    @Inject
    SnapshotEngine snapshotEngine;

    @Inject
    IdentifierNormalizer normalizer;

    @Inject
    ProcessTrackingConfig config;

    /**
     * Ordered history of the demand cycle an instance belongs to.
     * <p>
     * Legacy rows get a synthesized creation entry when their ledger has none, and a
     * synthesized closing entry when they are closed without a global finalization event.
     * Entries of the same instance with the same normalized text inside one timestamp bucket
     * are reported once.
     * </p>
     *
     * @throws ProcessNotFoundException if the instance does not exist
     */
    @Transactional
    public List<TimelineEntry> buildTimeline(String instanceId) {
        ProcessInstance instance = processRepository.findByIdOptional(instanceId)
                .orElseThrow(() -> ProcessNotFoundException.instance(instanceId));
        List<ProcessInstance> members = groupingResolver.groupMembers(instance);
        Map<String, ProcessInstance> byId = members.stream()
                .collect(Collectors.toMap(ProcessInstance::getId, Function.identity()));
        List<MovementEvent> events = movementRepository.findByProcessInstances(byId.keySet());
        return project(members, events);
    }

    List<TimelineEntry> project(List<ProcessInstance> members, List<MovementEvent> events) {
        Map<String, ProcessInstance> byId = members.stream()
                .collect(Collectors.toMap(ProcessInstance::getId, Function.identity()));
        Map<String, List<MovementEvent>> ledgers = events.stream()
                .collect(Collectors.groupingBy(MovementEvent::getProcessInstanceId));
        Map<MovementEvent, String> displays = new IdentityHashMap<>();
        ledgers.forEach((id, ledger) -> {
            ProcessInstance owner = byId.get(id);
            if (owner != null) {
                displays.putAll(displaysAtEventTime(owner, ledger));
            }
        });

        List<RankedEntry> ranked = new ArrayList<>();
        for (MovementEvent event : events) {
            ProcessInstance owner = byId.get(event.getProcessInstanceId());
            if (owner != null) {
                ranked.add(new RankedEntry(1, toEntry(owner, event, displays.get(event))));
            }
        }
        for (ProcessInstance member : members) {
            List<MovementEvent> ledger = ledgers.getOrDefault(member.getId(), List.of());
            if (ledger.stream().noneMatch(e -> e.getKind() == MovementKind.CREATION)) {
                ranked.add(new RankedEntry(0, synthesizedCreation(member, ledger)));
            }
            if (member.isClosed() && ledger.stream().noneMatch(e -> e.getKind() == MovementKind.GLOBAL_FINALIZATION)) {
                ranked.add(new RankedEntry(2, synthesizedClosing(member)));
            }
        }

        ranked.sort(Comparator
                .comparing((RankedEntry r) -> r.entry().occurredAt())
                .thenComparingInt(RankedEntry::rank)
                .thenComparing(r -> r.entry().eventId(), Comparator.nullsFirst(Comparator.naturalOrder())));

        long bucketSeconds = Math.max(1, config.timeline().dedupBucketSeconds());
        Set<String> seen = new HashSet<>();
        List<TimelineEntry> timeline = new ArrayList<>();
        for (RankedEntry r : ranked) {
            TimelineEntry entry = r.entry();
            String dedupKey = entry.processInstanceId() + "|" + normalizedText(entry) + "|"
                    + Math.floorDiv(entry.occurredAt().toEpochSecond(ZoneOffset.UTC), bucketSeconds);
            if (seen.add(dedupKey)) {
                timeline.add(entry);
            } else {
                log.debugf("Dropping duplicated timeline line for %s at %s: %s",
                        entry.caseNumberDisplay(), entry.occurredAt(), entry.description());
            }
        }
        return timeline;
    }

    /**
     * Active instances per department. Instances returned for intake re-triage are left
     * out; every department a process may sit in is present, possibly with zero.
     */
    @Transactional
    public Map<Department, Long> departmentOccupancySnapshot() {
        Map<Department, Long> occupancy = new EnumMap<>(Department.class);
        for (Department department : Department.values()) {
            if (department.isOccupiable()) {
                occupancy.put(department, 0L);
            }
        }
        processRepository.countActiveByDepartment().forEach(occupancy::put);
        return occupancy;
    }

    /**
     * How the group looked in each department it went through, in order of first arrival.
     * A department the group has left shows the values frozen when it was left.
     */
    @Transactional
    public List<DepartmentLeg> departmentLegs(String instanceId) {
        ProcessInstance instance = processRepository.findByIdOptional(instanceId)
                .orElseThrow(() -> ProcessNotFoundException.instance(instanceId));
        List<ProcessInstance> members = groupingResolver.groupMembers(instance);
        Map<String, ProcessInstance> byId = members.stream()
                .collect(Collectors.toMap(ProcessInstance::getId, Function.identity()));
        List<MovementEvent> events = new ArrayList<>(movementRepository.findByProcessInstances(byId.keySet()));
        events.sort(LEDGER_ORDER);

        Set<Department> visited = new LinkedHashSet<>();
        for (MovementEvent event : events) {
            if (event.getFromDepartment() != null && event.getFromDepartment().isConcrete()) {
                visited.add(event.getFromDepartment());
            }
            if (event.getToDepartment() != null && event.getToDepartment().isConcrete()) {
                visited.add(event.getToDepartment());
            }
        }
        members.stream()
                .map(ProcessInstance::getCurrentDepartment)
                .filter(Department::isConcrete)
                .forEach(visited::add);

        List<DepartmentLeg> legs = new ArrayList<>();
        for (Department department : visited) {
            Optional<MovementEvent> leaving = snapshotEngine.latestSnapshotEvent(events, department);
            DepartmentSnapshot snapshot = snapshotEngine.latestSnapshotFor(events, department).orElse(null);
            ProcessInstance subject = members.stream()
                    .filter(m -> !m.isClosed() && m.getCurrentDepartment() == department)
                    .findFirst()
                    .orElseGet(() -> leaving.map(e -> byId.get(e.getProcessInstanceId())).orElse(null));
            if (subject == null) {
                continue;
            }
            boolean fromSnapshot = snapshot != null && snapshotEngine.prefersSnapshot(subject, snapshot);
            legs.add(new DepartmentLeg(department, subject.getId(),
                    leaving.map(MovementEvent::getOccurredAt).orElse(null),
                    fromSnapshot,
                    snapshotEngine.displayValues(subject, snapshot)));
        }
        return legs;
    }

    private TimelineEntry toEntry(ProcessInstance owner, MovementEvent event, String display) {
        Map<String, String> snapshot = event.hasSnapshot()
                ? snapshotEngine.restore(event).map(snapshotEngine::snapshotValues).orElse(Map.of())
                : Map.of();
        return new TimelineEntry(event.getId(), owner.getId(), display, event.getKind(),
                event.getFromDepartment(), event.getToDepartment(), event.getActor(), event.getOccurredAt(),
                describe(display, event.getKind(), event.getFromDepartment(), event.getToDepartment()),
                event.getReason(), false, snapshot);
    }

    /**
     * Display number each ledger entry of one instance was recorded under. The number follows
     * the instance into concrete departments only; a return from review moves the instance
     * itself only when its next movement leaves the return target, or it still sits there.
     */
    Map<MovementEvent, String> displaysAtEventTime(ProcessInstance owner, List<MovementEvent> ledger) {
        List<MovementEvent> ordered = new ArrayList<>(ledger);
        ordered.sort(LEDGER_ORDER);
        Map<MovementEvent, String> displays = new IdentityHashMap<>();
        String display = null;
        for (int i = 0; i < ordered.size(); i++) {
            MovementEvent event = ordered.get(i);
            MovementEvent next = i + 1 < ordered.size() ? ordered.get(i + 1) : null;
            Department to = event.getToDepartment();
            boolean moved = switch (event.getKind()) {
                case CREATION, TRANSFER -> true;
                case RETURN_TO_INTAKE -> next != null
                        ? next.getFromDepartment() == to
                        : !owner.isClosed() && owner.getCurrentDepartment() == to;
                default -> false;
            };
            if (moved && to != null && to.isConcrete()) {
                display = normalizer.displayCaseNumber(to, owner.getCaseNumberBase());
            } else if (display == null && event.getFromDepartment() != null && event.getFromDepartment().isConcrete()) {
                // legacy ledger without a creation entry
                display = normalizer.displayCaseNumber(event.getFromDepartment(), owner.getCaseNumberBase());
            }
            displays.put(event, display != null ? display : owner.getCaseNumberDisplay());
        }
        return displays;
    }

    private TimelineEntry synthesizedCreation(ProcessInstance member, List<MovementEvent> ledger) {
        // the first recorded movement tells where a legacy row started
        Department startedIn = ledger.stream()
                .min(LEDGER_ORDER)
                .map(MovementEvent::getFromDepartment)
                .filter(Department::isConcrete)
                .orElse(member.getCurrentDepartment());
        String display = startedIn.isConcrete()
                ? normalizer.displayCaseNumber(startedIn, member.getCaseNumberBase())
                : member.getCaseNumberDisplay();
        return new TimelineEntry(null, member.getId(), display, MovementKind.CREATION,
                Department.INTAKE, startedIn, member.getCreatedBy(), member.getCreatedAt(),
                describe(display, MovementKind.CREATION, Department.INTAKE, startedIn),
                null, true, Map.of());
    }

    private TimelineEntry synthesizedClosing(ProcessInstance member) {
        return new TimelineEntry(null, member.getId(), member.getCaseNumberDisplay(), MovementKind.GLOBAL_FINALIZATION,
                member.getCurrentDepartment(), Department.CLOSED, member.getClosedBy(), member.getClosedAt(),
                describe(member.getCaseNumberDisplay(), MovementKind.GLOBAL_FINALIZATION, member.getCurrentDepartment(),
                        Department.CLOSED),
                null, true, Map.of());
    }

    static String describe(String caseNumberDisplay, MovementKind kind, Department from, Department to) {
        String headline = switch (kind) {
            case CREATION -> "created in " + displayName(to);
            case TRANSFER -> "transferred from " + displayName(from) + " to " + displayName(to);
            case DEPARTMENT_FINALIZATION -> "finalized in " + displayName(from) + ", sent to " + displayName(to);
            case GLOBAL_FINALIZATION -> "closed";
            case RETURN_TO_INTAKE -> "returned from " + displayName(from) + " to " + displayName(to);
            case REASSIGNMENT -> "reassigned in " + displayName(from);
            case EDIT -> "edited in " + displayName(from);
            case STATUS_CHANGE -> "status changed in " + displayName(from);
        };
        return caseNumberDisplay + ": " + headline;
    }

    static String normalizedText(TimelineEntry entry) {
        String text = entry.description() + " " + (entry.reason() == null ? "" : entry.reason());
        return IdentifierNormalizer.canonicalText(text);
    }

    private static String displayName(Department department) {
        return department == null ? "?" : department.getDisplayName();
    }

    private record RankedEntry(int rank, TimelineEntry entry) {}
}
