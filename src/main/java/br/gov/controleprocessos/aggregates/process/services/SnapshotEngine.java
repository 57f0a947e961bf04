package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.exceptions.SnapshotIntegrityException;
import br.gov.controleprocessos.aggregates.process.model.AttributeValue;
import br.gov.controleprocessos.aggregates.process.model.DepartmentSnapshot;
import br.gov.controleprocessos.aggregates.process.model.MovementEvent;
import br.gov.controleprocessos.aggregates.process.model.ProcessInstance;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.SnapshotField;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Captures and replays the department-scoped fields of a process at hand-off time.
 * <p>
 * A snapshot is taken on transfer and department finalization, before the department
 * pointer moves, and stored on the movement event as JSON with a SHA-256 checksum.
 * History views read the snapshot instead of the live row once the process has left the
 * department or been closed.
 * </p>
 */
@ApplicationScoped
public class SnapshotEngine {

    @Inject
    ObjectMapper objectMapper;

    public SnapshotEngine() {
    }

    public SnapshotEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Deep copy of the live department-scoped fields.
     */
    public DepartmentSnapshot captureSnapshot(ProcessInstance instance) {
        return new DepartmentSnapshot(
                instance.getCurrentDepartment(),
                instance.getCaseNumberDisplay(),
                instance.getSubject(),
                instance.getStakeholder(),
                instance.getExternalParty(),
                instance.getCoordination(),
                instance.getTeam(),
                instance.getStatus(),
                instance.getAssignedUserRef(),
                instance.getDueDate(),
                instance.getDepartmentDeadline(),
                instance.getNotes(),
                new TreeMap<>(instance.getAttributes()),
                LocalDateTime.now()
        );
    }

    /**
     * Serializes the snapshot onto a movement event that has not been persisted yet.
     */
    public void attach(MovementEvent event, DepartmentSnapshot snapshot) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotIntegrityException("Snapshot of " + snapshot.caseNumberDisplay() + " could not be serialized", e);
        }
        event.attachSnapshot(json, calculateChecksum(json));
    }

    /**
     * Reads back the snapshot stored on an event, verifying its checksum.
     *
     * @throws SnapshotIntegrityException if the payload was altered or no longer parses
     */
    public Optional<DepartmentSnapshot> restore(MovementEvent event) {
        if (!event.hasSnapshot()) {
            return Optional.empty();
        }
        String calculated = calculateChecksum(event.getSnapshotData());
        if (!calculated.equals(event.getSnapshotChecksum())) {
            String message = String.format("Checksum validation failed for snapshot on movement %d. Expected: %s, Got: %s",
                    event.getId(), event.getSnapshotChecksum(), calculated);
            Log.error(message);
            throw new SnapshotIntegrityException(message);
        }
        try {
            return Optional.of(objectMapper.readValue(event.getSnapshotData(), DepartmentSnapshot.class));
        } catch (JsonProcessingException e) {
            throw new SnapshotIntegrityException("Snapshot on movement " + event.getId() + " could not be read", e);
        }
    }

    /**
     * Most relevant snapshot of a department: the latest event by {@code occurredAt} that
     * left the department carrying a snapshot. Ties go to the later ledger entry.
     *
     * @param events ledger entries in any order
     */
    public Optional<DepartmentSnapshot> latestSnapshotFor(List<MovementEvent> events, Department department) {
        return latestSnapshotEvent(events, department).flatMap(this::restore);
    }

    /**
     * Ledger entry carrying the snapshot {@link #latestSnapshotFor} restores.
     */
    public Optional<MovementEvent> latestSnapshotEvent(List<MovementEvent> events, Department department) {
        return events.stream()
                .filter(e -> e.getFromDepartment() == department && e.hasSnapshot())
                .max(Comparator.comparing(MovementEvent::getOccurredAt)
                        .thenComparing(MovementEvent::getId, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    /**
     * Value shown for a field: the snapshot's when the instance is closed or has moved past
     * the snapshot's department, the live one otherwise.
     */
    public String resolveDisplayValue(SnapshotField field, ProcessInstance instance, DepartmentSnapshot snapshot) {
        if (snapshot != null && prefersSnapshot(instance, snapshot)) {
            return snapshotValue(field, snapshot);
        }
        return liveValue(field, instance);
    }

    public boolean prefersSnapshot(ProcessInstance instance, DepartmentSnapshot snapshot) {
        return instance.isClosed() || instance.getCurrentDepartment() != snapshot.department();
    }

    /**
     * Every displayable field plus the attribute bag, resolved for one department.
     */
    public Map<String, String> displayValues(ProcessInstance instance, DepartmentSnapshot snapshot) {
        Map<String, String> values = new LinkedHashMap<>();
        for (SnapshotField field : SnapshotField.values()) {
            values.put(field.getLabel(), resolveDisplayValue(field, instance, snapshot));
        }
        Map<String, AttributeValue> attributes = snapshot != null && prefersSnapshot(instance, snapshot)
                ? snapshot.attributes()
                : instance.getAttributes();
        new TreeMap<>(attributes).forEach((key, value) -> values.put("attributes." + key, value.value()));
        return values;
    }

    /**
     * Display values straight from a snapshot.
     */
    public Map<String, String> snapshotValues(DepartmentSnapshot snapshot) {
        Map<String, String> values = new LinkedHashMap<>();
        for (SnapshotField field : SnapshotField.values()) {
            values.put(field.getLabel(), snapshotValue(field, snapshot));
        }
        new TreeMap<>(snapshot.attributes()).forEach((key, value) -> values.put("attributes." + key, value.value()));
        return values;
    }

    String calculateChecksum(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(data.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new SnapshotIntegrityException("SHA-256 algorithm not available", e);
        }
    }

    private static String snapshotValue(SnapshotField field, DepartmentSnapshot snapshot) {
        return switch (field) {
            case SUBJECT -> snapshot.subject();
            case STAKEHOLDER -> snapshot.stakeholder();
            case EXTERNAL_PARTY -> snapshot.externalParty();
            case COORDINATION -> snapshot.coordination();
            case TEAM -> snapshot.team();
            case STATUS -> snapshot.status();
            case ASSIGNEE -> snapshot.assignedUserRef();
            case DUE_DATE -> Objects.toString(snapshot.dueDate(), null);
            case DEPARTMENT_DEADLINE -> Objects.toString(snapshot.departmentDeadline(), null);
            case NOTES -> snapshot.notes();
        };
    }

    private static String liveValue(SnapshotField field, ProcessInstance instance) {
        return switch (field) {
            case SUBJECT -> instance.getSubject();
            case STAKEHOLDER -> instance.getStakeholder();
            case EXTERNAL_PARTY -> instance.getExternalParty();
            case COORDINATION -> instance.getCoordination();
            case TEAM -> instance.getTeam();
            case STATUS -> instance.getStatus();
            case ASSIGNEE -> instance.getAssignedUserRef();
            case DUE_DATE -> Objects.toString(instance.getDueDate(), null);
            case DEPARTMENT_DEADLINE -> Objects.toString(instance.getDepartmentDeadline(), null);
            case NOTES -> instance.getNotes();
        };
    }
}
