package br.gov.controleprocessos.aggregates.process.services;

import br.gov.controleprocessos.aggregates.process.exceptions.ProcessNotFoundException;
import br.gov.controleprocessos.aggregates.process.exceptions.ProcessRejectedException.ErrorType;
import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;
import br.gov.controleprocessos.aggregates.process.model.enums.RejectionReason;
import br.gov.controleprocessos.aggregates.process.services.dto.*;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end lifecycle of process instances against the in-memory database: creation,
 * grouping, hand-offs, closing and the history built from them.
 */
@QuarkusTest
@DisplayName("Process lifecycle")
class ProcessLifecycleTest {

    private static final String ACTOR = "ana";

    @Inject
    ProcessTrackingService service;

    @Inject
    ProcessFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures.clear();
        fixtures.grant("maria", Department.GEPLAN, "COPLAN", "Equipe A");
        fixtures.grant("joao", Department.DOP, null, null);
        fixtures.grant("pedro", Department.GEPLAN, "COORDENACAO GERAL", null);
    }

    @AfterEach
    void tearDown() {
        fixtures.clear();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static ProcessFields readyFields() {
        return ProcessFields.builder()
                .subject("Aquisição de notebooks")
                .stakeholder("Secretaria de Educação")
                .coordination("COPLAN")
                .team("Equipe A")
                .status("EM_ANALISE")
                .assignedUserRef("maria")
                .notes("Prioridade alta")
                .build();
    }

    private ProcessInstanceView create(String caseNumber, String department, ProcessFields fields) {
        TransitionResult result = service.createInstance(CreateProcessCommand.builder()
                .caseNumber(caseNumber)
                .department(department)
                .actor(ACTOR)
                .fields(fields)
                .build());
        assertTrue(result.accepted(), () -> "creation rejected: " + result.rejection());
        return result.primary();
    }

    private ProcessInstanceView create(String caseNumber, String department) {
        return create(caseNumber, department, ProcessFields.empty());
    }

    private TransitionResult apply(String instanceId, TransitionCommand command) {
        return service.transition(instanceId, command);
    }

    private TransitionResult transfer(String instanceId, String target) {
        return apply(instanceId, TransitionCommand.builder()
                .kind(MovementKind.TRANSFER).actor(ACTOR).targetDepartment(target).build());
    }

    private TransitionResult finalizeDepartment(String instanceId, String next) {
        return apply(instanceId, TransitionCommand.builder()
                .kind(MovementKind.DEPARTMENT_FINALIZATION).actor(ACTOR).nextDepartment(next).build());
    }

    private TransitionResult closeAll(String instanceId) {
        return apply(instanceId, TransitionCommand.builder()
                .kind(MovementKind.GLOBAL_FINALIZATION).actor("diretor").build());
    }

    private TransitionResult changeStatus(String instanceId, String status) {
        return apply(instanceId, TransitionCommand.builder()
                .kind(MovementKind.STATUS_CHANGE).actor(ACTOR).status(status).build());
    }

    private ProcessInstanceView reload(String instanceId) {
        return service.findInstance(instanceId).orElseThrow();
    }

    private static void assertRejected(TransitionResult result, ErrorType errorType, RejectionReason reason) {
        assertFalse(result.accepted(), "expected a rejection");
        assertEquals(errorType, result.rejection().errorType());
        assertEquals(reason, result.rejection().reason());
    }

    // ========================================================================
    // Creation
    // ========================================================================

    @Nested
    @DisplayName("creation")
    class Creation {

        @Test
        @DisplayName("opens the instance with a minted key and a creation event")
        void createsInstance() {
            ProcessInstanceView created = create("geplan-123", "Planejamento", readyFields());

            assertEquals("GEPLAN-123", created.caseNumberDisplay());
            assertEquals("123", created.caseNumberBase());
            assertEquals(Department.GEPLAN, created.currentDepartment());
            assertTrue(created.relationalKey().startsWith("123#"));
            assertEquals("EM_ANALISE", created.status());
            assertEquals("maria", created.assignedUserRef());
            assertEquals(List.of(MovementKind.CREATION), fixtures.eventKinds(created.id()));
        }

        @Test
        @DisplayName("intake synonym and blank department go to the default department")
        void defaultDepartment() {
            assertEquals(Department.GEPLAN, create("500", "Protocolo").currentDepartment());
            assertEquals(Department.GEPLAN, create("501", null).currentDepartment());
        }

        @Test
        @DisplayName("a second active instance of the group in the same department is rejected without writes")
        void duplicateCreationRejected() {
            create("123", "GEPLAN");
            long instances = fixtures.countInstances();
            long events = fixtures.countEvents();

            TransitionResult result = service.createInstance(CreateProcessCommand.builder()
                    .caseNumber("GEPLAN-123").department("GEPLAN").actor(ACTOR).build());

            assertRejected(result, ErrorType.CONFLICT, RejectionReason.DUPLICATE_ACTIVE_DEPARTMENT);
            assertEquals(List.of(Department.GEPLAN), result.rejection().conflictingDepartments());
            assertEquals(instances, fixtures.countInstances());
            assertEquals(events, fixtures.countEvents());
        }

        @Test
        @DisplayName("unknown department, status or case number are validation errors")
        void validation() {
            assertRejected(service.createInstance(CreateProcessCommand.builder()
                            .caseNumber("123").department("Recursos Humanos").actor(ACTOR).build()),
                    ErrorType.VALIDATION, RejectionReason.INVALID_DEPARTMENT);
            assertRejected(service.createInstance(CreateProcessCommand.builder()
                            .caseNumber("123").department("DOP").actor(ACTOR)
                            .fields(ProcessFields.builder().status("PAGO").build()).build()),
                    ErrorType.VALIDATION, RejectionReason.INVALID_STATUS);
            assertRejected(service.createInstance(CreateProcessCommand.builder()
                            .caseNumber(" ").department("DOP").actor(ACTOR).build()),
                    ErrorType.VALIDATION, RejectionReason.INVALID_CASE_NUMBER);
            assertEquals(0, fixtures.countInstances());
        }
    }

    // ========================================================================
    // Grouping
    // ========================================================================

    @Nested
    @DisplayName("grouping")
    class Grouping {

        @Test
        @DisplayName("inspect is idempotent without intervening writes")
        void inspectIsIdempotent() {
            create("123", "GEPLAN", readyFields());
            create("123", "DOP");

            GroupInspection first = service.inspect("123");
            GroupInspection second = service.inspect("DOP-123");

            assertEquals(first, second);
            assertEquals(2, first.analysis().activeCount());
            assertNotNull(first.prefill());
        }

        @Test
        @DisplayName("an explicit key links a new instance to the prior cycle")
        void groupingContinuity() {
            // Given: A finalized to review
            ProcessInstanceView a = create("123", "GEPLAN", readyFields());
            assertTrue(finalizeDepartment(a.id(), null).accepted());

            // When: B is created with A's key
            TransitionResult result = service.createInstance(CreateProcessCommand.builder()
                    .caseNumber("123").department("DOP").relationalKey(a.relationalKey()).actor(ACTOR).build());

            // Then
            assertTrue(result.accepted());
            ProcessInstanceView b = result.primary();
            GroupAnalysis analysis = service.inspect("123").analysis();
            assertEquals(2, analysis.activeCount());
            assertEquals(0, analysis.finalizedCount());
            assertEquals(a.relationalKey(), analysis.relationalKey());

            Set<Long> timelineIds = service.timeline(b.id()).stream()
                    .map(TimelineEntry::eventId)
                    .collect(Collectors.toSet());
            assertTrue(timelineIds.containsAll(fixtures.eventIds(a.id())));
        }

        @Test
        @DisplayName("a number with only closed history starts an isolated cycle")
        void newCycleIsolation() {
            ProcessInstanceView old = create("123", "GEPLAN", readyFields());
            finalizeDepartment(old.id(), null);
            assertTrue(closeAll(old.id()).accepted());

            ProcessInstanceView fresh = create("123", "DOP");

            assertNotEquals(old.relationalKey(), fresh.relationalKey());
            List<TimelineEntry> timeline = service.timeline(fresh.id());
            assertFalse(timeline.isEmpty());
            assertTrue(timeline.stream().allMatch(e -> e.processInstanceId().equals(fresh.id())));
        }

        @Test
        @DisplayName("keyless legacy rows only group with each other")
        void legacyBucket() {
            String legacyId = fixtures.legacyInstance("900", Department.DOP);

            ProcessInstanceView joined = create("900", "GEPLAN");

            assertNull(joined.relationalKey());
            List<String> members = service.timeline(joined.id()).stream()
                    .map(TimelineEntry::processInstanceId)
                    .distinct()
                    .toList();
            assertTrue(members.contains(legacyId));
        }
    }

    // ========================================================================
    // Transfer
    // ========================================================================

    @Nested
    @DisplayName("transfer")
    class Transfer {

        @Test
        @DisplayName("into a department holding an active sibling is rejected with zero new rows")
        void rejectedDuplicate() {
            create("123", "GEPLAN");
            ProcessInstanceView dop = create("123", "DOP");
            long instances = fixtures.countInstances();
            long events = fixtures.countEvents();

            TransitionResult result = transfer(dop.id(), "GEPLAN");

            assertRejected(result, ErrorType.CONFLICT, RejectionReason.DUPLICATE_ACTIVE_DEPARTMENT);
            assertEquals(List.of(Department.GEPLAN), result.rejection().conflictingDepartments());
            assertEquals(instances, fixtures.countInstances());
            assertEquals(events, fixtures.countEvents());
            assertEquals(Department.DOP, reload(dop.id()).currentDepartment());
        }

        @Test
        @DisplayName("into a new department clears status and assignee only")
        void firstVisit() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());

            ProcessInstanceView moved = transfer(created.id(), "DOP").primary();

            assertEquals(Department.DOP, moved.currentDepartment());
            assertEquals("DOP-123", moved.caseNumberDisplay());
            assertNull(moved.status());
            assertNull(moved.assignedUserRef());
            assertEquals("Equipe A", moved.team());
            assertEquals("Aquisição de notebooks", moved.subject());
        }

        @Test
        @DisplayName("back into a department with group history starts a fresh cycle there")
        void revisitResetsFields() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());
            transfer(created.id(), "DOP");

            TransitionResult result = transfer(created.id(), "GEPLAN");

            ProcessInstanceView moved = result.primary();
            assertEquals(Department.GEPLAN, moved.currentDepartment());
            assertNull(moved.team());
            assertNull(moved.coordination());
            assertNull(moved.notes());
            assertEquals("Aquisição de notebooks", moved.subject());
            assertTrue(fixtures.eventReasons(created.id(), MovementKind.TRANSFER).get(1).contains("new cycle"));
        }

        @Test
        @DisplayName("to review keeps every field; the snapshot keeps the leg's values after later edits")
        void snapshotFidelity() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields().toBuilder().status("UNDER_REVIEW").build());
            transfer(created.id(), "OUTBOUND_REVIEW");
            assertEquals("UNDER_REVIEW", reload(created.id()).status());

            assertTrue(changeStatus(created.id(), "REVISADO").accepted());

            TimelineEntry handOff = service.timeline(created.id()).stream()
                    .filter(e -> e.kind() == MovementKind.TRANSFER)
                    .findFirst()
                    .orElseThrow();
            assertEquals(Department.GEPLAN, handOff.fromDepartment());
            assertEquals("UNDER_REVIEW", handOff.snapshot().get("status"));
            assertEquals("REVISADO", reload(created.id()).status());

            DepartmentLeg geplanLeg = service.departmentLegs(created.id()).stream()
                    .filter(l -> l.department() == Department.GEPLAN)
                    .findFirst()
                    .orElseThrow();
            assertTrue(geplanLeg.fromSnapshot());
            assertEquals("UNDER_REVIEW", geplanLeg.values().get("status"));
        }
    }

    // ========================================================================
    // Department finalization
    // ========================================================================

    @Nested
    @DisplayName("department finalization")
    class DepartmentFinalization {

        @Test
        @DisplayName("requires coordination, team, assignee and status")
        void mandatoryFields() {
            ProcessInstanceView created = create("123", "GEPLAN",
                    ProcessFields.builder().coordination("COPLAN").build());

            TransitionResult result = finalizeDepartment(created.id(), null);

            assertRejected(result, ErrorType.VALIDATION, RejectionReason.MISSING_MANDATORY_FIELD);
            assertTrue(result.rejection().message().contains("team"));
            assertTrue(result.rejection().message().contains("assignedUserRef"));
            assertFalse(result.rejection().message().contains("coordination"));
            assertEquals(Department.GEPLAN, reload(created.id()).currentDepartment());
        }

        @Test
        @DisplayName("routes to review and opens the next department as a sibling")
        void spawnsSibling() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());

            TransitionResult result = finalizeDepartment(created.id(), "Financeiro");

            assertTrue(result.accepted());
            assertEquals(2, result.instances().size());
            assertTrue(result.warnings().isEmpty());
            assertEquals(Department.OUTBOUND_REVIEW, result.instances().get(0).currentDepartment());
            ProcessInstanceView sibling = result.instances().get(1);
            assertEquals(Department.GEFIN, sibling.currentDepartment());
            assertEquals(created.relationalKey(), sibling.relationalKey());
            assertEquals("Aquisição de notebooks", sibling.subject());
            assertNull(sibling.assignedUserRef());
        }

        @Test
        @DisplayName("downstream department with group history degrades to a warning")
        void siblingConflictIsWarning() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());
            create("123", "DOP");
            long instances = fixtures.countInstances();

            TransitionResult result = finalizeDepartment(created.id(), "DOP");

            assertTrue(result.accepted());
            assertEquals(1, result.instances().size());
            assertEquals(1, result.warnings().size());
            assertEquals(Department.OUTBOUND_REVIEW, reload(created.id()).currentDepartment());
            assertEquals(instances, fixtures.countInstances());
        }

        @Test
        @DisplayName("is only allowed from a department")
        void onlyFromDepartment() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());
            finalizeDepartment(created.id(), null);

            assertRejected(finalizeDepartment(created.id(), null),
                    ErrorType.ILLEGAL_TRANSITION, RejectionReason.ILLEGAL_TRANSITION);
        }
    }

    // ========================================================================
    // Global finalization
    // ========================================================================

    @Nested
    @DisplayName("global finalization")
    class GlobalFinalization {

        @Test
        @DisplayName("closes every open sibling in review with the same timestamp")
        void batchClose() {
            ProcessInstanceView a = create("123", "GEPLAN");
            ProcessInstanceView b = create("123", "DOP");
            ProcessInstanceView c = create("123", "GEFIN");
            ProcessInstanceView elsewhere = create("123", "ASJUR");
            for (ProcessInstanceView view : List.of(a, b, c)) {
                assertTrue(transfer(view.id(), "OUTBOUND_REVIEW").accepted());
            }

            TransitionResult result = closeAll(b.id());

            assertTrue(result.accepted());
            assertEquals(3, result.instances().size());
            List<ProcessInstanceView> closed = List.of(reload(a.id()), reload(b.id()), reload(c.id()));
            assertTrue(closed.stream().allMatch(ProcessInstanceView::closed));
            assertEquals(1, closed.stream().map(ProcessInstanceView::closedAt).distinct().count());
            assertEquals("diretor", closed.get(0).closedBy());
            assertFalse(reload(elsewhere.id()).closed());
            for (ProcessInstanceView view : List.of(a, b, c)) {
                assertTrue(fixtures.eventKinds(view.id()).contains(MovementKind.GLOBAL_FINALIZATION));
            }
        }

        @Test
        @DisplayName("is rejected outside review")
        void outsideReview() {
            ProcessInstanceView created = create("123", "GEPLAN");

            assertRejected(closeAll(created.id()), ErrorType.ILLEGAL_TRANSITION, RejectionReason.ILLEGAL_TRANSITION);
        }

        @Test
        @DisplayName("closed instances accept no further transition")
        void alreadyClosed() {
            ProcessInstanceView created = create("123", "GEPLAN");
            transfer(created.id(), "OUTBOUND_REVIEW");
            closeAll(created.id());

            assertRejected(changeStatus(created.id(), "REVISADO"), ErrorType.ILLEGAL_TRANSITION, RejectionReason.ALREADY_CLOSED);
            assertRejected(closeAll(created.id()), ErrorType.ILLEGAL_TRANSITION, RejectionReason.ALREADY_CLOSED);
        }
    }

    // ========================================================================
    // Return to intake
    // ========================================================================

    @Nested
    @DisplayName("return to intake")
    class ReturnToIntake {

        @Test
        @DisplayName("goes back in place to the sending department, flagged for re-triage")
        void returnsInPlace() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());
            finalizeDepartment(created.id(), null);

            TransitionResult result = apply(created.id(), TransitionCommand.builder()
                    .kind(MovementKind.RETURN_TO_INTAKE).actor(ACTOR).reason("Falta documento").build());

            assertTrue(result.accepted());
            ProcessInstanceView returned = result.primary();
            assertEquals(created.id(), returned.id());
            assertEquals(Department.GEPLAN, returned.currentDepartment());
            assertTrue(returned.returnedForTriage());
            assertEquals(0L, service.occupancyByDepartment().get(Department.GEPLAN));

            changeStatus(created.id(), "AGUARDANDO_DOCUMENTOS");

            assertFalse(reload(created.id()).returnedForTriage());
            assertEquals(1L, service.occupancyByDepartment().get(Department.GEPLAN));
        }

        @Test
        @DisplayName("to another department spawns a new instance and leaves the original in review")
        void spawnsElsewhere() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());
            finalizeDepartment(created.id(), null);

            TransitionResult result = apply(created.id(), TransitionCommand.builder()
                    .kind(MovementKind.RETURN_TO_INTAKE).actor(ACTOR).targetDepartment("Jurídico").build());

            assertTrue(result.accepted());
            assertEquals(2, result.instances().size());
            ProcessInstanceView spawned = result.instances().get(1);
            assertEquals(Department.ASJUR, spawned.currentDepartment());
            assertTrue(spawned.returnedForTriage());
            assertEquals(created.relationalKey(), spawned.relationalKey());
            assertEquals(Department.OUTBOUND_REVIEW, reload(created.id()).currentDepartment());
        }

        @Test
        @DisplayName("obeys the duplicate-active guard")
        void guarded() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());
            finalizeDepartment(created.id(), null);
            create("123", "GEPLAN");

            TransitionResult result = apply(created.id(), TransitionCommand.builder()
                    .kind(MovementKind.RETURN_TO_INTAKE).actor(ACTOR).build());

            assertRejected(result, ErrorType.CONFLICT, RejectionReason.DUPLICATE_ACTIVE_DEPARTMENT);
        }
    }

    // ========================================================================
    // Reassignment, edit and status change
    // ========================================================================

    @Nested
    @DisplayName("reassignment")
    class Reassignment {

        @Test
        @DisplayName("requires a grant for the department and the instance's scope")
        void guard() {
            ProcessInstanceView created = create("123", "GEPLAN",
                    ProcessFields.builder().coordination("COPLAN").build());

            assertRejected(apply(created.id(), TransitionCommand.builder()
                            .kind(MovementKind.REASSIGNMENT).actor(ACTOR).assignee("joao").build()),
                    ErrorType.VALIDATION, RejectionReason.UNAUTHORIZED_ASSIGNEE);
            assertRejected(apply(created.id(), TransitionCommand.builder()
                            .kind(MovementKind.REASSIGNMENT).actor(ACTOR).assignee("pedro").build()),
                    ErrorType.VALIDATION, RejectionReason.UNAUTHORIZED_ASSIGNEE);

            TransitionResult accepted = apply(created.id(), TransitionCommand.builder()
                    .kind(MovementKind.REASSIGNMENT).actor(ACTOR).assignee("maria").build());

            assertTrue(accepted.accepted());
            assertEquals("maria", accepted.primary().assignedUserRef());
            assertEquals(List.of("assignedUserRef:  -> maria"),
                    fixtures.eventReasons(created.id(), MovementKind.REASSIGNMENT));
        }
    }

    @Nested
    @DisplayName("edit")
    class Edit {

        @Test
        @DisplayName("records a diff and splits the status change into its own event")
        void diffAndStatusSplit() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());

            TransitionResult result = apply(created.id(), TransitionCommand.builder()
                    .kind(MovementKind.EDIT).actor(ACTOR)
                    .changes(ProcessFields.builder()
                            .subject("Aquisição de monitores")
                            .notes("")
                            .dueDate("31/05/2024")
                            .status("Concluido")
                            .build())
                    .build());

            assertTrue(result.accepted());
            assertEquals(List.of(MovementKind.CREATION, MovementKind.EDIT, MovementKind.STATUS_CHANGE),
                    fixtures.eventKinds(created.id()));
            assertEquals(List.of("subject: Aquisição de notebooks -> Aquisição de monitores; notes: Prioridade alta -> ; dueDate:  -> 2024-05-31"),
                    fixtures.eventReasons(created.id(), MovementKind.EDIT));
            assertEquals(List.of("status: EM_ANALISE -> CONCLUIDO"),
                    fixtures.eventReasons(created.id(), MovementKind.STATUS_CHANGE));
            assertNull(reload(created.id()).notes());
        }

        @Test
        @DisplayName("without actual changes records nothing")
        void noOp() {
            ProcessInstanceView created = create("123", "GEPLAN", readyFields());

            apply(created.id(), TransitionCommand.builder()
                    .kind(MovementKind.EDIT).actor(ACTOR)
                    .changes(ProcessFields.builder().subject("Aquisição de notebooks").status("em análise").build())
                    .build());

            assertEquals(List.of(MovementKind.CREATION), fixtures.eventKinds(created.id()));
        }

        @Test
        @DisplayName("propagates descriptive changes to open siblings on request")
        void propagates() {
            ProcessInstanceView a = create("123", "GEPLAN", readyFields());
            ProcessInstanceView b = create("123", "DOP");

            TransitionResult result = apply(a.id(), TransitionCommand.builder()
                    .kind(MovementKind.EDIT).actor(ACTOR).propagate(true)
                    .changes(ProcessFields.builder().stakeholder("Prefeitura").team("Equipe B").build())
                    .build());

            assertEquals(2, result.instances().size());
            ProcessInstanceView sibling = reload(b.id());
            assertEquals("Prefeitura", sibling.stakeholder());
            assertNull(sibling.team());
            assertTrue(fixtures.eventReasons(b.id(), MovementKind.EDIT).get(0).contains("propagated from GEPLAN-123"));
        }
    }

    @Nested
    @DisplayName("status change")
    class StatusChange {

        @Test
        @DisplayName("validates against the department's statuses and skips no-ops")
        void statusChange() {
            ProcessInstanceView created = create("123", "DOP");

            assertRejected(changeStatus(created.id(), "PAGO"), ErrorType.VALIDATION, RejectionReason.INVALID_STATUS);
            assertTrue(changeStatus(created.id(), "Empenho solicitado").accepted());
            assertTrue(changeStatus(created.id(), "EMPENHO_SOLICITADO").accepted());

            assertEquals(List.of(MovementKind.CREATION, MovementKind.STATUS_CHANGE), fixtures.eventKinds(created.id()));
        }

        @Test
        @DisplayName("unknown instance is reported as not found")
        void notFound() {
            assertRejected(changeStatus("missing", "EM_ANALISE"), ErrorType.NOT_FOUND, RejectionReason.INSTANCE_NOT_FOUND);
        }
    }

    // ========================================================================
    // Deletion and history
    // ========================================================================

    @Test
    @DisplayName("deleting an instance removes its ledger")
    void deleteCascades() {
        ProcessInstanceView created = create("123", "GEPLAN", readyFields());
        changeStatus(created.id(), "CONCLUIDO");

        service.deleteInstance(created.id());

        assertTrue(service.findInstance(created.id()).isEmpty());
        assertEquals(0, fixtures.countEvents());
        assertThrows(ProcessNotFoundException.class, () -> service.timeline(created.id()));
        assertThrows(ProcessNotFoundException.class, () -> service.deleteInstance(created.id()));
    }

    @Test
    @DisplayName("legacy rows without ledger get a synthesized creation entry")
    void timelineSynthesis() {
        String legacyId = fixtures.legacyInstance("700", Department.GECOMP);

        List<TimelineEntry> timeline = service.timeline(legacyId);

        assertEquals(1, timeline.size());
        assertTrue(timeline.get(0).synthetic());
        assertEquals(Department.GECOMP, timeline.get(0).toDepartment());
    }

    @Test
    @DisplayName("occupancy counts active instances per department")
    void occupancy() {
        create("123", "GEPLAN");
        create("123", "DOP");
        create("456", "DOP");

        Map<Department, Long> occupancy = service.occupancyByDepartment();

        assertEquals(1L, occupancy.get(Department.GEPLAN));
        assertEquals(2L, occupancy.get(Department.DOP));
        assertEquals(0L, occupancy.get(Department.ASJUR));
    }
}
