package br.gov.controleprocessos.aggregates.process.events;

import br.gov.controleprocessos.aggregates.process.model.enums.Department;
import br.gov.controleprocessos.aggregates.process.model.enums.MovementKind;
import br.gov.controleprocessos.aggregates.process.services.ProcessFixtures;
import br.gov.controleprocessos.aggregates.process.services.ProcessTrackingService;
import br.gov.controleprocessos.aggregates.process.services.dto.CreateProcessCommand;
import br.gov.controleprocessos.aggregates.process.services.dto.ProcessInstanceView;
import br.gov.controleprocessos.aggregates.process.services.dto.TransitionCommand;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The state machine fires one {@link ProcessMovementRecorded} per ledger entry, and none
 * for rejected or no-op operations.
 */
@QuarkusTest
public class ProcessMovementEventTest {

    @Inject
    ProcessTrackingService service;

    @Inject
    ProcessFixtures fixtures;

    @Inject
    TestEventListener eventListener;

    @BeforeEach
    public void setUp() {
        fixtures.clear();
        eventListener.clear();
    }

    @AfterEach
    public void tearDown() {
        fixtures.clear();
    }

    @Test
    public void testEventEmittedOnCreation() {
        // When
        ProcessInstanceView created = create("123", "GEPLAN");

        // Then
        assertEquals(1, eventListener.getEvents().size());
        ProcessMovementRecorded event = eventListener.getEvents().get(0);
        assertEquals(created.id(), event.processInstanceId());
        assertEquals("GEPLAN-123", event.caseNumberDisplay());
        assertEquals(MovementKind.CREATION, event.kind());
        assertEquals(Department.INTAKE, event.fromDepartment());
        assertEquals(Department.GEPLAN, event.toDepartment());
        assertEquals("ana", event.actor());
        assertNotNull(event.timestamp());
        assertTrue(event.isDepartmentChange());
    }

    @Test
    public void testEventEmittedForEachMovementInChain() {
        // Given
        ProcessInstanceView created = create("123", "GEPLAN");
        eventListener.clear();

        // When: out to review and closed
        service.transition(created.id(), TransitionCommand.builder()
                .kind(MovementKind.TRANSFER).actor("ana").targetDepartment("OUTBOUND_REVIEW").build());
        service.transition(created.id(), TransitionCommand.builder()
                .kind(MovementKind.GLOBAL_FINALIZATION).actor("diretor").build());

        // Then
        assertEquals(2, eventListener.getEvents().size());
        ProcessMovementRecorded transfer = eventListener.getEvents().get(0);
        assertEquals(MovementKind.TRANSFER, transfer.kind());
        assertFalse(transfer.isTerminalTransition());

        ProcessMovementRecorded closing = eventListener.getEvents().get(1);
        assertEquals(Department.OUTBOUND_REVIEW, closing.fromDepartment());
        assertEquals(Department.CLOSED, closing.toDepartment());
        assertTrue(closing.isTerminalTransition());
    }

    @Test
    public void testNoEventForRejectedOrNoOpMovement() {
        // Given
        ProcessInstanceView created = create("123", "DOP");
        create("123", "GEPLAN");
        service.transition(created.id(), TransitionCommand.builder()
                .kind(MovementKind.STATUS_CHANGE).actor("ana").status("EM_ANALISE").build());
        eventListener.clear();

        // When: transfer into an occupied department, then the same status again
        service.transition(created.id(), TransitionCommand.builder()
                .kind(MovementKind.TRANSFER).actor("ana").targetDepartment("GEPLAN").build());
        service.transition(created.id(), TransitionCommand.builder()
                .kind(MovementKind.STATUS_CHANGE).actor("ana").status("em análise").build());

        // Then
        assertEquals(0, eventListener.getEvents().size());
    }

    @Test
    public void testEventRequiresInstanceAndKind() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessMovementRecorded(" ", "GEPLAN-1", MovementKind.EDIT, null, null, "ana", null));
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessMovementRecorded("id", "GEPLAN-1", null, null, null, "ana", null));

        ProcessMovementRecorded edit = new ProcessMovementRecorded("id", "GEPLAN-1", MovementKind.EDIT,
                Department.GEPLAN, Department.GEPLAN, "ana", null);
        assertNotNull(edit.timestamp());
        assertFalse(edit.isDepartmentChange());
    }

    private ProcessInstanceView create(String caseNumber, String department) {
        return service.createInstance(CreateProcessCommand.builder()
                .caseNumber(caseNumber).department(department).actor("ana").build()).primary();
    }

    /**
     * Test CDI bean that observes ProcessMovementRecorded events.
     */
    @Singleton
    public static class TestEventListener {
        private final CopyOnWriteArrayList<ProcessMovementRecorded> events = new CopyOnWriteArrayList<>();

        void onMovementRecorded(@Observes ProcessMovementRecorded event) {
            events.add(event);
        }

        public CopyOnWriteArrayList<ProcessMovementRecorded> getEvents() {
            return events;
        }

        public void clear() {
            events.clear();
        }
    }
}
