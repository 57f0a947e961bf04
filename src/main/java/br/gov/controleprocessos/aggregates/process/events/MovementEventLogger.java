package br.gov.controleprocessos.aggregates.process.events;

import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

/**
 * Audit log of every recorded process movement.
 */
@ApplicationScoped
public class MovementEventLogger {

    void onMovementRecorded(@Observes ProcessMovementRecorded event) {
        Log.infof("EVENT: Process %s (%s) %s: %s -> %s by %s at %s",
                event.processInstanceId(),
                event.caseNumberDisplay(),
                event.kind(),
                event.fromDepartment(),
                event.toDepartment(),
                event.actor(),
                event.timestamp());

        if (event.isTerminalTransition()) {
            Log.infof("Process %s reached terminal state", event.caseNumberDisplay());
        }
    }
}
