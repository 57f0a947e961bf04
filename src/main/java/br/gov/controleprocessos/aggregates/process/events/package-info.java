/**
 * Process movement events.
 *
 * <h2>Overview</h2>
 * {@link br.gov.controleprocessos.aggregates.process.events.ProcessMovementRecorded} is fired by
 * {@link br.gov.controleprocessos.aggregates.process.services.MovementStateMachine} once for every
 * movement event it appends to the ledger, including one per instance closed by a batch global
 * finalization.
 *
 * <h2>Observing Events</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class ClosingListener {
 *
 *     void onMovement(@Observes ProcessMovementRecorded event) {
 *         if (event.isTerminalTransition()) {
 *             // react to closed processes
 *         }
 *     }
 * }
 * }</pre>
 *
 * <h2>Implementation Notes</h2>
 * <ul>
 *   <li>Events are immutable Java records</li>
 *   <li>Events are fired synchronously within the same transaction</li>
 *   <li>Observer order is not guaranteed unless you use @Priority</li>
 * </ul>
 */
package br.gov.controleprocessos.aggregates.process.events;
