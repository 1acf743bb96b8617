/**
 * Command orchestration: the single-active-command state machine, the phase executor and the
 * preemptive safe-state path.
 *
 * <p>Threading model:
 * <ul>
 *   <li>{@link com.phillippitts.petpal.service.command.CommandStateMachine} serializes every
 *       transition through one lock</li>
 *   <li>{@link com.phillippitts.petpal.service.command.CommandExecutor} runs one command per pool
 *       thread and polls adapters on a fixed cadence</li>
 *   <li>{@link com.phillippitts.petpal.service.command.PreemptionController} runs the safe-state
 *       motion on a separate pool thread, so a hung executor never delays it</li>
 * </ul>
 */
package com.phillippitts.petpal.service.command;
