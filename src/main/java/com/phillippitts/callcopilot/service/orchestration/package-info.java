/**
 * Per-call state machine: carrier frames in, pipeline and fan-out calls out.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@link com.phillippitts.callcopilot.service.orchestration.SessionOrchestrator} -
 *       entry point for frames and disconnects</li>
 *   <li>{@link com.phillippitts.callcopilot.service.orchestration.CarrierConnection} -
 *       transport-neutral view of one carrier socket</li>
 * </ul>
 */
package com.phillippitts.callcopilot.service.orchestration;
