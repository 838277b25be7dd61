/**
 * Inbound adapters: the carrier WebSocket endpoint and the small REST status surface.
 *
 * <p>Nothing here holds call state; everything is delegated to
 * {@link com.phillippitts.callcopilot.service.orchestration.SessionOrchestrator} and
 * {@link com.phillippitts.callcopilot.service.session.SessionRegistry}.
 */
package com.phillippitts.callcopilot.presentation;
