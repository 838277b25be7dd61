/**
 * Logging helpers: request-scoped MDC for the HTTP surface.
 */
package com.phillippitts.callcopilot.config.logging;
