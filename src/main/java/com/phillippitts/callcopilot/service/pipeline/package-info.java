/**
 * Streaming transcription pipelines, one per active call, over a shared connection pool.
 */
package com.phillippitts.callcopilot.service.pipeline;
