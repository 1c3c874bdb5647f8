/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voiceorders.exception.VoiceOrdersException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voiceorders.exception.BackendCallException} - A speech, language
 *       model or synthesis backend call failed; the session apologises and continues</li>
 *   <li>{@link com.phillippitts.voiceorders.exception.OrderSnapshotException} - The static order
 *       snapshot is missing or malformed; surfaced through health checks</li>
 *   <li>{@link com.phillippitts.voiceorders.exception.PipelineTerminatedException} - A pipeline stage
 *       failed and the session was torn down</li>
 *   <li>{@link com.phillippitts.voiceorders.exception.MissingCredentialException} - A required backend
 *       credential is absent; voice sessions are refused</li>
 * </ul>
 *
 * @see com.phillippitts.voiceorders.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voiceorders.exception;
