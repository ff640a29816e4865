/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.voicedaemon.exception.VoiceDaemonException}
 * and reports a wire-level {@code error_type} through {@code errorType()}:
 * <ul>
 *   <li>{@link com.phillippitts.voicedaemon.exception.FramingException} - malformed or oversized
 *       frames; closes the connection</li>
 *   <li>{@link com.phillippitts.voicedaemon.exception.ProtocolException} - unknown command, bad
 *       payload, or a command the current phase does not accept</li>
 *   <li>{@link com.phillippitts.voicedaemon.exception.StateConflictException} - the resource is
 *       held by another session's active workflow
 *       ({@link com.phillippitts.voicedaemon.exception.AlreadyRecordingException})</li>
 *   <li>{@link com.phillippitts.voicedaemon.exception.AudioDeviceException} - microphone
 *       unavailable or failing</li>
 *   <li>{@link com.phillippitts.voicedaemon.exception.TranscriptionException} - speech engine
 *       failure</li>
 *   <li>{@link com.phillippitts.voicedaemon.exception.RefinementException} - LLM provider failure
 *       after retries; carries the original text</li>
 *   <li>{@link com.phillippitts.voicedaemon.exception.RuntimeDirectoryException} and
 *       {@link com.phillippitts.voicedaemon.exception.DaemonAlreadyRunningException} - startup
 *       failures of the local transport</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicedaemon.exception;
