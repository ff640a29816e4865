/**
 * Immutable domain types shared by the daemon, its workflows and its clients.
 *
 * <ul>
 *   <li>{@link com.phillippitts.voicedaemon.domain.DaemonPhase} and
 *       {@link com.phillippitts.voicedaemon.domain.DaemonSnapshot} - process-wide state</li>
 *   <li>{@link com.phillippitts.voicedaemon.domain.Command},
 *       {@link com.phillippitts.voicedaemon.domain.CommandKind} and
 *       {@link com.phillippitts.voicedaemon.domain.CommandPayload} - typed requests</li>
 *   <li>{@link com.phillippitts.voicedaemon.domain.DaemonResponse} - responses and state events</li>
 *   <li>{@link com.phillippitts.voicedaemon.domain.AudioBuffer},
 *       {@link com.phillippitts.voicedaemon.domain.SpeechSpan} and
 *       {@link com.phillippitts.voicedaemon.domain.TranscriptionResult} - transcription data</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicedaemon.domain;
