/**
 * Deepgram live-streaming speech engine.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.transcriptionagent.service.stt.deepgram.DeepgramSpeechEngine} - Spring
 *       component opening one WebSocket conversation per track</li>
 *   <li>{@code DeepgramSpeechStream} - WebSocket listener bridging frames in and events out</li>
 *   <li>{@code DeepgramJsonParser} - maps {@code Results}/{@code UtteranceEnd}/{@code Error} messages</li>
 * </ul>
 *
 * <p>Configuration (application.properties):
 * <pre>
 * stt.deepgram.api-key=${DEEPGRAM_API_KEY:}
 * stt.deepgram.model=nova-2
 * stt.deepgram.language=en-US
 * stt.deepgram.sample-rate=48000
 * </pre>
 */
package com.phillippitts.transcriptionagent.service.stt.deepgram;
