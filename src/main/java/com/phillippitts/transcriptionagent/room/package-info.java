/**
 * Port to the real-time room transport.
 *
 * <p>The transcription pipeline only depends on these interfaces: participants and their track
 * publications for the startup scan, {@link com.phillippitts.transcriptionagent.room.AudioFrameStream}
 * for audio input, {@link com.phillippitts.transcriptionagent.room.DistributionSink} for broadcast, and
 * {@link com.phillippitts.transcriptionagent.room.RoomEventStream} for notifications. A concrete
 * transport is plugged in through a {@link com.phillippitts.transcriptionagent.room.RoomConnector} bean.
 */
package com.phillippitts.transcriptionagent.room;
