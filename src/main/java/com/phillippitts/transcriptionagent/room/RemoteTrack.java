package com.phillippitts.transcriptionagent.room;

/** A subscribed track published by a remote participant. */
public interface RemoteTrack {

    String sid();

    TrackKind kind();

    /**
     * Opens a frame stream over this track. Only meaningful for {@link TrackKind#AUDIO} tracks.
     *
     * @return a new stream; each call returns an independent stream
     */
    AudioFrameStream openAudioStream();
}
