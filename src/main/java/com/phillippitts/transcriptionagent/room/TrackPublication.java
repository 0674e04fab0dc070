package com.phillippitts.transcriptionagent.room;

import java.util.Optional;

/** A track announced by a participant; the track itself is present only once subscribed. */
public interface TrackPublication {

    String sid();

    TrackKind kind();

    Optional<RemoteTrack> track();
}
