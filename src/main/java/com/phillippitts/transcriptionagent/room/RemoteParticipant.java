package com.phillippitts.transcriptionagent.room;

import java.util.Collection;

/** Another participant of the room. */
public interface RemoteParticipant {

    /** Server-assigned identifier, stable for the participant's connection. */
    String sid();

    /** Human-readable label used in transcripts. */
    String identity();

    Collection<TrackPublication> trackPublications();
}
