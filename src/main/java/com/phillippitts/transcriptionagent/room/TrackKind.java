package com.phillippitts.transcriptionagent.room;

/** Media kind of a published track. */
public enum TrackKind {
    AUDIO,
    VIDEO,
    UNKNOWN
}
