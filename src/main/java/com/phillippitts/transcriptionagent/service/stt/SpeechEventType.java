package com.phillippitts.transcriptionagent.service.stt;

/** Kinds of events produced by a speech conversation. */
public enum SpeechEventType {
    /** Provisional text for the utterance in progress; later events may revise it. */
    INTERIM_TRANSCRIPT,
    /** Confirmed text for a completed utterance. */
    FINAL_TRANSCRIPT,
    /** The speaker stopped talking. Carries no text. */
    END_OF_SPEECH
}
