package com.phillippitts.transcriptionagent.service.transcript;

import com.phillippitts.transcriptionagent.domain.TranscriptRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Durable, append-only storage of final transcripts, partitioned by room and calendar day.
 *
 * <p>Implementations must be safe for concurrent {@link #append(TranscriptRecord)} calls from
 * many track sessions, including calls targeting the same partition: no append may be lost.
 */
public interface TranscriptStore {

    /**
     * Appends a record to the partition of its room and the current day.
     *
     * @param record final transcript to persist
     * @throws com.phillippitts.transcriptionagent.exception.TranscriptPersistenceException if the
     *         partition cannot be written
     */
    void append(TranscriptRecord record);

    /**
     * Reads one partition in arrival order.
     *
     * @return stored records, or an empty list if the partition is absent or unreadable
     */
    List<TranscriptRecord> read(String roomName, LocalDate date);
}
