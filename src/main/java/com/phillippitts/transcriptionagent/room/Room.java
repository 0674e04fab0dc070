package com.phillippitts.transcriptionagent.room;

import java.util.Collection;

/**
 * A connected real-time room. The agent reads participants and notifications from it and
 * broadcasts to it through the {@link DistributionSink} contract.
 */
public interface Room extends DistributionSink {

    String name();

    /** Snapshot of the participants currently in the room, excluding the agent itself. */
    Collection<RemoteParticipant> remoteParticipants();

    RoomEventStream events();

    /** Leaves the room. Idempotent. */
    void disconnect();
}
