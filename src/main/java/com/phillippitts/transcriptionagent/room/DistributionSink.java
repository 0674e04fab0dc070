package com.phillippitts.transcriptionagent.room;

/**
 * Outbound data channel that broadcasts a payload to every participant of the room.
 */
public interface DistributionSink {

    /**
     * Publishes a payload to the room.
     *
     * @param payload  serialized message
     * @param reliable request ordered, retransmitted delivery from the transport
     * @throws RuntimeException if the transport rejects the payload
     */
    void publish(byte[] payload, boolean reliable);
}
