package com.phillippitts.transcriptionagent.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the room transcription agent.
 */
@ConfigurationProperties(prefix = "agent")
@Validated
public class AgentProperties {

    /** Room to join; when unset the room connector decides. */
    private String roomName;

    /** Directory holding one transcript file per room and day. */
    @NotBlank(message = "Transcript directory must not be blank")
    private String transcriptDir = "transcripts";

    /** Interval between two status heartbeats. */
    @NotNull
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    /** Data channel topic whose messages are logged as chat. */
    @NotBlank(message = "Chat topic must not be blank")
    private String chatTopic = "lk.chat";

    public String getRoomName() {
        return roomName;
    }

    public void setRoomName(String roomName) {
        this.roomName = roomName;
    }

    public String getTranscriptDir() {
        return transcriptDir;
    }

    public void setTranscriptDir(String transcriptDir) {
        this.transcriptDir = transcriptDir;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public String getChatTopic() {
        return chatTopic;
    }

    public void setChatTopic(String chatTopic) {
        this.chatTopic = chatTopic;
    }
}
