package com.phillippitts.transcriptionagent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans of the agent.
 */
@Configuration
public class AgentConfig {

    /**
     * Wall clock used for transcript timestamps and the per-day transcript file.
     * Local time, matching the ISO-8601 local date-times written to the room and to disk.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
