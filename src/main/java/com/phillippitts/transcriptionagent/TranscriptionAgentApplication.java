package com.phillippitts.transcriptionagent;

import com.phillippitts.transcriptionagent.config.properties.AgentProperties;
import com.phillippitts.transcriptionagent.config.stt.DeepgramProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AgentProperties.class,
        DeepgramProperties.class
})
@EnableScheduling
public class TranscriptionAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranscriptionAgentApplication.class, args);
    }

}
