package com.phillippitts.transcriptionagent.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Deepgram live streaming engine.
 */
@ConfigurationProperties(prefix = "stt.deepgram")
@Validated
public class DeepgramProperties {

    /** API key; usually supplied through DEEPGRAM_API_KEY. */
    private String apiKey;

    /** Live streaming endpoint. */
    @NotBlank(message = "Deepgram URL must not be blank")
    private String url = "wss://api.deepgram.com/v1/listen";

    @NotBlank(message = "Deepgram model must not be blank")
    private String model = "nova-2";

    @NotBlank(message = "Deepgram language must not be blank")
    private String language = "en-US";

    private boolean punctuate = true;

    private boolean interimResults = true;

    /** Sample rate of the PCM frames forwarded to the engine. */
    @Positive(message = "Sample rate must be positive")
    private int sampleRate = 48_000;

    @Positive(message = "Channels must be positive")
    private int channels = 1;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public boolean isPunctuate() {
        return punctuate;
    }

    public void setPunctuate(boolean punctuate) {
        this.punctuate = punctuate;
    }

    public boolean isInterimResults() {
        return interimResults;
    }

    public void setInterimResults(boolean interimResults) {
        this.interimResults = interimResults;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getChannels() {
        return channels;
    }

    public void setChannels(int channels) {
        this.channels = channels;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
