package de.bsommerfeld.golinks.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Click recording parameters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClickConfig {

    @JsonProperty("queue-capacity")
    private int queueCapacity = 256;

    @JsonProperty("drain-timeout-seconds")
    private long drainTimeoutSeconds = 30;

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getDrainTimeoutSeconds() {
        return drainTimeoutSeconds;
    }

    public void setDrainTimeoutSeconds(long drainTimeoutSeconds) {
        this.drainTimeoutSeconds = drainTimeoutSeconds;
    }
}
