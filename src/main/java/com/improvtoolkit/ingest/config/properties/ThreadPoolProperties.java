package com.improvtoolkit.ingest.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pipeline thread pool.
 *
 * <p>Every device session and every stage occupies one thread for the life of the pipeline, so the
 * pool has no queue: it must hold at least one thread per device plus the three stage tasks.
 */
@Validated
@ConfigurationProperties(prefix = "ingest.threadpool")
public class ThreadPoolProperties {

    @Min(4)
    private int poolSize = 8;

    @Min(1)
    private int awaitTerminationSeconds = 5;

    @NotBlank
    private String threadNamePrefix = "ingest-";

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getAwaitTerminationSeconds() {
        return awaitTerminationSeconds;
    }

    public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
        this.awaitTerminationSeconds = awaitTerminationSeconds;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
