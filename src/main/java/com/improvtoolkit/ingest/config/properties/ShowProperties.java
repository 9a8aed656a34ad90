package com.improvtoolkit.ingest.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Show-level declarations that the device configuration is cross-checked against.
 */
@Validated
@ConfigurationProperties(prefix = "ingest.show")
public class ShowProperties {

    /** Number of actors on stage; must match configured microphones and avatar buttons. */
    @Positive(message = "Actors count must be positive")
    private int actorsCount = 1;

    public int getActorsCount() {
        return actorsCount;
    }

    public void setActorsCount(int actorsCount) {
        this.actorsCount = actorsCount;
    }
}
