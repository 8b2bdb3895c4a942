package com.gridcast.core.freshness;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "gridcast.freshness")
public class FreshnessProperties {

    private long expectedIntervalMinutes = 60;
    private double stalenessMultiplier = 1.5;

    public long getExpectedIntervalMinutes() {
        return expectedIntervalMinutes;
    }

    public void setExpectedIntervalMinutes(long expectedIntervalMinutes) {
        this.expectedIntervalMinutes = expectedIntervalMinutes;
    }

    public double getStalenessMultiplier() {
        return stalenessMultiplier;
    }

    public void setStalenessMultiplier(double stalenessMultiplier) {
        this.stalenessMultiplier = stalenessMultiplier;
    }

    public FreshnessPolicy toPolicy() {
        return new FreshnessPolicy(Duration.ofMinutes(expectedIntervalMinutes), stalenessMultiplier);
    }
}
