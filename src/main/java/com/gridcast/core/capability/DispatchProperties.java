package com.gridcast.core.capability;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "gridcast.dispatch")
public class DispatchProperties {

    private long defaultTimeoutSeconds = 30;

    /** Invocations of one wave run concurrently up to this limit; 1 keeps ACT strictly sequential. */
    private int maxParallel = 1;

    /** Per-capability timeout overrides in seconds, keyed by capability name. */
    private Map<String, Long> timeouts = new HashMap<>();

    public long getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(long defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public Map<String, Long> getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Map<String, Long> timeouts) {
        this.timeouts = timeouts;
    }

    public Duration timeoutFor(CapabilityDescriptor descriptor) {
        Long override = timeouts.get(descriptor.name());
        if (override != null) {
            return Duration.ofSeconds(override);
        }
        if (descriptor.timeout() != null) {
            return descriptor.timeout();
        }
        return Duration.ofSeconds(defaultTimeoutSeconds);
    }
}
