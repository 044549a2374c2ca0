package com.stemtutor.core.collaborators;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "stemtutor.collaborators")
public class CollaboratorProperties {

    private int maxAttempts = 3;
    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private int fanOutPoolSize = 8;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public int getFanOutPoolSize() {
        return fanOutPoolSize;
    }

    public void setFanOutPoolSize(int fanOutPoolSize) {
        this.fanOutPoolSize = fanOutPoolSize;
    }
}
