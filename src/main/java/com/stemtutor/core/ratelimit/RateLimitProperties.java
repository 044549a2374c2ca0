package com.stemtutor.core.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "stemtutor.rate-limit")
public class RateLimitProperties {

    /** "memory" for a single instance, "redis" to share buckets across instances. */
    private String store = "memory";
    private int windowSeconds = 60;
    private int freeLimit = 5;
    private int proLimit = 50;
    private List<String> proIdentities = new ArrayList<>();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getFreeLimit() {
        return freeLimit;
    }

    public void setFreeLimit(int freeLimit) {
        this.freeLimit = freeLimit;
    }

    public int getProLimit() {
        return proLimit;
    }

    public void setProLimit(int proLimit) {
        this.proLimit = proLimit;
    }

    public List<String> getProIdentities() {
        return proIdentities;
    }

    public void setProIdentities(List<String> proIdentities) {
        this.proIdentities = proIdentities;
    }

    public int limitFor(Tier tier) {
        return switch (tier) {
            case FREE -> freeLimit;
            case PRO -> proLimit;
        };
    }
}
