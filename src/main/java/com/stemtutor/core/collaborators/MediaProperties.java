package com.stemtutor.core.collaborators;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "stemtutor.media")
public class MediaProperties {

    private String youtubeApiKey = "";
    private String youtubeBaseUrl = "https://www.googleapis.com/youtube/v3";
    private int timeoutSeconds = 10;

    public String getYoutubeApiKey() {
        return youtubeApiKey;
    }

    public void setYoutubeApiKey(String youtubeApiKey) {
        this.youtubeApiKey = youtubeApiKey;
    }

    public String getYoutubeBaseUrl() {
        return youtubeBaseUrl;
    }

    public void setYoutubeBaseUrl(String youtubeBaseUrl) {
        this.youtubeBaseUrl = youtubeBaseUrl;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public boolean hasYoutubeApiKey() {
        return youtubeApiKey != null && !youtubeApiKey.isBlank();
    }
}
