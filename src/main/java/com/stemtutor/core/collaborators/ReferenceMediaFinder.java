package com.stemtutor.core.collaborators;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Finds a reference video for a topic through the YouTube Data API.
 * <p>
 * Without an API key the finder returns a search-results link instead of
 * calling out, which is also the fallback when the lookup fails.
 */
@Component
public class ReferenceMediaFinder {

    private static final Logger log = LoggerFactory.getLogger(ReferenceMediaFinder.class);

    static final String COLLABORATOR = "reference_media";

    private final CollaboratorInvoker invoker;
    private final MediaProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public ReferenceMediaFinder(CollaboratorInvoker invoker, MediaProperties properties, ObjectMapper objectMapper) {
        this(invoker, properties, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .build());
    }

    ReferenceMediaFinder(CollaboratorInvoker invoker, MediaProperties properties,
                         ObjectMapper objectMapper, HttpClient httpClient) {
        this.invoker = invoker;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    public CollaboratorResult<String> find(String topic) {
        if (!properties.hasYoutubeApiKey()) {
            log.debug("No YouTube API key configured, linking search results for '{}'", topic);
            return new CollaboratorResult<>(searchUrl(topic), CollaboratorOutcome.OK, 0);
        }
        return invoker.invoke(COLLABORATOR, () -> lookup(topic), () -> searchUrl(topic));
    }

    public static String searchUrl(String topic) {
        return "https://www.youtube.com/results?search_query="
                + URLEncoder.encode(topic + " tutorial", StandardCharsets.UTF_8);
    }

    private String lookup(String topic) {
        URI uri = URI.create(properties.getYoutubeBaseUrl() + "/search?part=snippet&type=video&maxResults=1"
                + "&q=" + URLEncoder.encode(topic + " tutorial", StandardCharsets.UTF_8)
                + "&key=" + URLEncoder.encode(properties.getYoutubeApiKey(), StandardCharsets.UTF_8));
        var request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorPermanentException(COLLABORATOR, "Interrupted during video lookup", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new CollaboratorTransientException(COLLABORATOR, "YouTube API returned HTTP " + status, null);
        }
        if (status != 200) {
            throw new CollaboratorPermanentException(COLLABORATOR, "YouTube API returned HTTP " + status, null);
        }

        try {
            JsonNode videoId = objectMapper.readTree(response.body()).path("items").path(0).path("id").path("videoId");
            if (videoId.isMissingNode() || videoId.asText().isBlank()) {
                throw new CollaboratorPermanentException(COLLABORATOR, "No video found for '" + topic + "'", null);
            }
            return "https://www.youtube.com/watch?v=" + videoId.asText();
        } catch (IOException e) {
            throw new CollaboratorPermanentException(COLLABORATOR, "Unreadable YouTube API response", e);
        }
    }
}
