package com.stemtutor.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeType;

/**
 * Reusable service that wraps Spring AI's {@link ChatClient} to produce
 * structured (typed) output from model calls.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target
 * Java class and append format instructions to the user prompt. When the
 * converter rejects the reply, {@link LenientJsonDecoder} gets a second try
 * before the call is reported as a parse failure.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LenientJsonDecoder decoder = new LenientJsonDecoder();

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt to the model and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returns no content
     * @throws LlmParseException         if the content cannot be decoded
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.debug("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        logElapsed(outputType, start);
        return convert(response, converter, outputType);
    }

    /**
     * Like {@link #structuredCall}, but attaches an image to the user message.
     */
    public <T> T visionCall(String systemPrompt, String userPrompt, MimeType imageType,
                            byte[] image, Class<T> outputType) {
        log.debug("Vision call started -> {} ({} bytes)", outputType.getSimpleName(), image.length);
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String text = userPrompt + "\n\n" + converter.getFormat();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(u -> u.text(text).media(imageType, new ByteArrayResource(image)))
                .call()
                .content();
        logElapsed(outputType, start);
        return convert(response, converter, outputType);
    }

    private <T> T convert(String response, BeanOutputConverter<T> converter, Class<T> outputType) {
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Model returned empty content for " + outputType.getSimpleName());
        }
        try {
            T converted = converter.convert(response);
            if (converted != null) {
                return converted;
            }
        } catch (RuntimeException e) {
            log.warn("Converter rejected reply for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw model response: {}", response);
        }
        return decoder.decode(response, outputType).orElseThrow();
    }

    private static void logElapsed(Class<?> outputType, long start) {
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
    }
}
