package com.forgeloop.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) output from LLM calls.
 * <p>
 * Uses {@link BeanOutputConverter} to derive a JSON schema from the target class, append
 * format instructions to the user prompt and deserialize the reply. Replies the converter
 * rejects get a second, lenient pass through Jackson.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    @Autowired
    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(builder.build());
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    LlmService(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    /**
     * Sends a system + user prompt and deserializes the reply into {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returned no content
     * @throws LlmParseException         if the reply could not be parsed
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Sends a system + user prompt and returns the raw reply text.
     *
     * @throws LlmEmptyResponseException if the model returned no content
     */
    public String textCall(String systemPrompt, String userPrompt) {
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content");
        }
        return response.trim();
    }

    /**
     * Lenient fallback: strips markdown fences and ignores unknown properties.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        log.info("Attempting Jackson fallback parsing for {}", outputType.getSimpleName());
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
            mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
            mapper.registerModule(new ParameterNamesModule());

            T result = mapper.readValue(stripFences(json), outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e2) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e2.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e2.getMessage(), e2);
        }
    }

    static String stripFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int newline = cleaned.indexOf('\n');
            cleaned = newline > 0 ? cleaned.substring(newline + 1) : cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
