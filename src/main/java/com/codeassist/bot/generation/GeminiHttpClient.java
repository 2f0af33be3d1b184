package com.codeassist.bot.generation;

import com.codeassist.bot.config.BotConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GeminiHttpClient implements GenerationClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiHttpClient.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final String apiKey;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GeminiHttpClient(BotConfig config) {
        this(config.geminiApiKey(), config.geminiEndpoint(), config.geminiModel(), config.requestTimeout());
    }

    public GeminiHttpClient(String apiKey, String baseUrl, String model, Duration requestTimeout) {
        this.apiKey = apiKey;
        this.endpoint = URI.create(baseUrl + "/models/" + model + ":generateContent");
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        this.objectMapper = new ObjectMapper();
        LOGGER.info("Gemini client initialized for model {}", model);
    }

    @Override
    public String generate(String prompt, GenerationMode mode) throws GenerationException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("x-goog-api-key", apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestPayload(prompt, mode)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException error) {
            throw new GenerationException("Gemini request timed out after " + requestTimeout.toSeconds() + "s", error);
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Gemini request interrupted", error);
        } catch (IOException error) {
            throw new GenerationException("Gemini request failed: " + error.getMessage(), error);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new GenerationException("Gemini returned HTTP " + response.statusCode()
                    + ": " + summarize(response.body()));
        }
        return parseResponse(response.body());
    }

    String buildRequestPayload(String prompt, GenerationMode mode) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("temperature", mode.temperature());
        generationConfig.put("maxOutputTokens", mode.maxOutputTokens());
        return objectMapper.writeValueAsString(payload);
    }

    String parseResponse(String body) throws GenerationException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException error) {
            throw new GenerationException("Gemini response was not valid JSON", error);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode candidate : root.path("candidates")) {
            for (JsonNode part : candidate.path("content").path("parts")) {
                text.append(part.path("text").asText(""));
            }
            if (text.length() > 0) {
                break;
            }
        }
        String result = text.toString().strip();
        if (result.isEmpty()) {
            String reason = root.path("promptFeedback").path("blockReason").asText("no text in candidates");
            throw new GenerationException("Gemini returned no text: " + reason);
        }
        return result;
    }

    private static String summarize(String body) {
        if (body == null || body.isBlank()) {
            return "n/a";
        }
        String normalized = body.strip().replaceAll("\\s+", " ");
        if (normalized.length() <= 200) {
            return normalized;
        }
        return normalized.substring(0, 197) + "...";
    }
}
