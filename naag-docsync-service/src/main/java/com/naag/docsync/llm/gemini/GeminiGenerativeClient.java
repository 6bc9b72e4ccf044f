package com.naag.docsync.llm.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naag.docsync.http.Http;
import com.naag.docsync.json.Json;
import com.naag.docsync.llm.GenerativeClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;

/**
 * Gemini {@code generateContent} over REST, with documents sent as inline base64 parts.
 */
public final class GeminiGenerativeClient implements GenerativeClient {
    private static final Logger log = LoggerFactory.getLogger(GeminiGenerativeClient.class);

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public GeminiGenerativeClient(String baseUrl, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String generate(String model, String prompt) {
        ArrayNode parts = Json.MAPPER.createArrayNode();
        parts.addObject().put("text", prompt);
        return call(model, parts);
    }

    @Override
    public String generateFromDocument(String model, String prompt, byte[] document, String mimeType) {
        ArrayNode parts = Json.MAPPER.createArrayNode();
        parts.addObject().put("text", prompt);
        ObjectNode inline = parts.addObject().putObject("inline_data");
        inline.put("mime_type", mimeType);
        inline.put("data", Base64.getEncoder().encodeToString(document));
        return call(model, parts);
    }

    private String call(String model, ArrayNode parts) {
        if (!isAvailable()) {
            throw new IllegalStateException("Gemini API key is not configured");
        }
        long start = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.putArray("contents").addObject().set("parts", parts);
            body.putObject("generationConfig").put("temperature", 0.0);

            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/models/" + model + ":generateContent"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("x-goog-api-key", apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();

            HttpResponse<String> resp = Http.CLIENT.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new RuntimeException("Gemini generateContent HTTP " + resp.statusCode() + ": " + resp.body());
            }

            String text = extractText(Json.MAPPER.readTree(resp.body()));
            log.debug("[GEMINI TIMING] model={} took={}ms outLen={}", model, System.currentTimeMillis() - start, text.length());
            return text;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Gemini call interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Gemini call failed", e);
        }
    }

    static String extractText(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        JsonNode candidates = root.path("candidates");
        if (candidates.isArray() && candidates.size() > 0) {
            for (JsonNode part : candidates.get(0).path("content").path("parts")) {
                sb.append(part.path("text").asText(""));
            }
        }
        return sb.toString().trim();
    }
}
