package com.naag.docsync.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naag.docsync.embed.EmbeddingException;
import com.naag.docsync.http.Http;
import com.naag.docsync.json.Json;
import com.naag.docsync.llm.EmbeddingsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeddings over any OpenAI-compatible endpoint: llama.cpp, Ollama, or Gemini's
 * OpenAI compatibility layer.
 */
public final class OpenAIEmbeddingsClient implements EmbeddingsClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIEmbeddingsClient.class);

    private final String endpoint;
    private final String model;
    private final String apiKey;

    public OpenAIEmbeddingsClient(String baseUrl, String path, String model, String apiKey) {
        this.endpoint = baseUrl + path;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public List<Double> embed(String text) {
        long startTime = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            ObjectNode body = Json.MAPPER.createObjectNode()
                    .put("model", model)
                    .put("input", text);

            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
            if (apiKey != null && !apiKey.isBlank()) {
                req.header("Authorization", "Bearer " + apiKey);
            }

            resp = Http.CLIENT.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding request interrupted", e);
        } catch (Exception e) {
            throw new EmbeddingException("OpenAI-compatible embedding failed", e);
        }

        if (resp.statusCode() / 100 != 2) {
            throw new EmbeddingException("OpenAI-compatible embed HTTP " + resp.statusCode() + ": " + resp.body());
        }

        List<Double> out = parseEmbedding(resp.body());
        log.debug("[EMBED TIMING] total={}ms textLen={} dim={}",
                System.currentTimeMillis() - startTime, text.length(), out.size());
        return out;
    }

    static List<Double> parseEmbedding(String json) {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(json);
        } catch (Exception e) {
            throw new EmbeddingException("Bad embed response JSON", e);
        }

        JsonNode data = root.get("data");
        if (data == null || !data.isArray() || data.size() == 0) {
            throw new EmbeddingException("Bad OpenAI embed response: missing data array - " + json);
        }
        JsonNode vec = data.get(0).get("embedding");
        if (vec == null || !vec.isArray()) {
            throw new EmbeddingException("Bad OpenAI embed response: missing embedding array - " + json);
        }

        List<Double> out = new ArrayList<>(vec.size());
        for (JsonNode n : vec) out.add(n.asDouble());
        return out;
    }
}
