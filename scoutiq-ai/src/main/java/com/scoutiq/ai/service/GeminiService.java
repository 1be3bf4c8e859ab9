package com.scoutiq.ai.service;

import com.google.genai.Client;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Text generation with Google Gemini via Vertex AI.
 * Used by the router for intent classification and by the answerer for explanations.
 * Callers treat an empty result as "model unavailable" and fall back to deterministic behavior.
 */
@Slf4j
@Service
public class GeminiService {

    private final Client client;
    private final String modelName;

    public GeminiService(
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location,
            @Value("${vertex.ai.model:gemini-2.0-flash}") String modelName) {
        this.modelName = modelName;

        Client tempClient = null;
        if (projectId != null && !projectId.isBlank()) {
            try {
                tempClient = Client.builder()
                        .project(projectId)
                        .location(location)
                        .vertexAI(true)
                        .build();
                log.info("Initialized Gemini client for Vertex AI: project={}, location={}, model={}",
                        projectId, location, modelName);
            } catch (Exception e) {
                log.error("Failed to initialize Gemini client: {}", e.getMessage());
                tempClient = null;
            }
        } else {
            log.warn("Vertex AI not configured - projectId is empty. Set vertex.ai.project-id property.");
        }
        this.client = tempClient;
    }

    public boolean isAvailable() {
        return client != null;
    }

    /**
     * Single-turn generation.
     *
     * @param systemPrompt Instructions for the model
     * @param userPrompt   The user turn
     * @param jsonOutput   Ask for an application/json response
     * @return Generated text, empty when the client is not configured or the call failed
     */
    public Optional<String> generate(String systemPrompt, String userPrompt, float temperature,
                                     int maxOutputTokens, boolean jsonOutput) {
        if (client == null) {
            return Optional.empty();
        }

        long startTime = System.currentTimeMillis();
        try {
            GenerateContentConfig.Builder config = GenerateContentConfig.builder()
                    .systemInstruction(Content.builder()
                            .parts(List.of(Part.builder().text(systemPrompt).build()))
                            .build())
                    .temperature(temperature)
                    .maxOutputTokens(maxOutputTokens);
            if (jsonOutput) {
                config.responseMimeType("application/json");
            }

            List<Content> contents = List.of(Content.builder()
                    .role("user")
                    .parts(List.of(Part.builder().text(userPrompt).build()))
                    .build());

            GenerateContentResponse response = client.models.generateContent(modelName, contents, config.build());
            Optional<String> text = extractText(response);
            log.debug("Gemini generation finished in {}ms, empty={}",
                    System.currentTimeMillis() - startTime, text.isEmpty());
            return text;

        } catch (Exception e) {
            log.warn("Error calling Gemini: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> extractText(GenerateContentResponse response) {
        Optional<List<Candidate>> candidatesOpt = response.candidates();
        if (candidatesOpt.isEmpty() || candidatesOpt.get().isEmpty()) {
            return Optional.empty();
        }
        Optional<Content> contentOpt = candidatesOpt.get().get(0).content();
        if (contentOpt.isEmpty()) {
            return Optional.empty();
        }
        Optional<List<Part>> partsOpt = contentOpt.get().parts();
        if (partsOpt.isPresent()) {
            StringBuilder text = new StringBuilder();
            for (Part part : partsOpt.get()) {
                part.text().ifPresent(text::append);
            }
            if (!text.toString().isBlank()) {
                return Optional.of(text.toString().trim());
            }
        }
        return Optional.empty();
    }
}
