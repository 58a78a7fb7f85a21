package com.catalogiq.ai.service;

import com.catalogiq.ai.config.AiConfig;
import com.catalogiq.engine.spi.Oracle;
import com.catalogiq.engine.spi.OracleException;
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
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Oracle backed by Google Gemini via Vertex AI.
 * Answers are free text; this class reduces them to a boolean, a number or a trimmed string.
 */
@Slf4j
@Service
public class GeminiOracle implements Oracle {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern VERDICT_PATTERN = Pattern.compile("\\b(TRUE|FALSE|YES|NO)\\b");

    private final Client client;
    private final String modelName;
    private final AiConfig aiConfig;

    public GeminiOracle(
            AiConfig aiConfig,
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location,
            @Value("${vertex.ai.model:gemini-2.0-flash}") String modelName) {
        this.aiConfig = aiConfig;
        this.modelName = modelName;

        Client tempClient = null;
        if (projectId != null && !projectId.isBlank()) {
            try {
                tempClient = Client.builder()
                        .project(projectId)
                        .location(location)
                        .vertexAI(true)
                        .build();
                log.info("Initialized Gemini oracle for Vertex AI: project={}, location={}, model={}",
                        projectId, location, modelName);
            } catch (Exception e) {
                log.error("Failed to initialize Gemini oracle client: {}", e.getMessage());
            }
        } else {
            log.warn("Vertex AI not configured - projectId is empty. Oracle disabled, engine runs threshold-only.");
        }
        this.client = tempClient;
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public boolean validateBool(String prompt) {
        return parseBoolean(generate(prompt));
    }

    @Override
    public double scoreScalar(String prompt) {
        return parseScore(generate(prompt));
    }

    @Override
    public String explain(String prompt) {
        String text = generate(prompt).trim();
        if (text.isEmpty()) {
            throw new OracleException("Empty explanation from " + modelName);
        }
        return text;
    }

    private String generate(String prompt) {
        if (client == null) {
            throw new OracleException("Gemini client not initialized");
        }

        List<Content> contents = List.of(
                Content.builder()
                        .role("user")
                        .parts(List.of(Part.builder().text(prompt).build()))
                        .build()
        );

        GenerateContentConfig config = GenerateContentConfig.builder()
                .temperature(aiConfig.getGeneration().getTemperature())
                .maxOutputTokens(aiConfig.getGeneration().getMaxOutputTokens())
                .build();

        GenerateContentResponse response;
        try {
            long startTime = System.currentTimeMillis();
            response = client.models.generateContent(modelName, contents, config);
            log.debug("Gemini call completed in {}ms", System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            throw new OracleException("Gemini call failed: " + e.getMessage(), e);
        }
        return extractText(response);
    }

    private static String extractText(GenerateContentResponse response) {
        Optional<List<Candidate>> candidatesOpt = response.candidates();
        if (candidatesOpt.isEmpty() || candidatesOpt.get().isEmpty()) {
            throw new OracleException("No candidates in Gemini response");
        }

        Optional<Content> contentOpt = candidatesOpt.get().get(0).content();
        Optional<List<Part>> partsOpt = contentOpt.flatMap(Content::parts);
        if (partsOpt.isEmpty()) {
            throw new OracleException("No content in Gemini response");
        }

        StringBuilder text = new StringBuilder();
        for (Part part : partsOpt.get()) {
            part.text().ifPresent(text::append);
        }
        return text.toString();
    }

    /**
     * First TRUE/FALSE (or YES/NO) token in the answer, case-insensitive.
     */
    static boolean parseBoolean(String answer) {
        if (answer == null) {
            throw new OracleException("Empty validation answer");
        }
        Matcher matcher = VERDICT_PATTERN.matcher(answer.toUpperCase(Locale.ROOT));
        if (!matcher.find()) {
            throw new OracleException("Unparseable validation answer: " + abbreviate(answer));
        }
        String verdict = matcher.group(1);
        return verdict.equals("TRUE") || verdict.equals("YES");
    }

    /**
     * First number in the answer, so "8", "8.5/10" and "Score: 7" all parse.
     */
    static double parseScore(String answer) {
        if (answer == null) {
            throw new OracleException("Empty score answer");
        }
        Matcher matcher = NUMBER_PATTERN.matcher(answer);
        if (!matcher.find()) {
            throw new OracleException("Unparseable score answer: " + abbreviate(answer));
        }
        return Double.parseDouble(matcher.group());
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() <= 50 ? trimmed : trimmed.substring(0, 50) + "...";
    }
}
