package com.commerceforecast.analysis.backend;

/**
 * One prompt pair sent to the generation backend.
 *
 * @param wantStructured when true the backend is asked for a bare JSON object
 */
public record GenerationRequest(
    String systemPrompt,
    String userPrompt,
    boolean wantStructured,
    double temperature,
    int maxTokens
) {}
