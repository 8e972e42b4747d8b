package com.flamingo.ai.quotes.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Structured output of the quote scorer. */
public record ScoreResult(
    @JsonProperty("score") Integer score, // 0-100
    @JsonProperty("cleanQuote") String cleanQuote // may be empty for rejected text
    ) {}
