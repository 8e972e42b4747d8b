package com.flamingo.ai.quotes.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Structured output of the author name classifier. */
public record ClassificationResult(
    @JsonProperty("isHuman") Boolean isHuman, // null when the model left it out
    @JsonProperty("englishName") String englishName // required only when isHuman is true
    ) {}
