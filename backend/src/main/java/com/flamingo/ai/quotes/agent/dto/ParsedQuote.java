package com.flamingo.ai.quotes.agent.dto;

/**
 * A scored candidate.
 *
 * @param score 0 to 100
 * @param cleanQuote the cleaned single rendering, or null when the scorer returned none
 */
public record ParsedQuote(int score, String cleanQuote) {

  public static ParsedQuote rejected() {
    return new ParsedQuote(0, null);
  }

  public boolean hasCleanQuote() {
    return cleanQuote != null && !cleanQuote.isBlank();
  }
}
