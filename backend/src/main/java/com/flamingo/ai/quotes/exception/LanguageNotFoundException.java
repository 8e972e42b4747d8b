package com.flamingo.ai.quotes.exception;

/** Exception thrown when a language abbreviation is missing from the language catalog. */
public class LanguageNotFoundException extends RuntimeException {

  private final String abbreviation;

  public LanguageNotFoundException(String abbreviation) {
    super("Language not found: " + abbreviation);
    this.abbreviation = abbreviation;
  }

  public String getAbbreviation() {
    return abbreviation;
  }
}
