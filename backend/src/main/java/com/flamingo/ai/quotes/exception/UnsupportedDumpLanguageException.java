package com.flamingo.ai.quotes.exception;

/** Exception thrown when no content extractor handles the language of a dump. */
public class UnsupportedDumpLanguageException extends RuntimeException {

  private final String languageAbbreviation;

  public UnsupportedDumpLanguageException(String languageAbbreviation) {
    super("No content extractor for language: " + languageAbbreviation);
    this.languageAbbreviation = languageAbbreviation;
  }

  public String getLanguageAbbreviation() {
    return languageAbbreviation;
  }
}
