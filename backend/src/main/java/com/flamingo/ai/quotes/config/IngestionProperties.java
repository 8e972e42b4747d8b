package com.flamingo.ai.quotes.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the dump ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionProperties {

  /** Dump files ingested in order when no paths are given on the command line. */
  private List<String> dumps = new ArrayList<>();

  /** Page URL template, filled with the language abbreviation and the page title. */
  private String sourceUrlTemplate = "https://%s.wikiquote.org/wiki/%s";

  private Retry retry = new Retry();
  private Scoring scoring = new Scoring();
  private List<LanguageEntry> languages = new ArrayList<>();

  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;

    /** The wait before attempt n+1 is n squared times this unit. */
    private Duration backoffUnit = Duration.ofSeconds(1);
  }

  @Getter
  @Setter
  public static class Scoring {
    /** A quote is kept only when its score is strictly greater than this. */
    private int acceptanceThreshold = 50;

    private int maxCleanQuoteLength = 500;

    /** Longer candidates are rejected without being sent to the scorer. */
    private int maxCandidateLength = 1000;
  }

  @Getter
  @Setter
  public static class LanguageEntry {
    private String abbreviation;
    private String englishName;
    private String nativeName;
  }
}
