package com.flamingo.ai.quotes.extraction;

import com.flamingo.ai.quotes.agent.QuoteScorer;
import com.flamingo.ai.quotes.config.IngestionProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Extractor for the English Wikiquote (en.wikiquote.org). */
@Component
public class EnglishContentExtractor extends AbstractWikiquoteContentExtractor {

  private static final List<String> FORBIDDEN_PREFIXES =
      List.of(
          "Wikiquote:",
          "Wikiquote talk:",
          "Category:",
          "Category talk:",
          "Help:",
          "Help talk:",
          "Template:",
          "Template talk:",
          "File:",
          "File talk:",
          "MediaWiki:",
          "MediaWiki talk:",
          "Module:",
          "Module talk:",
          "Portal:",
          "Portal talk:",
          "Special:",
          "Media:",
          "Talk:",
          "User:",
          "User talk:");

  public EnglishContentExtractor(
      QuoteScorer quoteScorer, IngestionProperties properties, MeterRegistry meterRegistry) {
    super(quoteScorer, properties, meterRegistry);
  }

  @Override
  protected String languageAbbreviation() {
    return "en";
  }

  @Override
  protected Set<String> quotationHeadings() {
    return Set.of("Quotes", "Sourced", "Quotations");
  }

  @Override
  protected List<String> forbiddenPrefixes() {
    return FORBIDDEN_PREFIXES;
  }

  @Override
  protected String mainPageTitle() {
    return "Main Page";
  }
}
