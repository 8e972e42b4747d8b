package com.flamingo.ai.quotes.extraction;

import com.flamingo.ai.quotes.agent.QuoteScorer;
import com.flamingo.ai.quotes.config.IngestionProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Extractor for the Czech Wikiquote (cs.wikiquote.org). */
@Component
public class CzechContentExtractor extends AbstractWikiquoteContentExtractor {

  private static final List<String> FORBIDDEN_PREFIXES =
      List.of(
          "Wikicitáty:",
          "Wikicitáty diskuse:",
          "Kategorie:",
          "Diskuse k kategorii:",
          "Nápověda:",
          "Nápověda diskuse:",
          "Šablona:",
          "Diskuse k šabloně:",
          "Soubor:",
          "Diskuse k souboru:",
          "MediaWiki:",
          "MediaWiki diskuse:",
          "Modul:",
          "Diskuse k modulu:",
          "Portál:",
          "Diskuse k portálu:",
          "Speciální:",
          "Média:",
          "Diskuse:",
          "Uživatel:",
          "Diskuse s uživatelem:",
          "Uživatelka:",
          "Diskuse s uživatelkou:");

  public CzechContentExtractor(
      QuoteScorer quoteScorer, IngestionProperties properties, MeterRegistry meterRegistry) {
    super(quoteScorer, properties, meterRegistry);
  }

  @Override
  protected String languageAbbreviation() {
    return "cs";
  }

  @Override
  protected Set<String> quotationHeadings() {
    return Set.of("Citáty", "Výroky", "Citace");
  }

  @Override
  protected List<String> forbiddenPrefixes() {
    return FORBIDDEN_PREFIXES;
  }

  @Override
  protected String mainPageTitle() {
    return "Hlavní strana";
  }
}
