package com.flamingo.ai.quotes.service.language;

import com.flamingo.ai.quotes.config.IngestionProperties;
import com.flamingo.ai.quotes.domain.entity.Language;
import com.flamingo.ai.quotes.domain.repository.LanguageRepository;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Seeds the language catalog from {@code ingestion.languages} before any dump is ingested.
 * Existing languages are left untouched.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class LanguageCatalogInitializer implements CommandLineRunner {

  private final LanguageRepository languageRepository;
  private final IngestionProperties properties;

  @Override
  public void run(String... args) {
    int added = 0;
    for (IngestionProperties.LanguageEntry entry : properties.getLanguages()) {
      if (entry.getAbbreviation() == null || entry.getAbbreviation().length() != 2) {
        throw new IllegalStateException(
            "Language abbreviation must have two letters: " + entry.getAbbreviation());
      }
      String abbreviation = entry.getAbbreviation().toLowerCase(Locale.ROOT);
      if (languageRepository.existsById(abbreviation)) {
        continue;
      }
      languageRepository.save(
          Language.builder()
              .abbreviation(abbreviation)
              .englishName(entry.getEnglishName())
              .nativeName(entry.getNativeName())
              .build());
      added++;
    }
    log.info(
        "Language catalog ready: {} configured, {} added", properties.getLanguages().size(), added);
  }
}
