package com.flamingo.ai.quotes.extraction;

import com.flamingo.ai.quotes.exception.UnsupportedDumpLanguageException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Routes a dump language to the {@link ContentExtractor} that supports it. */
@Service
@RequiredArgsConstructor
public class ContentExtractorRegistry {

  private final List<ContentExtractor> extractors;

  /**
   * Returns the extractor for a language.
   *
   * @param languageAbbreviation two-letter language code
   * @return the first extractor that supports the language
   * @throws UnsupportedDumpLanguageException if no extractor supports it
   */
  public ContentExtractor forLanguage(String languageAbbreviation) {
    return extractors.stream()
        .filter(e -> e.supports(languageAbbreviation))
        .findFirst()
        .orElseThrow(() -> new UnsupportedDumpLanguageException(languageAbbreviation));
  }
}
