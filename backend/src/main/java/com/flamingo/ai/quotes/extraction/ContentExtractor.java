package com.flamingo.ai.quotes.extraction;

import com.flamingo.ai.quotes.domain.entity.Author;
import com.flamingo.ai.quotes.domain.entity.Language;
import com.flamingo.ai.quotes.domain.entity.Quote;
import java.util.List;

/**
 * Language-specific reader of Wikiquote page content.
 *
 * <p>Implementations are stateless and registered as Spring beans; {@link
 * ContentExtractorRegistry} picks the one for a dump's language.
 */
public interface ContentExtractor {

  /**
   * Returns {@code true} if this extractor handles pages in the given language.
   *
   * @param languageAbbreviation two-letter language code
   * @return {@code true} if supported
   */
  boolean supports(String languageAbbreviation);

  /**
   * Returns {@code true} for namespace and administrative pages (help, categories, talk pages,
   * the main page) that never hold an author's quotes.
   *
   * @param title the page title
   * @return {@code true} if the page must be skipped
   */
  boolean isForbiddenPageName(String title);

  /**
   * Extracts, scores and filters the quotations of an author's page.
   *
   * @param pageUrl URL of the page, stored as the quotes' source
   * @param rawContent wikitext of the page
   * @param author the page's author
   * @param language the language of the page
   * @return accepted quotes in page order, not yet stored; empty if none passed
   * @throws com.flamingo.ai.quotes.exception.ClassificationException when scoring keeps failing
   */
  List<Quote> extract(String pageUrl, String rawContent, Author author, Language language);
}
