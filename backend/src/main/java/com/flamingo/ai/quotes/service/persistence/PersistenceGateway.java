package com.flamingo.ai.quotes.service.persistence;

import com.flamingo.ai.quotes.domain.entity.Author;
import com.flamingo.ai.quotes.domain.entity.Language;
import com.flamingo.ai.quotes.domain.entity.Quote;
import com.flamingo.ai.quotes.domain.entity.TranslatedAuthorName;
import java.util.List;
import java.util.Optional;

/** Storage operations the ingestion pipeline depends on. */
public interface PersistenceGateway {

  /**
   * Looks an author up by canonical English name.
   *
   * @param englishFullName the canonical English name
   * @return the author, or empty if none is stored yet
   */
  Optional<Author> findAuthorByName(String englishFullName);

  /**
   * Stores a new author.
   *
   * @param englishFullName the canonical English name
   * @return the stored author
   */
  Author createAuthor(String englishFullName);

  /**
   * Records the name of an author as written in a language.
   *
   * @param author the author
   * @param language the language of the name
   * @param fullName the name as written in that language
   * @return the stored name
   */
  TranslatedAuthorName appendTranslatedName(Author author, Language language, String fullName);

  /**
   * Gets a language from the catalog.
   *
   * @param abbreviation the two-letter abbreviation
   * @return the language
   * @throws com.flamingo.ai.quotes.exception.LanguageNotFoundException if not in the catalog
   */
  Language findLanguageByAbbreviation(String abbreviation);

  /**
   * Stores quotes.
   *
   * @param quotes the quotes
   * @return the stored quotes
   */
  List<Quote> saveQuotes(List<Quote> quotes);

  /** Returns the number of stored quotes. */
  long countQuotes();
}
