package com.flamingo.ai.quotes.service.persistence;

import com.flamingo.ai.quotes.domain.entity.Author;
import com.flamingo.ai.quotes.domain.entity.Language;
import com.flamingo.ai.quotes.domain.entity.Quote;
import com.flamingo.ai.quotes.domain.entity.TranslatedAuthorName;
import com.flamingo.ai.quotes.domain.repository.AuthorRepository;
import com.flamingo.ai.quotes.domain.repository.LanguageRepository;
import com.flamingo.ai.quotes.domain.repository.QuoteRepository;
import com.flamingo.ai.quotes.domain.repository.TranslatedAuthorNameRepository;
import com.flamingo.ai.quotes.exception.LanguageNotFoundException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** PersistenceGateway backed by Spring Data JPA repositories. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPersistenceGateway implements PersistenceGateway {

  private final AuthorRepository authorRepository;
  private final LanguageRepository languageRepository;
  private final TranslatedAuthorNameRepository translatedAuthorNameRepository;
  private final QuoteRepository quoteRepository;

  @Override
  @Transactional(readOnly = true)
  public Optional<Author> findAuthorByName(String englishFullName) {
    return authorRepository.findByEnglishFullName(englishFullName);
  }

  @Override
  @Transactional
  public Author createAuthor(String englishFullName) {
    Author saved = authorRepository.save(Author.builder().englishFullName(englishFullName).build());
    log.info("Created author {} with ID: {}", englishFullName, saved.getId());
    return saved;
  }

  @Override
  @Transactional
  public TranslatedAuthorName appendTranslatedName(
      Author author, Language language, String fullName) {
    return translatedAuthorNameRepository.save(
        TranslatedAuthorName.builder().author(author).language(language).fullName(fullName).build());
  }

  @Override
  @Transactional(readOnly = true)
  public Language findLanguageByAbbreviation(String abbreviation) {
    return languageRepository
        .findById(abbreviation)
        .orElseThrow(() -> new LanguageNotFoundException(abbreviation));
  }

  @Override
  @Transactional
  public List<Quote> saveQuotes(List<Quote> quotes) {
    if (quotes.isEmpty()) {
      return List.of();
    }
    return quoteRepository.saveAll(quotes);
  }

  @Override
  @Transactional(readOnly = true)
  public long countQuotes() {
    return quoteRepository.count();
  }
}
