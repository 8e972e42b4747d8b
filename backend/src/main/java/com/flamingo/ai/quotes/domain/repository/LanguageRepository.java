package com.flamingo.ai.quotes.domain.repository;

import com.flamingo.ai.quotes.domain.entity.Language;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Language entities, keyed by abbreviation. */
@Repository
public interface LanguageRepository extends JpaRepository<Language, String> {}
