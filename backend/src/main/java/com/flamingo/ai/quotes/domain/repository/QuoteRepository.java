package com.flamingo.ai.quotes.domain.repository;

import com.flamingo.ai.quotes.domain.entity.Quote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Quote entities. */
@Repository
public interface QuoteRepository extends JpaRepository<Quote, Long> {

  long countByAuthorId(Long authorId);
}
