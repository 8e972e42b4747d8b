package com.flamingo.ai.quotes.domain.repository;

import com.flamingo.ai.quotes.domain.entity.TranslatedAuthorName;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for TranslatedAuthorName entities. */
@Repository
public interface TranslatedAuthorNameRepository extends JpaRepository<TranslatedAuthorName, Long> {

  List<TranslatedAuthorName> findByAuthorId(Long authorId);
}
