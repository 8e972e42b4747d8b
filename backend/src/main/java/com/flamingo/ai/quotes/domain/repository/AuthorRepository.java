package com.flamingo.ai.quotes.domain.repository;

import com.flamingo.ai.quotes.domain.entity.Author;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Author entities. */
@Repository
public interface AuthorRepository extends JpaRepository<Author, Long> {

  Optional<Author> findByEnglishFullName(String englishFullName);
}
