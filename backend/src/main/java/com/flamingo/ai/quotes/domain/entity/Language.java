package com.flamingo.ai.quotes.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A language quotes can be written in, keyed by its two-letter abbreviation. */
@Entity
@Table(name = "languages")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Language {

  @Id
  @Column(length = 2)
  private String abbreviation;

  @Column(nullable = false)
  private String englishName;

  @Column(nullable = false)
  private String nativeName;
}
