package com.flamingo.ai.quotes.service.language;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.quotes.config.IngestionProperties;
import com.flamingo.ai.quotes.domain.entity.Language;
import com.flamingo.ai.quotes.domain.repository.LanguageRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LanguageCatalogInitializerTest {

  @Mock private LanguageRepository languageRepository;

  private IngestionProperties properties;
  private LanguageCatalogInitializer initializer;

  @BeforeEach
  void setUp() {
    properties = new IngestionProperties();
    initializer = new LanguageCatalogInitializer(languageRepository, properties);
  }

  @Test
  void shouldAddOnlyMissingLanguages() {
    // Given
    properties.setLanguages(List.of(entry("CS", "Czech", "čeština"), entry("en", "English", "English")));
    when(languageRepository.existsById("cs")).thenReturn(false);
    when(languageRepository.existsById("en")).thenReturn(true);
    ArgumentCaptor<Language> captor = ArgumentCaptor.forClass(Language.class);

    // When
    initializer.run();

    // Then
    verify(languageRepository, times(1)).save(captor.capture());
    assertThat(captor.getValue().getAbbreviation()).isEqualTo("cs");
    assertThat(captor.getValue().getNativeName()).isEqualTo("čeština");
  }

  @Test
  void shouldRejectAbbreviation_thatIsNotTwoLetters() {
    properties.setLanguages(List.of(entry("ces", "Czech", "čeština")));

    assertThatThrownBy(() -> initializer.run()).isInstanceOf(IllegalStateException.class);
    verify(languageRepository, times(0)).save(any());
  }

  private static IngestionProperties.LanguageEntry entry(
      String abbreviation, String englishName, String nativeName) {
    IngestionProperties.LanguageEntry entry = new IngestionProperties.LanguageEntry();
    entry.setAbbreviation(abbreviation);
    entry.setEnglishName(englishName);
    entry.setNativeName(nativeName);
    return entry;
  }
}
