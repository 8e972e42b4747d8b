package com.flamingo.ai.quotes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.quotes.domain.entity.Author;
import com.flamingo.ai.quotes.domain.repository.AuthorRepository;
import com.flamingo.ai.quotes.domain.repository.LanguageRepository;
import com.flamingo.ai.quotes.domain.repository.QuoteRepository;
import com.flamingo.ai.quotes.domain.repository.TranslatedAuthorNameRepository;
import com.flamingo.ai.quotes.extraction.ContentExtractorRegistry;
import com.flamingo.ai.quotes.service.ingestion.IngestionReport;
import com.flamingo.ai.quotes.service.ingestion.WikiquoteIngestionService;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Loads the application context against a throwaway SQLite database, with both chat models
 * mocked, and runs one small dump through the whole pipeline.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean(name = "classifierChatModel")
  private ChatModel classifierChatModel;

  @MockitoBean(name = "scorerChatModel")
  private ChatModel scorerChatModel;

  @Autowired private ApplicationContext applicationContext;
  @Autowired private WikiquoteIngestionService ingestionService;
  @Autowired private LanguageRepository languageRepository;
  @Autowired private AuthorRepository authorRepository;
  @Autowired private TranslatedAuthorNameRepository translatedAuthorNameRepository;
  @Autowired private QuoteRepository quoteRepository;

  @TempDir Path tempDir;

  @Test
  @DisplayName("Application context should load with the language catalog seeded")
  void contextLoads() {
    assertThat(applicationContext.getBean(ContentExtractorRegistry.class).forLanguage("cs"))
        .isNotNull();
    assertThat(languageRepository.findById("cs")).isPresent();
    assertThat(languageRepository.findById("en")).isPresent();
  }

  @Test
  @DisplayName("A Czech dump is ingested end to end into the database")
  void shouldIngestDumpIntoDatabase() throws Exception {
    // Given
    Path dump = tempDir.resolve("cswikiquote-latest-pages.xml");
    Files.writeString(
        dump,
        """
        <mediawiki xmlns="http://www.mediawiki.org/xml/export-0.11/">
          <siteinfo><dbname>cswikiquote</dbname></siteinfo>
          <page>
            <title>Kategorie:Spisovatelé</title>
            <revision><text>* nic</text></revision>
          </page>
          <page>
            <title>Lucius Annaeus Seneca</title>
            <revision><text>== Citáty ==
        * Svolného osud vede, zpurného vleče. (Volentem fata ducunt, nolentem trahunt.)
        ** De vita beata</text></revision>
          </page>
        </mediawiki>
        """);
    when(classifierChatModel.chat(any(ChatRequest.class)))
        .thenReturn(response("{\"isHuman\":true,\"englishName\":\"Seneca\"}"));
    when(scorerChatModel.chat(any(ChatRequest.class)))
        .thenReturn(response("{\"score\":92,\"cleanQuote\":\"Svolného osud vede, zpurného vleče.\"}"));

    // When
    IngestionReport report = ingestionService.ingest(dump);

    // Then
    assertThat(report.quotesSaved()).isEqualTo(1);
    Author author = authorRepository.findByEnglishFullName("Seneca").orElseThrow();
    assertThat(quoteRepository.countByAuthorId(author.getId())).isEqualTo(1);
    assertThat(translatedAuthorNameRepository.findByAuthorId(author.getId()))
        .extracting("fullName")
        .containsExactly("Lucius Annaeus Seneca");
    assertThat(Files.exists(tempDir.resolve("cswikiquote-latest-pages.xml.done"))).isTrue();
  }

  private static ChatResponse response(String json) {
    return ChatResponse.builder()
        .aiMessage(AiMessage.from(json))
        .finishReason(FinishReason.STOP)
        .build();
  }
}
