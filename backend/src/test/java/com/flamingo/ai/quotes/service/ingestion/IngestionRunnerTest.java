package com.flamingo.ai.quotes.service.ingestion;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.quotes.config.IngestionProperties;
import com.flamingo.ai.quotes.exception.DumpFormatException;
import com.flamingo.ai.quotes.service.persistence.PersistenceGateway;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class IngestionRunnerTest {

  @Mock private WikiquoteIngestionService ingestionService;
  @Mock private PersistenceGateway persistenceGateway;

  private IngestionProperties properties;
  private IngestionRunner runner;

  @BeforeEach
  void setUp() {
    properties = new IngestionProperties();
    properties.setDumps(List.of("configured.xml"));
    runner = new IngestionRunner(ingestionService, persistenceGateway, properties);
  }

  @Test
  void shouldPreferCommandLineDumps_overConfiguredOnes() throws Exception {
    // Given
    when(ingestionService.ingest(any(Path.class)))
        .thenAnswer(inv -> IngestionReport.alreadyDone(inv.getArgument(0)));

    // When
    runner.run(new DefaultApplicationArguments("a.xml", "--verbose", "b.xml"));

    // Then
    verify(ingestionService).ingest(Path.of("a.xml"));
    verify(ingestionService).ingest(Path.of("b.xml"));
    verify(ingestionService, never()).ingest(Path.of("configured.xml"));
    verify(persistenceGateway).countQuotes();
  }

  @Test
  void shouldUseConfiguredDumps_whenNoArguments() throws Exception {
    // Given
    when(ingestionService.ingest(any(Path.class)))
        .thenAnswer(inv -> IngestionReport.alreadyDone(inv.getArgument(0)));

    // When
    runner.run(new DefaultApplicationArguments());

    // Then
    verify(ingestionService).ingest(Path.of("configured.xml"));
  }

  @Test
  void shouldStopAtFirstFailingDump() throws Exception {
    // Given
    when(ingestionService.ingest(Path.of("a.xml")))
        .thenThrow(new DumpFormatException(Path.of("a.xml"), "no <page> elements"));

    // When / Then
    assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("a.xml", "b.xml")))
        .isInstanceOf(DumpFormatException.class);
    verify(ingestionService, never()).ingest(Path.of("b.xml"));
    verify(persistenceGateway, never()).countQuotes();
  }
}
