package com.flamingo.ai.quotes.service.ingestion;

import com.flamingo.ai.quotes.config.IngestionProperties;
import com.flamingo.ai.quotes.service.persistence.PersistenceGateway;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Ingests the dumps given as command-line arguments, or the configured {@code ingestion.dumps}
 * when there are none. Dumps run one after another; the first failure stops the process.
 */
@Component
@Order(10)
@RequiredArgsConstructor
@Slf4j
public class IngestionRunner implements ApplicationRunner {

  private final WikiquoteIngestionService ingestionService;
  private final PersistenceGateway persistenceGateway;
  private final IngestionProperties properties;

  @Override
  public void run(ApplicationArguments args) throws IOException {
    List<String> dumps =
        args.getNonOptionArgs().isEmpty() ? properties.getDumps() : args.getNonOptionArgs();
    if (dumps.isEmpty()) {
      log.info("No dumps to ingest");
      return;
    }

    for (String dump : dumps) {
      IngestionReport report = ingestionService.ingest(Path.of(dump));
      log.info("Dump {}: {}", report.dumpPath(), report.status());
    }
    log.info("Catalog holds {} quotes", persistenceGateway.countQuotes());
  }
}
