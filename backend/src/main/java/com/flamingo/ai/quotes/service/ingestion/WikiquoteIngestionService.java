package com.flamingo.ai.quotes.service.ingestion;

import com.flamingo.ai.quotes.agent.AuthorNameClassifier;
import com.flamingo.ai.quotes.checkpoint.Checkpoint;
import com.flamingo.ai.quotes.checkpoint.CheckpointStore;
import com.flamingo.ai.quotes.config.IngestionProperties;
import com.flamingo.ai.quotes.domain.entity.Author;
import com.flamingo.ai.quotes.domain.entity.Language;
import com.flamingo.ai.quotes.domain.entity.Quote;
import com.flamingo.ai.quotes.dump.Dump;
import com.flamingo.ai.quotes.dump.DumpPage;
import com.flamingo.ai.quotes.dump.DumpReader;
import com.flamingo.ai.quotes.exception.StaleCheckpointException;
import com.flamingo.ai.quotes.extraction.ContentExtractor;
import com.flamingo.ai.quotes.extraction.ContentExtractorRegistry;
import com.flamingo.ai.quotes.service.persistence.PersistenceGateway;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests one Wikiquote dump: decodes it, classifies every page title, extracts and scores the
 * quotations of author pages and stores the accepted ones.
 *
 * <p>Pages are processed strictly in dump order. When a page fails, a checkpoint naming that page
 * is written next to the dump and the failure is rethrown; the next run of the same, unchanged dump
 * starts again at that page. A finished dump gets a done marker and is skipped from then on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WikiquoteIngestionService {

  private final DumpReader dumpReader;
  private final CheckpointStore checkpointStore;
  private final AuthorNameClassifier authorNameClassifier;
  private final ContentExtractorRegistry extractorRegistry;
  private final PersistenceGateway persistenceGateway;
  private final IngestionProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests a dump file.
   *
   * @param dumpPath the dump file
   * @return what the run did
   * @throws IOException if the dump, its checkpoint or its done marker cannot be read or written
   * @throws StaleCheckpointException if the checkpoint does not belong to this dump
   * @throws com.flamingo.ai.quotes.exception.ClassificationException if a page kept failing
   */
  @Timed(value = "ingestion.run", description = "Time to ingest a dump")
  public IngestionReport ingest(Path dumpPath) throws IOException {
    Path dump = dumpPath.toRealPath();
    if (checkpointStore.isDone(dump)) {
      log.warn("Dump {} was already processed, skipping", dump);
      meterRegistry.counter("ingestion.runs", "outcome", "already_done").increment();
      return IngestionReport.alreadyDone(dump);
    }

    log.info("Loading quotes from dump {}", dump);
    Optional<Checkpoint> checkpoint = checkpointStore.load(dump);
    String checksum = null;
    if (checkpoint.isPresent()) {
      checksum = checkpointStore.computeChecksum(dump);
      if (!checksum.equals(checkpoint.get().dumpChecksum())) {
        log.error("Checkpoint of {} was written for a different version of the dump", dump);
        meterRegistry.counter("ingestion.runs", "outcome", "failed").increment();
        throw StaleCheckpointException.checksumMismatch(
            dump, checkpoint.get().dumpChecksum(), checksum);
      }
      log.info(
          "Dump {} was partially processed, resuming at page '{}'",
          dump,
          checkpoint.get().lastPageTitle());
    }

    Dump decoded = dumpReader.load(dump);
    ContentExtractor extractor = extractorRegistry.forLanguage(decoded.languageAbbreviation());
    Language language = persistenceGateway.findLanguageByAbbreviation(decoded.languageAbbreviation());
    log.info("Detected language: {}", language.getEnglishName());

    IngestionReport.Tally tally = new IngestionReport.Tally();
    String resumeTitle = checkpoint.map(Checkpoint::lastPageTitle).orElse(null);
    for (DumpPage page : decoded.pages()) {
      if (resumeTitle != null) {
        if (!resumeTitle.equals(page.title())) {
          continue;
        }
        resumeTitle = null;
      }

      try {
        PageOutcome outcome = processPage(page, extractor, language);
        recordOutcome(outcome);
        tally.add(outcome);
      } catch (RuntimeException e) {
        log.error("Failed to process page '{}' of {}", page.title(), dump, e);
        saveCheckpointQuietly(dump, checksum, page.title());
        meterRegistry.counter("ingestion.runs", "outcome", "failed").increment();
        throw e;
      }
    }

    if (resumeTitle != null) {
      meterRegistry.counter("ingestion.runs", "outcome", "failed").increment();
      throw StaleCheckpointException.resumePageMissing(dump, resumeTitle);
    }

    if (checkpoint.isPresent()) {
      try {
        checkpointStore.delete(dump);
      } catch (IOException e) {
        log.warn("Failed to remove checkpoint of {}", dump, e);
      }
    }
    checkpointStore.markDone(dump);

    IngestionReport report = tally.completed(dump);
    meterRegistry.counter("ingestion.runs", "outcome", "completed").increment();
    log.info(
        "Finished dump {}: {} pages, {} with quotes, {} skipped, {} quotes saved",
        dump,
        report.pagesSeen(),
        report.pagesProcessed(),
        report.pagesSkipped(),
        report.quotesSaved());
    return report;
  }

  /**
   * Processes one page. Skips are returned as outcomes; anything thrown aborts the run.
   *
   * <p>The forbidden-title check always runs before the classifier.
   */
  PageOutcome processPage(DumpPage page, ContentExtractor extractor, Language language) {
    String title = page.title();
    if (page.redirect()) {
      return PageOutcome.skipped(title, SkipReason.REDIRECT);
    }
    if (extractor.isForbiddenPageName(title)) {
      return PageOutcome.skipped(title, SkipReason.FORBIDDEN_TITLE);
    }

    Optional<String> englishName = authorNameClassifier.classify(title);
    if (englishName.isEmpty()) {
      return PageOutcome.skipped(title, SkipReason.NOT_A_PERSON);
    }

    Author author = resolveAuthor(englishName.get());
    persistenceGateway.appendTranslatedName(author, language, title);

    log.info("Processing quotes by {}", author.getEnglishFullName());
    List<Quote> quotes =
        extractor.extract(sourceUrl(language, title), page.rawContent(), author, language);
    if (quotes.isEmpty()) {
      log.warn("No relevant quotes found on page '{}'", title);
      return PageOutcome.skipped(title, SkipReason.NO_QUOTES);
    }

    persistenceGateway.saveQuotes(quotes);
    log.info("Saved {} quotes by {}", quotes.size(), author.getEnglishFullName());
    return PageOutcome.processed(title, quotes.size());
  }

  String sourceUrl(Language language, String title) {
    return String.format(
        properties.getSourceUrlTemplate(), language.getAbbreviation(), title.replace(' ', '_'));
  }

  private Author resolveAuthor(String englishName) {
    return persistenceGateway
        .findAuthorByName(englishName)
        .orElseGet(() -> persistenceGateway.createAuthor(englishName));
  }

  private void recordOutcome(PageOutcome outcome) {
    if (outcome.isSkipped()) {
      log.debug("Skipped page '{}': {}", outcome.title(), outcome.skipReason());
      meterRegistry
          .counter(
              "ingestion.pages.skipped",
              "reason",
              outcome.skipReason().name().toLowerCase(Locale.ROOT))
          .increment();
    } else {
      meterRegistry.counter("ingestion.pages.processed").increment();
    }
  }

  /** Writes the checkpoint of a failed run; a failure here must not hide the page failure. */
  private void saveCheckpointQuietly(Path dump, String knownChecksum, String pageTitle) {
    try {
      String checksum = knownChecksum != null ? knownChecksum : checkpointStore.computeChecksum(dump);
      checkpointStore.save(dump, Checkpoint.at(checksum, pageTitle));
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to save checkpoint of {} at page '{}'", dump, pageTitle, e);
    }
  }
}
