package com.flamingo.ai.quotes.service.ingestion;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/** Summary of one dump ingestion. */
public record IngestionReport(
    Path dumpPath,
    Status status,
    int pagesSeen,
    int pagesProcessed,
    Map<SkipReason, Integer> skippedByReason,
    int quotesSaved) {

  public enum Status {
    COMPLETED,
    ALREADY_DONE
  }

  public IngestionReport {
    skippedByReason = Map.copyOf(skippedByReason);
  }

  public static IngestionReport alreadyDone(Path dumpPath) {
    return new IngestionReport(dumpPath, Status.ALREADY_DONE, 0, 0, Map.of(), 0);
  }

  public int pagesSkipped() {
    return skippedByReason.values().stream().mapToInt(Integer::intValue).sum();
  }

  /** Accumulates page outcomes of a running ingestion. */
  static final class Tally {

    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
    private int pagesSeen;
    private int pagesProcessed;
    private int quotesSaved;

    void add(PageOutcome outcome) {
      pagesSeen++;
      if (outcome.isSkipped()) {
        skipped.merge(outcome.skipReason(), 1, Integer::sum);
      } else {
        pagesProcessed++;
        quotesSaved += outcome.quotesSaved();
      }
    }

    IngestionReport completed(Path dumpPath) {
      return new IngestionReport(
          dumpPath, Status.COMPLETED, pagesSeen, pagesProcessed, skipped, quotesSaved);
    }
  }
}
