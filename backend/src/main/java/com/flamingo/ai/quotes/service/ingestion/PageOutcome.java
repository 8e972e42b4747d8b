package com.flamingo.ai.quotes.service.ingestion;

/**
 * Result of processing one page.
 *
 * @param title the page title
 * @param skipReason why the page was skipped, or null if its quotes were stored
 * @param quotesSaved number of quotes stored for the page
 */
public record PageOutcome(String title, SkipReason skipReason, int quotesSaved) {

  public static PageOutcome processed(String title, int quotesSaved) {
    return new PageOutcome(title, null, quotesSaved);
  }

  public static PageOutcome skipped(String title, SkipReason reason) {
    return new PageOutcome(title, reason, 0);
  }

  public boolean isSkipped() {
    return skipReason != null;
  }
}
