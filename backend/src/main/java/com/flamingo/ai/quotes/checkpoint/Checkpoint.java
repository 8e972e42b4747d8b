package com.flamingo.ai.quotes.checkpoint;

import java.time.Instant;

/**
 * Resume point of an interrupted ingestion run.
 *
 * @param createdAt when the checkpoint was written
 * @param dumpChecksum checksum of the dump the checkpoint belongs to
 * @param lastPageTitle title of the page that was being processed; the next run starts there
 */
public record Checkpoint(Instant createdAt, String dumpChecksum, String lastPageTitle) {

  public static Checkpoint at(String dumpChecksum, String lastPageTitle) {
    return new Checkpoint(Instant.now(), dumpChecksum, lastPageTitle);
  }
}
