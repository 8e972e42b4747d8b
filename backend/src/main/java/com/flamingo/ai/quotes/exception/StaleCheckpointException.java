package com.flamingo.ai.quotes.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a checkpoint cannot be trusted for resuming: the dump changed since the
 * checkpoint was written, or the page it points at is no longer in the dump.
 */
public class StaleCheckpointException extends RuntimeException {

  private final Path dumpPath;

  public StaleCheckpointException(Path dumpPath, String message) {
    super(message);
    this.dumpPath = dumpPath;
  }

  public static StaleCheckpointException checksumMismatch(
      Path dumpPath, String expectedChecksum, String actualChecksum) {
    return new StaleCheckpointException(
        dumpPath,
        String.format(
            "Dump %s does not match its checkpoint (checkpoint checksum %s, current %s). "
                + "Remove the checkpoint to start over.",
            dumpPath, expectedChecksum, actualChecksum));
  }

  public static StaleCheckpointException resumePageMissing(Path dumpPath, String pageTitle) {
    return new StaleCheckpointException(
        dumpPath,
        String.format(
            "Checkpoint of dump %s points at page '%s' which is not in the dump",
            dumpPath, pageTitle));
  }

  public Path getDumpPath() {
    return dumpPath;
  }
}
