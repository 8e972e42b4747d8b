package com.flamingo.ai.quotes.exception;

import java.nio.file.Path;

/** Exception thrown when a dump file is not a well-formed MediaWiki export. */
public class DumpFormatException extends RuntimeException {

  private final Path dumpPath;

  public DumpFormatException(Path dumpPath, String message) {
    super("Invalid dump " + dumpPath + ": " + message);
    this.dumpPath = dumpPath;
  }

  public DumpFormatException(Path dumpPath, String message, Throwable cause) {
    super("Invalid dump " + dumpPath + ": " + message, cause);
    this.dumpPath = dumpPath;
  }

  public Path getDumpPath() {
    return dumpPath;
  }
}
