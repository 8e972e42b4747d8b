package com.flamingo.ai.quotes.dump;

import java.util.List;

/**
 * A decoded dump in document order.
 *
 * @param languageAbbreviation two-letter language code taken from the site database name
 * @param siteDatabaseName the site database name, e.g. {@code cswikiquote}
 * @param pages pages in the order they appear in the file
 */
public record Dump(String languageAbbreviation, String siteDatabaseName, List<DumpPage> pages) {

  public Dump {
    pages = List.copyOf(pages);
  }
}
