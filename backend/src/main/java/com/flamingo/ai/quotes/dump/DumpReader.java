package com.flamingo.ai.quotes.dump;

import com.flamingo.ai.quotes.exception.DumpFormatException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads MediaWiki XML export files.
 *
 * <p>The whole page list is materialised; only the elements the pipeline needs are kept (site
 * database name, page title, redirect flag and the text of the last revision).
 */
@Component
@Slf4j
public class DumpReader {

  private static final XMLInputFactory XML_INPUT_FACTORY = createInputFactory();

  /**
   * Decodes a dump file.
   *
   * @param dumpPath the dump file
   * @return the decoded dump
   * @throws IOException if the file cannot be read
   * @throws DumpFormatException if the file is not a usable MediaWiki export
   */
  public Dump load(Path dumpPath) throws IOException {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(dumpPath))) {
      XMLStreamReader reader = XML_INPUT_FACTORY.createXMLStreamReader(in);
      try {
        Dump dump = readDump(reader, dumpPath);
        log.info(
            "Decoded dump {} ({}): {} pages",
            dumpPath,
            dump.siteDatabaseName(),
            dump.pages().size());
        return dump;
      } finally {
        reader.close();
      }
    } catch (XMLStreamException e) {
      throw new DumpFormatException(dumpPath, "malformed XML: " + e.getMessage(), e);
    }
  }

  private Dump readDump(XMLStreamReader reader, Path dumpPath) throws XMLStreamException {
    if (!nextStartElement(reader) || !"mediawiki".equals(reader.getLocalName())) {
      throw new DumpFormatException(dumpPath, "missing <mediawiki> root element");
    }

    String dbName = null;
    List<DumpPage> pages = new ArrayList<>();
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.END_ELEMENT) {
        break;
      }
      if (event != XMLStreamConstants.START_ELEMENT) {
        continue;
      }
      switch (reader.getLocalName()) {
        case "siteinfo" -> dbName = readDatabaseName(reader);
        case "page" -> pages.add(readPage(reader, dumpPath, pages.size()));
        default -> skipElement(reader);
      }
    }

    if (dbName == null || dbName.isBlank() || dbName.strip().length() < 2) {
      throw new DumpFormatException(dumpPath, "missing or invalid <siteinfo>/<dbname>");
    }
    if (pages.isEmpty()) {
      throw new DumpFormatException(dumpPath, "no <page> elements");
    }
    String siteDatabaseName = dbName.strip();
    String abbreviation = siteDatabaseName.substring(0, 2).toLowerCase(Locale.ROOT);
    return new Dump(abbreviation, siteDatabaseName, pages);
  }

  private String readDatabaseName(XMLStreamReader reader) throws XMLStreamException {
    String dbName = null;
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.END_ELEMENT) {
        return dbName;
      }
      if (event != XMLStreamConstants.START_ELEMENT) {
        continue;
      }
      if ("dbname".equals(reader.getLocalName())) {
        dbName = reader.getElementText();
      } else {
        skipElement(reader);
      }
    }
    return dbName;
  }

  private DumpPage readPage(XMLStreamReader reader, Path dumpPath, int index)
      throws XMLStreamException {
    String title = null;
    boolean redirect = false;
    String content = "";
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.END_ELEMENT) {
        break;
      }
      if (event != XMLStreamConstants.START_ELEMENT) {
        continue;
      }
      switch (reader.getLocalName()) {
        case "title" -> title = reader.getElementText();
        case "redirect" -> {
          redirect = true;
          skipElement(reader);
        }
        case "revision" -> content = readRevisionText(reader);
        default -> skipElement(reader);
      }
    }
    if (title == null || title.isBlank()) {
      throw new DumpFormatException(dumpPath, "page #" + (index + 1) + " has no <title>");
    }
    return new DumpPage(title, redirect, content);
  }

  private String readRevisionText(XMLStreamReader reader) throws XMLStreamException {
    String text = "";
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.END_ELEMENT) {
        return text;
      }
      if (event != XMLStreamConstants.START_ELEMENT) {
        continue;
      }
      if ("text".equals(reader.getLocalName())) {
        text = reader.getElementText();
      } else {
        skipElement(reader);
      }
    }
    return text;
  }

  private static boolean nextStartElement(XMLStreamReader reader) throws XMLStreamException {
    while (reader.hasNext()) {
      if (reader.next() == XMLStreamConstants.START_ELEMENT) {
        return true;
      }
    }
    return false;
  }

  /** Skips the current element with everything inside it; the reader must be on its start tag. */
  private static void skipElement(XMLStreamReader reader) throws XMLStreamException {
    int depth = 1;
    while (depth > 0 && reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.START_ELEMENT) {
        depth++;
      } else if (event == XMLStreamConstants.END_ELEMENT) {
        depth--;
      }
    }
  }

  private static XMLInputFactory createInputFactory() {
    XMLInputFactory factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    return factory;
  }
}
