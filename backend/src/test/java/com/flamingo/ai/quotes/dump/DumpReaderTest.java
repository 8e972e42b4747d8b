package com.flamingo.ai.quotes.dump;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.quotes.exception.DumpFormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DumpReaderTest {

  private static final String SITE_INFO =
      """
        <siteinfo>
          <sitename>Wikicitáty</sitename>
          <dbname>cswikiquote</dbname>
          <namespaces><namespace key="0" case="first-letter" /></namespaces>
        </siteinfo>
      """;

  @TempDir Path tempDir;

  private final DumpReader dumpReader = new DumpReader();

  @Test
  void shouldDecodePagesInDocumentOrder_whenDumpIsValid() throws IOException {
    // Given
    Path dump =
        write(
            "<mediawiki xmlns=\"http://www.mediawiki.org/xml/export-0.11/\">"
                + SITE_INFO
                + page("Karel Čapek", "== Citáty ==\n* Věta.")
                + "<page><title>Capek</title><redirect title=\"Karel Čapek\" />"
                + "<revision><text>#PŘESMĚRUJ [[Karel Čapek]]</text></revision></page>"
                + page("Jan Werich", "* Jiná věta.")
                + "</mediawiki>");

    // When
    Dump result = dumpReader.load(dump);

    // Then
    assertThat(result.languageAbbreviation()).isEqualTo("cs");
    assertThat(result.siteDatabaseName()).isEqualTo("cswikiquote");
    assertThat(result.pages())
        .extracting(DumpPage::title)
        .containsExactly("Karel Čapek", "Capek", "Jan Werich");
    assertThat(result.pages().get(0).redirect()).isFalse();
    assertThat(result.pages().get(0).rawContent()).isEqualTo("== Citáty ==\n* Věta.");
    assertThat(result.pages().get(1).redirect()).isTrue();
  }

  @Test
  void shouldUseLastRevision_whenPageHasSeveralRevisions() throws IOException {
    // Given
    Path dump =
        write(
            "<mediawiki>"
                + SITE_INFO
                + "<page><title>Seneca</title>"
                + "<revision><id>1</id><text>old</text></revision>"
                + "<revision><id>2</id><contributor><username>X</username></contributor>"
                + "<text>new</text></revision></page>"
                + "</mediawiki>");

    // When
    Dump result = dumpReader.load(dump);

    // Then
    assertThat(result.pages()).singleElement().extracting(DumpPage::rawContent).isEqualTo("new");
  }

  @Test
  void shouldUseEmptyContent_whenPageHasNoRevisionText() throws IOException {
    // Given
    Path dump = write("<mediawiki>" + SITE_INFO + "<page><title>Seneca</title></page></mediawiki>");

    // When
    Dump result = dumpReader.load(dump);

    // Then
    assertThat(result.pages().get(0).rawContent()).isEmpty();
  }

  @Test
  void shouldThrowFormatError_whenDatabaseNameMissing() throws IOException {
    // Given
    Path dump =
        write("<mediawiki><siteinfo><sitename>X</sitename></siteinfo>" + page("A", "") + "</mediawiki>");

    // When / Then
    assertThatThrownBy(() -> dumpReader.load(dump))
        .isInstanceOf(DumpFormatException.class)
        .hasMessageContaining("dbname");
  }

  @Test
  void shouldThrowFormatError_whenNoPages() throws IOException {
    // Given
    Path dump = write("<mediawiki>" + SITE_INFO + "</mediawiki>");

    // When / Then
    assertThatThrownBy(() -> dumpReader.load(dump))
        .isInstanceOf(DumpFormatException.class)
        .hasMessageContaining("no <page>");
  }

  @Test
  void shouldThrowFormatError_whenRootIsNotMediawiki() throws IOException {
    // Given
    Path dump = write("<feed>" + SITE_INFO + page("A", "") + "</feed>");

    // When / Then
    assertThatThrownBy(() -> dumpReader.load(dump))
        .isInstanceOf(DumpFormatException.class)
        .hasMessageContaining("<mediawiki>");
  }

  @Test
  void shouldThrowFormatError_whenXmlIsTruncated() throws IOException {
    // Given
    Path dump = write("<mediawiki>" + SITE_INFO + "<page><title>A</title><revision><text>x");

    // When / Then
    assertThatThrownBy(() -> dumpReader.load(dump)).isInstanceOf(DumpFormatException.class);
  }

  @Test
  void shouldThrowFormatError_whenPageHasNoTitle() throws IOException {
    // Given
    Path dump =
        write(
            "<mediawiki>"
                + SITE_INFO
                + "<page><revision><text>x</text></revision></page></mediawiki>");

    // When / Then
    assertThatThrownBy(() -> dumpReader.load(dump))
        .isInstanceOf(DumpFormatException.class)
        .hasMessageContaining("<title>");
  }

  @Test
  void shouldThrowIoError_whenFileMissing() {
    assertThatThrownBy(() -> dumpReader.load(tempDir.resolve("missing.xml")))
        .isInstanceOf(NoSuchFileException.class);
  }

  private Path write(String xml) throws IOException {
    Path dump = tempDir.resolve("cswikiquote-pages.xml");
    Files.writeString(dump, xml);
    return dump;
  }

  private static String page(String title, String text) {
    return "<page><title>" + title + "</title><ns>0</ns><revision><text xml:space=\"preserve\">"
        + text + "</text></revision></page>";
  }
}
