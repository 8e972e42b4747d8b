package com.flamingo.ai.quotes.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WikitextCleanerTest {

  @Test
  void shouldResolveLinksToTheirLabels() {
    assertThat(WikitextCleaner.clean("Read [[Bible|the Book]] and [[Hamlet]]."))
        .isEqualTo("Read the Book and Hamlet.");
  }

  @Test
  void shouldKeepOnlyLastLabel_ofLinkWithOptions() {
    assertThat(WikitextCleaner.clean("Text [[Soubor:x.jpg|náhled|Popis]] end."))
        .isEqualTo("Text Popis end.");
  }

  @Test
  void shouldDropReferencesCommentsAndTemplates() {
    assertThat(
            WikitextCleaner.clean(
                "Carpe diem.<ref name=\"o\">Odes, I, 11</ref><!-- check -->{{Cite|a={{b}}}}"))
        .isEqualTo("Carpe diem.");
  }

  @Test
  void shouldStripEmphasisAndTags() {
    assertThat(WikitextCleaner.clean("'''Vidi''' ''vici''<br/>now <span>here</span>"))
        .isEqualTo("Vidi vici now here");
  }

  @Test
  void shouldKeepExternalLinkLabel() {
    assertThat(WikitextCleaner.clean("See [https://example.org the site]."))
        .isEqualTo("See the site.");
  }

  @Test
  void shouldDropTrailingAttribution_afterTerminalPunctuation() {
    assertThat(WikitextCleaner.clean("Kdo jinému jámu kopá, sám do ní padá. – lidové"))
        .isEqualTo("Kdo jinému jámu kopá, sám do ní padá.");
  }

  @Test
  void shouldKeepDashInsideSentence() {
    assertThat(WikitextCleaner.clean("War – what is it good for"))
        .isEqualTo("War – what is it good for");
  }
}
