package com.flamingo.ai.quotes.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reduces a line of wikitext to the plain text a reader would see. */
final class WikitextCleaner {

  private static final Pattern COMMENT = Pattern.compile("(?s)<!--.*?-->");
  private static final Pattern REF =
      Pattern.compile("(?is)<ref\\b[^>]*/>|<ref\\b[^>]*>.*?</ref>");
  private static final Pattern INNERMOST_TEMPLATE = Pattern.compile("\\{\\{[^{}]*\\}\\}");
  private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[(?:[^\\]]*\\|)?([^\\]|]*)\\]\\]");
  private static final Pattern EXTERNAL_LINK =
      Pattern.compile("\\[(?:https?:)?//[^\\s\\]]+\\s*([^\\]]*)\\]");
  private static final Pattern TAG = Pattern.compile("</?[a-zA-Z][^>]*>");
  private static final Pattern EMPHASIS = Pattern.compile("'{2,}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_ATTRIBUTION =
      Pattern.compile("^(.*[.!?…\"“”»)])\\s+[–—]\\s+.+$");

  private WikitextCleaner() {}

  static String clean(String wikitext) {
    String text = COMMENT.matcher(wikitext).replaceAll("");
    text = REF.matcher(text).replaceAll("");
    text = removeTemplates(text);
    text = WIKI_LINK.matcher(text).replaceAll("$1");
    text = EXTERNAL_LINK.matcher(text).replaceAll("$1");
    text = TAG.matcher(text).replaceAll("");
    text = EMPHASIS.matcher(text).replaceAll("");
    text = text.replace("&nbsp;", " ").replace("&amp;", "&");
    text = WHITESPACE.matcher(text).replaceAll(" ").strip();

    Matcher attribution = TRAILING_ATTRIBUTION.matcher(text);
    if (attribution.matches()) {
      text = attribution.group(1).strip();
    }
    return text;
  }

  /** Removes templates innermost first so nested ones disappear entirely. */
  private static String removeTemplates(String text) {
    String previous;
    do {
      previous = text;
      text = INNERMOST_TEMPLATE.matcher(text).replaceAll("");
    } while (!text.equals(previous));
    return text;
  }
}
