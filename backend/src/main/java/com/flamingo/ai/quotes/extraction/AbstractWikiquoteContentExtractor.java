package com.flamingo.ai.quotes.extraction;

import com.flamingo.ai.quotes.agent.QuoteScorer;
import com.flamingo.ai.quotes.agent.dto.ParsedQuote;
import com.flamingo.ai.quotes.config.IngestionProperties;
import com.flamingo.ai.quotes.domain.entity.Author;
import com.flamingo.ai.quotes.domain.entity.Language;
import com.flamingo.ai.quotes.domain.entity.Quote;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Wikiquote page extraction shared by all languages. Subclasses only name their quotation
 * headings, namespace prefixes and main page.
 *
 * <p>A quotation section starts at a heading with one of the quotation heading names and runs to
 * the next heading of the same or a higher level. Its top-level list items are the candidates;
 * deeper items carry sources and notes.
 */
@Slf4j
public abstract class AbstractWikiquoteContentExtractor implements ContentExtractor {

  private static final Pattern HEADING = Pattern.compile("^(={2,6})\\s*(.+?)\\s*\\1\\s*$");
  private static final Pattern COMMENT = Pattern.compile("(?s)<!--.*?-->");
  private static final Pattern TOP_LEVEL_ITEM = Pattern.compile("^[*#](?![*#:;])(.*)$");

  private final QuoteScorer quoteScorer;
  private final IngestionProperties.Scoring scoring;
  private final MeterRegistry meterRegistry;
  private final Set<String> quotationHeadings;
  private final List<String> forbiddenPrefixes;

  protected AbstractWikiquoteContentExtractor(
      QuoteScorer quoteScorer, IngestionProperties properties, MeterRegistry meterRegistry) {
    this.quoteScorer = quoteScorer;
    this.scoring = properties.getScoring();
    this.meterRegistry = meterRegistry;
    this.quotationHeadings =
        quotationHeadings().stream().map(AbstractWikiquoteContentExtractor::normalize)
            .collect(Collectors.toUnmodifiableSet());
    this.forbiddenPrefixes =
        forbiddenPrefixes().stream().map(AbstractWikiquoteContentExtractor::normalize).toList();
  }

  /** Two-letter code of the language this extractor reads. */
  protected abstract String languageAbbreviation();

  /** Headings of sections holding the author's own quotations. */
  protected abstract Set<String> quotationHeadings();

  /** Namespace and administrative title prefixes, including the colon. */
  protected abstract List<String> forbiddenPrefixes();

  /** Title of the wiki's main page. */
  protected abstract String mainPageTitle();

  @Override
  public boolean supports(String languageAbbreviation) {
    return languageAbbreviation().equalsIgnoreCase(languageAbbreviation);
  }

  @Override
  public boolean isForbiddenPageName(String title) {
    String normalized = normalize(title);
    if (normalized.equals(normalize(mainPageTitle()))) {
      return true;
    }
    return forbiddenPrefixes.stream().anyMatch(normalized::startsWith);
  }

  @Override
  public List<Quote> extract(
      String pageUrl, String rawContent, Author author, Language language) {
    String authorName = author.getEnglishFullName();
    List<Quote> accepted = new ArrayList<>();
    for (String candidate : findCandidates(rawContent)) {
      if (candidate.length() > scoring.getMaxCandidateLength()) {
        log.debug("Candidate of {} too long to score ({} chars)", authorName, candidate.length());
        meterRegistry.counter("ingestion.quotes.rejected").increment();
        continue;
      }

      ParsedQuote parsed = quoteScorer.score(authorName, candidate);
      if (isAcceptable(parsed)) {
        accepted.add(
            Quote.builder()
                .text(parsed.cleanQuote())
                .source(pageUrl)
                .score(parsed.score())
                .author(author)
                .language(language)
                .build());
        meterRegistry.counter("ingestion.quotes.accepted").increment();
      } else {
        meterRegistry.counter("ingestion.quotes.rejected").increment();
      }
    }
    return accepted;
  }

  /**
   * Lists the cleaned candidate quotations of a page in page order.
   *
   * @param rawContent wikitext of the page, may be null
   * @return non-blank candidates
   */
  public List<String> findCandidates(String rawContent) {
    List<String> candidates = new ArrayList<>();
    if (rawContent == null || rawContent.isBlank()) {
      return candidates;
    }

    int sectionLevel = 0; // level of the open quotation heading, 0 when outside one
    String content = COMMENT.matcher(rawContent).replaceAll("");
    for (String line : content.split("\\R")) {
      Matcher heading = HEADING.matcher(line.strip());
      if (heading.matches()) {
        int level = heading.group(1).length();
        if (sectionLevel > 0 && level <= sectionLevel) {
          sectionLevel = 0;
        }
        if (sectionLevel == 0 && isQuotationHeading(heading.group(2))) {
          sectionLevel = level;
        }
        continue;
      }
      if (sectionLevel == 0) {
        continue;
      }

      Matcher item = TOP_LEVEL_ITEM.matcher(line);
      if (item.matches()) {
        String text = WikitextCleaner.clean(item.group(1));
        if (!text.isBlank()) {
          candidates.add(text);
        }
      }
    }
    return candidates;
  }

  boolean isAcceptable(ParsedQuote parsed) {
    return parsed.score() > scoring.getAcceptanceThreshold()
        && parsed.hasCleanQuote()
        && parsed.cleanQuote().length() <= scoring.getMaxCleanQuoteLength();
  }

  private boolean isQuotationHeading(String headingText) {
    return quotationHeadings.contains(normalize(WikitextCleaner.clean(headingText)));
  }

  private static String normalize(String text) {
    return text.strip().toLowerCase(Locale.ROOT);
  }
}
