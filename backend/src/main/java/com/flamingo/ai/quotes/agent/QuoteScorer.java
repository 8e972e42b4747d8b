package com.flamingo.ai.quotes.agent;

import com.flamingo.ai.quotes.agent.dto.ParsedQuote;
import com.flamingo.ai.quotes.agent.dto.ScoreResult;
import com.flamingo.ai.quotes.exception.MalformedModelResponseException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Scores a candidate quotation from 0 to 100 and returns a single clean rendering of it.
 *
 * <p>A response cut off by the output token limit scores 0 and is not retried.
 */
@Component
@Slf4j
public class QuoteScorer {

  static final String OPERATION = "quote-scoring";

  private static final String SYSTEM_PROMPT =
      """
      You are an international expert on quotations. You receive quotations in different
      languages in the form  Author: "text"  and score how correct and how valuable to society
      each one is with a single integer from 0 to 100. Judge the value by how well known the
      quotation (or a variant of it in another language) is, and penalize very long quotations,
      which people tend to skip.

      Answer with a JSON object with two properties:
      - score: the integer score.
      - cleanQuote: the quotation without variants in other languages and without any text that
        is not part of what the author said; an empty string when the score is 0.

      A typical input:
      <input>Oscar Wilde: "Be yourself; everyone else is already taken."</input>
      <output>{"score":95,"cleanQuote":"Be yourself; everyone else is already taken."}</output>

      Text shaped like a quotation that the author never said, such as a citation or a
      description, scores 0:
      <input>Dante Alighieri: "Libri iii, Caput XIII, (XV.) emendati Johann Heinrich F. Karl \
      Witte (1874) p. 25. Translation as quoted by Hannah Arendt, The Human Condition (1958), \
      p. 175."</input>
      <output>{"score":0,"cleanQuote":""}</output>

      Remove translations and other additions:
      <input>Lucius Annaeus Seneca: "Svolného osud vede, zpurného vleče. (Volentem fata ducunt, \
      nolentem trahunt.)"</input>
      <output>{"score":92,"cleanQuote":"Svolného osud vede, zpurného vleče."}</output>
      """;

  private static final ResponseFormat RESPONSE_FORMAT =
      ResponseFormat.builder()
          .type(ResponseFormatType.JSON)
          .jsonSchema(
              JsonSchema.builder()
                  .name("quote_scoring_schema")
                  .rootElement(
                      JsonObjectSchema.builder()
                          .addIntegerProperty("score", "Quote score from 0 to 100.")
                          .addStringProperty(
                              "cleanQuote", "The cleaned quote, empty when the score is 0.")
                          .required("score", "cleanQuote")
                          .additionalProperties(false)
                          .build())
                  .build())
          .build();

  private final ChatModel chatModel;
  private final StructuredResponseDecoder responseDecoder;
  private final ClassificationRetryPolicy retryPolicy;

  public QuoteScorer(
      @Qualifier("scorerChatModel") ChatModel chatModel,
      StructuredResponseDecoder responseDecoder,
      ClassificationRetryPolicy retryPolicy) {
    this.chatModel = chatModel;
    this.responseDecoder = responseDecoder;
    this.retryPolicy = retryPolicy;
  }

  /**
   * Scores one candidate.
   *
   * @param authorName canonical English name of the author
   * @param candidateText the candidate as found on the page
   * @return the score and the cleaned text
   * @throws com.flamingo.ai.quotes.exception.ClassificationException when every attempt failed
   */
  public ParsedQuote score(String authorName, String candidateText) {
    ParsedQuote parsed =
        retryPolicy.execute(OPERATION, () -> requestScore(authorName, candidateText));
    log.debug("Scored {} for {}: {}", parsed.score(), authorName, candidateText);
    return parsed;
  }

  private ParsedQuote requestScore(String authorName, String candidateText) {
    ChatRequest request =
        ChatRequest.builder()
            .messages(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from(authorName + ": \"" + candidateText + "\""))
            .parameters(ChatRequestParameters.builder().responseFormat(RESPONSE_FORMAT).build())
            .build();
    ChatResponse response = chatModel.chat(request);

    if (response != null && response.finishReason() == FinishReason.LENGTH) {
      log.debug("Scoring output truncated, rejecting candidate by {}", authorName);
      return ParsedQuote.rejected();
    }

    ScoreResult result = responseDecoder.decode(response, ScoreResult.class);
    Integer score = result.score();
    if (score == null || score < 0 || score > 100) {
      throw new MalformedModelResponseException("Score out of range 0-100: " + score);
    }
    String cleanQuote = result.cleanQuote();
    if (cleanQuote != null) {
      cleanQuote = cleanQuote.strip();
    }
    return new ParsedQuote(score, cleanQuote == null || cleanQuote.isEmpty() ? null : cleanQuote);
  }
}
