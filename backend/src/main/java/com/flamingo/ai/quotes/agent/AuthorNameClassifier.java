package com.flamingo.ai.quotes.agent;

import com.flamingo.ai.quotes.agent.dto.ClassificationResult;
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
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Decides whether a page title names a person and, if so, returns the English form of the name.
 */
@Component
@Slf4j
public class AuthorNameClassifier {

  static final String OPERATION = "author-name-classification";

  private static final String SYSTEM_PROMPT =
      """
      You are a professional international linguist. Decide whether the given text, which may be in
      any language, is the name of a real human being or something else (a book, an object, a
      concept, a verb).

      Answer with a JSON object with two properties:
      - isHuman: boolean, true only if the text is a real person's name.
      - englishName: the English form of the name (the same name if it is already English) when
        isHuman is true, otherwise an empty string.

      Examples:
      <input>Winston Churchill</input>
      <output>{"isHuman":true,"englishName":"Winston Churchill"}</output>

      <input>Artur Şopenhauer</input>
      <output>{"isHuman":true,"englishName":"Arthur Schopenhauer"}</output>

      <input>Animal farm</input>
      <output>{"isHuman":false,"englishName":""}</output>
      """;

  private static final ResponseFormat RESPONSE_FORMAT =
      ResponseFormat.builder()
          .type(ResponseFormatType.JSON)
          .jsonSchema(
              JsonSchema.builder()
                  .name("name_normalizing_schema")
                  .rootElement(
                      JsonObjectSchema.builder()
                          .addBooleanProperty(
                              "isHuman", "Whether the text is a real human name.")
                          .addStringProperty(
                              "englishName",
                              "The English form of the name, or the same name if it is English.")
                          .required("isHuman", "englishName")
                          .additionalProperties(false)
                          .build())
                  .build())
          .build();

  private final ChatModel chatModel;
  private final StructuredResponseDecoder responseDecoder;
  private final ClassificationRetryPolicy retryPolicy;

  public AuthorNameClassifier(
      @Qualifier("classifierChatModel") ChatModel chatModel,
      StructuredResponseDecoder responseDecoder,
      ClassificationRetryPolicy retryPolicy) {
    this.chatModel = chatModel;
    this.responseDecoder = responseDecoder;
    this.retryPolicy = retryPolicy;
  }

  /**
   * Classifies a candidate author name.
   *
   * @param candidateName a page title
   * @return the canonical English name, or empty if the title does not name a person
   * @throws com.flamingo.ai.quotes.exception.ClassificationException when every attempt failed
   */
  public Optional<String> classify(String candidateName) {
    ClassificationResult result =
        retryPolicy.execute(OPERATION, () -> requestClassification(candidateName));
    if (!result.isHuman()) {
      log.debug("'{}' is not a person", candidateName);
      return Optional.empty();
    }
    String englishName = result.englishName().strip();
    log.debug("'{}' is a person: {}", candidateName, englishName);
    return Optional.of(englishName);
  }

  private ClassificationResult requestClassification(String candidateName) {
    ChatRequest request =
        ChatRequest.builder()
            .messages(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(candidateName))
            .parameters(ChatRequestParameters.builder().responseFormat(RESPONSE_FORMAT).build())
            .build();
    ChatResponse response = chatModel.chat(request);
    ClassificationResult result = responseDecoder.decode(response, ClassificationResult.class);

    if (result.isHuman() == null) {
      throw new MalformedModelResponseException("Classification is missing 'isHuman'");
    }
    if (result.isHuman() && (result.englishName() == null || result.englishName().isBlank())) {
      throw new MalformedModelResponseException(
          "Classification marks '" + candidateName + "' as human but has no englishName");
    }
    return result;
  }
}
