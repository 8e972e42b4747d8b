package com.flamingo.ai.quotes.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.quotes.exception.MalformedModelResponseException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Turns the JSON text of a chat response into a typed result. */
@Component
@RequiredArgsConstructor
public class StructuredResponseDecoder {

  private final ObjectMapper objectMapper;

  /**
   * Decodes the response text.
   *
   * @throws MalformedModelResponseException if the response has no text or the text is not JSON
   *     of the requested shape
   */
  public <T> T decode(ChatResponse response, Class<T> resultType) {
    AiMessage message = response == null ? null : response.aiMessage();
    String text = message == null ? null : message.text();
    if (text == null || text.isBlank()) {
      throw new MalformedModelResponseException("Model returned no text");
    }
    try {
      return objectMapper.readValue(text, resultType);
    } catch (JsonProcessingException e) {
      throw new MalformedModelResponseException(
          "Model returned invalid " + resultType.getSimpleName() + ": " + abbreviate(text), e);
    }
  }

  private static String abbreviate(String text) {
    return text.length() <= 200 ? text : text.substring(0, 200) + "...";
  }
}
