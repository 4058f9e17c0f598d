package ca.gc.cra.prism.infrastructure.reasoner;

import ca.gc.cra.prism.application.json.JsonTree;
import ca.gc.cra.prism.application.port.GenerateOptions;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes chat-completion requests and extracts the generated text from responses.
 * <p>Wire format is the OpenAI-compatible {@code /v1/chat/completions} schema: a {@code system} and a
 * {@code user} message in, {@code choices[0].message.content} out.</p>
 */
final class ChatCompletionCodec {
  private final JsonFactory factory = new JsonFactory();
  private final JsonTree tree = new JsonTree(factory);

  /**
   * Serializes a request body.
   *
   * @param model model identifier
   * @param prompt user prompt
   * @param options system prompt and sampling parameters
   * @return JSON document
   */
  String encodeRequest(String model, String prompt, GenerateOptions options) {
    StringWriter out = new StringWriter();
    try (JsonGenerator json = factory.createGenerator(out)) {
      json.writeStartObject();
      json.writeStringField("model", model);
      json.writeArrayFieldStart("messages");
      writeMessage(json, "system", options.systemPrompt());
      writeMessage(json, "user", prompt);
      json.writeEndArray();
      json.writeNumberField("max_tokens", options.maxOutputTokens());
      json.writeNumberField("temperature", options.temperature());
      json.writeBooleanField("stream", false);
      json.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to encode chat completion request", ex);
    }
    return out.toString();
  }

  private static void writeMessage(JsonGenerator json, String role, String content) throws IOException {
    json.writeStartObject();
    json.writeStringField("role", role);
    json.writeStringField("content", content);
    json.writeEndObject();
  }

  /**
   * Extracts {@code choices[0].message.content} from a response body.
   *
   * @param body JSON response
   * @return generated text
   * @throws IllegalArgumentException when the body is not JSON or lacks the content field
   */
  String decodeContent(String body) {
    Map<String, Object> object = tree.parseObject(Objects.requireNonNull(body, "body"));
    if (object.get("error") instanceof Map<?, ?> error && error.get("message") != null) {
      throw new IllegalArgumentException("reasoner error: " + error.get("message"));
    }
    if (!(object.get("choices") instanceof List<?> choices) || choices.isEmpty()) {
      throw new IllegalArgumentException("response has no choices");
    }
    if (!(choices.get(0) instanceof Map<?, ?> choice)
        || !(choice.get("message") instanceof Map<?, ?> message)
        || !(message.get("content") instanceof String content)) {
      throw new IllegalArgumentException("response choice has no message content");
    }
    return content;
  }
}
