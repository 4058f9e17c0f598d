package ca.gc.cra.prism.infrastructure.reasoner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.GenerateOptions;
import org.junit.jupiter.api.Test;

class ChatCompletionCodecTest {
  private final ChatCompletionCodec codec = new ChatCompletionCodec();

  @Test
  void encodesEscapedPromptText() {
    String json = codec.encodeRequest("m", "line one\n\"quoted\"", new GenerateOptions("sys", 300, 0.7d));

    assertTrue(json.contains("\"content\":\"line one\\n\\\"quoted\\\"\""), json);
    assertTrue(json.contains("\"temperature\":0.7"), json);
  }

  @Test
  void decodesFirstChoiceAndIgnoresExtraFields() {
    String body = "{\"usage\":{\"total_tokens\":12},\"choices\":["
        + "{\"message\":{\"content\":\"first\"},\"logprobs\":null},"
        + "{\"message\":{\"content\":\"second\"}}]}";

    assertEquals("first", codec.decodeContent(body));
  }

  @Test
  void errorObjectIsReported() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> codec.decodeContent("{\"error\":{\"message\":\"context length exceeded\"}}"));
    assertEquals("reasoner error: context length exceeded", ex.getMessage());
  }

  @Test
  void rejectsNonObjectAndBrokenJson() {
    assertThrows(IllegalArgumentException.class, () -> codec.decodeContent("[]"));
    assertThrows(IllegalArgumentException.class, () -> codec.decodeContent("{\"choices\":"));
    assertThrows(IllegalArgumentException.class, () -> codec.decodeContent(""));
    assertThrows(IllegalArgumentException.class,
        () -> codec.decodeContent("{\"choices\":[{\"message\":{\"content\":42}}]}"));
  }
}
