package ca.gc.cra.prism.infrastructure.reasoner;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of the HTTP Reasoner.
 *
 * @param endpoint base URI or full {@code /chat/completions} URI
 * @param model model identifier sent with each request
 * @param apiKey bearer token, or {@code null} when the endpoint needs none
 * @param requestTimeout per-request timeout
 */
public record ReasonerSettings(URI endpoint, String model, String apiKey, Duration requestTimeout) {
  static final String COMPLETIONS_PATH = "/v1/chat/completions";

  public ReasonerSettings {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * Returns the URI requests are posted to, appending {@value #COMPLETIONS_PATH} to a base endpoint.
   *
   * @return completions URI
   */
  public URI completionsUri() {
    String raw = endpoint.toString();
    if (raw.endsWith("/chat/completions")) {
      return endpoint;
    }
    String base = raw.endsWith("/") ? raw.substring(0, raw.length() - 1) : raw;
    return URI.create(base + COMPLETIONS_PATH);
  }

  @Override
  public String toString() {
    return "ReasonerSettings[endpoint=" + endpoint + ", model=" + model + ", requestTimeout=" + requestTimeout + "]";
  }
}
