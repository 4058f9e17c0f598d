package ca.gc.cra.prism.infrastructure.reasoner;

import ca.gc.cra.prism.application.port.CancellationToken;
import ca.gc.cra.prism.application.port.GenerateOptions;
import ca.gc.cra.prism.application.port.ReasonerException;
import ca.gc.cra.prism.application.port.ReasonerPort;
import ca.gc.cra.prism.logging.Logs;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ReasonerPort} calling an OpenAI-compatible chat-completions endpoint.
 * <p><strong>Why:</strong> Most hosted and local text generators expose this schema, so one adapter
 * covers them.</p>
 * <p><strong>Cancellation:</strong> The call is sent asynchronously and the cancellation token is polled
 * while waiting; a fired token cancels the exchange and raises {@link ReasonerException}.</p>
 * <p><strong>Thread-safety:</strong> {@link HttpClient} is shared and thread-safe.</p>
 * <p><strong>Observability:</strong> Logs request failures at DEBUG with truncated bodies; the API key is
 * never logged.</p>
 *
 * @since 0.1.0
 */
public final class HttpReasonerAdapter implements ReasonerPort {
  private static final Logger log = LoggerFactory.getLogger(HttpReasonerAdapter.class);
  private static final long CANCEL_POLL_MILLIS = 50L;
  private static final int LOG_BODY_BYTES = 512;

  private final ReasonerSettings settings;
  private final HttpClient http;
  private final ChatCompletionCodec codec = new ChatCompletionCodec();

  public HttpReasonerAdapter(ReasonerSettings settings) {
    this(settings, HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(Objects.requireNonNull(settings, "settings").requestTimeout())
        .build());
  }

  HttpReasonerAdapter(ReasonerSettings settings, HttpClient http) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.http = Objects.requireNonNull(http, "http");
    log.info("HTTP reasoner targeting {} with model {} (apiKey={})",
        settings.completionsUri(), settings.model(), Logs.redact(settings.apiKey()));
  }

  @Override
  public String generate(CancellationToken cancellation, String prompt, GenerateOptions options)
      throws ReasonerException {
    Objects.requireNonNull(cancellation, "cancellation");
    Objects.requireNonNull(prompt, "prompt");
    Objects.requireNonNull(options, "options");
    if (cancellation.isCancellationRequested()) {
      throw new ReasonerException("generation cancelled before request");
    }
    HttpRequest request = buildRequest(codec.encodeRequest(settings.model(), prompt, options));
    HttpResponse<String> response = await(http.sendAsync(request, HttpResponse.BodyHandlers.ofString()), cancellation);

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String body = Logs.truncate(response.body(), LOG_BODY_BYTES);
      log.debug("Reasoner returned HTTP {}: {}", status, body);
      throw new ReasonerException("HTTP " + status + " from reasoner: " + body);
    }
    try {
      return codec.decodeContent(response.body());
    } catch (IllegalArgumentException ex) {
      throw new ReasonerException("malformed reasoner response: " + ex.getMessage(), ex);
    }
  }

  private HttpRequest buildRequest(String body) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(settings.completionsUri())
        .timeout(settings.requestTimeout())
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body));
    if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + settings.apiKey());
    }
    return builder.build();
  }

  private static HttpResponse<String> await(
      CompletableFuture<HttpResponse<String>> future, CancellationToken cancellation) throws ReasonerException {
    while (true) {
      try {
        return future.get(CANCEL_POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (TimeoutException ex) {
        if (cancellation.isCancellationRequested()) {
          future.cancel(true);
          throw new ReasonerException("generation cancelled");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        future.cancel(true);
        throw new ReasonerException("interrupted while waiting for reasoner", ex);
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof HttpTimeoutException) {
          throw new ReasonerException("reasoner request timed out", cause);
        }
        log.debug("Reasoner request failed", cause);
        throw new ReasonerException("reasoner request failed: " + cause, cause);
      }
    }
  }
}
