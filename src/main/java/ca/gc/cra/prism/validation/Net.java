package ca.gc.cra.prism.validation;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Endpoint validation for HTTP adapters and exporters.
 */
public final class Net {

  private Net() {
    // Utility
  }

  /**
   * Validates an absolute {@code http} or {@code https} URI with a host.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate URI text
   * @return parsed URI
   * @throws IllegalArgumentException if the URI is malformed, not HTTP(S) or has no host
   */
  public static URI requireHttpUri(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      URI uri = new URI(text);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(name + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(name + " must include a host");
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
  }
}
