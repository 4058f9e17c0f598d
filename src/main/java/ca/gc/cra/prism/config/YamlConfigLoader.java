package ca.gc.cra.prism.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads pipeline configuration from YAML and flattens it into dotted keys.
 * <p>The {@code common} section is applied first, then the named profile section overrides it. Nested
 * mappings become dotted keys ({@code reasoner: {model: x}} becomes {@code reasoner.model=x}).</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges {@code common} with the {@code profile} section.
   *
   * @param path location of the YAML configuration
   * @param profile profile section name, matched case-insensitively
   * @return flat merged map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(merge(new Yaml(new SafeConstructor(new LoaderOptions())).load(reader), profile));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  /**
   * Loads {@code path} and builds a {@link PipelineConfig}, using defaults when the file is absent.
   *
   * @param path location of the YAML configuration
   * @param profile profile section name
   * @return validated configuration
   * @throws IOException when the file cannot be read
   */
  public static PipelineConfig loadPipelineConfig(Path path, String profile) throws IOException {
    return PipelineConfig.fromMap(load(path, profile).orElse(Map.of()));
  }

  private static Map<String, String> merge(Object document, String profile) {
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = section(root, COMMON_SECTION);
    if (common != null) {
      flatten(asMap(common, COMMON_SECTION), "", flattened);
    }
    String normalized = profile.trim().toLowerCase(Locale.ROOT);
    Object selected = section(root, normalized);
    if (selected != null) {
      flatten(asMap(selected, normalized), "", flattened);
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    }
  }
}
