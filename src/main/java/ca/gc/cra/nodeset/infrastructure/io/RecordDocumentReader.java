package ca.gc.cra.nodeset.infrastructure.io;

import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Reads configuration records from a YAML document.
 *
 * <p>The document is a sequence of mappings. Each mapping becomes one {@link ConfigRecord}; a property
 * value is either a scalar (one value) or a sequence of scalars (several values, order kept). Plain
 * scalars are never typed: {@code 010}, {@code yes} and {@code 1.50} are kept as written. An empty value
 * becomes an empty string and an empty document yields no records.</p>
 *
 * @since 0.1.0
 */
public final class RecordDocumentReader {
  private static final Logger log = LoggerFactory.getLogger(RecordDocumentReader.class);

  /**
   * Reads all records from {@code path}.
   *
   * @param path UTF-8 YAML document
   * @return records in document order
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a sequence of mappings
   */
  public List<ConfigRecord> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      List<ConfigRecord> records = read(reader, path.toString());
      log.debug("Read {} record(s) from {}", records.size(), path);
      return records;
    }
  }

  /**
   * Reads all records from an in-memory YAML document.
   *
   * @param yaml document text
   * @return records in document order
   * @throws IllegalArgumentException when the document is not a sequence of mappings
   */
  public List<ConfigRecord> read(String yaml) {
    Objects.requireNonNull(yaml, "yaml");
    return read(new StringReader(yaml), "<inline>");
  }

  private List<ConfigRecord> read(Reader reader, String source) {
    Object document;
    try {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse record document " + source, ex);
    }
    if (document == null) {
      return List.of();
    }
    if (!(document instanceof List<?> items)) {
      throw new IllegalArgumentException("Record document " + source + " must be a sequence of mappings");
    }
    List<ConfigRecord> records = new ArrayList<>(items.size());
    int index = 0;
    for (Object item : items) {
      records.add(toRecord(item, source, index++));
    }
    return records;
  }

  private static Yaml newYaml() {
    LoaderOptions loaderOptions = new LoaderOptions();
    DumperOptions dumperOptions = new DumperOptions();
    return new Yaml(
        new SafeConstructor(loaderOptions),
        new Representer(dumperOptions),
        dumperOptions,
        loaderOptions,
        new RawScalarResolver());
  }

  private static ConfigRecord toRecord(Object item, String source, int index) {
    if (!(item instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(
          "Record #" + index + " in " + source + " must be a mapping");
    }
    ConfigRecord.Builder builder = ConfigRecord.builder();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(
            "Record #" + index + " in " + source + " contains a blank or non-string property name");
      }
      Object value = entry.getValue();
      if (value instanceof List<?> list) {
        builder.add(name);
        for (Object element : list) {
          builder.add(name, scalar(element, name, index, source));
        }
      } else {
        builder.add(name, scalar(value, name, index, source));
      }
    }
    return builder.build();
  }

  private static String scalar(Object value, String name, int index, String source) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      throw new IllegalArgumentException(
          "Property " + name + " of record #" + index + " in " + source + " must hold scalars");
    }
    return value.toString();
  }

  // Registers no implicit tags, so every plain scalar resolves to a string.
  private static final class RawScalarResolver extends Resolver {
    @Override
    protected void addImplicitResolvers() {}
  }
}
